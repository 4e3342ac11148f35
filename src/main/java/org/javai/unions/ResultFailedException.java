package org.javai.unions;

/**
 * Thrown when the value of a failed {@link Result} is demanded, or when
 * {@code throwIfFailure()} is called on a failure without a custom exception selector.
 * This is an unchecked exception because it marks a deliberate "crash here" decision by
 * the caller; normal control flow should match or fold the result instead.
 */
public class ResultFailedException extends RuntimeException {

    private final Failure failure;

    public ResultFailedException(Failure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
