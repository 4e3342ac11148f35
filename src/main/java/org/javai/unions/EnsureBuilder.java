package org.javai.unions;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import org.javai.unions.check.Check;

/**
 * A value passing through a chain of named checks on its way back into a {@link Result}.
 *
 * <p>While <em>eligible</em> the builder carries the value and each check evaluates its
 * predicate. The first check that does not hold <em>disqualifies</em> the value with that
 * check's failure; later checks are no-ops and cannot replace it. A builder started from a
 * failed result is disqualified from the outset with the original failure.
 * {@link #build()} collapses the builder back into a result.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Result<Integer> age = Result.validate(form.age())
 *     .check(NumericChecks.nonNegative())
 *     .check(NumericChecks.lessThan(150))
 *     .build();
 * }</pre>
 *
 * <p>A builder is a transient view over the original value. Do not store it in a field,
 * return it, or pass it as an argument.
 *
 * @param <T> The type of the value under check
 */
public final class EnsureBuilder<T> {

    private final T value;
    private final Failure failure;

    private EnsureBuilder(T value, Failure failure) {
        this.value = value;
        this.failure = failure;
    }

    static <T> EnsureBuilder<T> from(Result<T> result) {
        Objects.requireNonNull(result, "result must not be null");
        return result.isSuccess()
                ? new EnsureBuilder<>(result.getValue(), null)
                : new EnsureBuilder<>(null, result.getFailure());
    }

    /**
     * Applies one check, disqualifying the value with {@code failure} if {@code predicate}
     * does not hold.
     */
    public EnsureBuilder<T> check(Predicate<? super T> predicate, Failure failure) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
        if (!isEligible() || predicate.test(value)) {
            return this;
        }
        return new EnsureBuilder<>(null, failure);
    }

    /**
     * Applies a named check, disqualifying the value with the check's failure.
     */
    public EnsureBuilder<T> check(Check<? super T> check) {
        Objects.requireNonNull(check, "check must not be null");
        return check(check, check.failure());
    }

    public boolean isEligible() {
        return failure == null;
    }

    public Result<T> build() {
        return isEligible() ? Result.success(value) : Result.failure(failure);
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return build().map(mapper);
    }

    public <U> Result<U> bind(Function<? super T, ? extends Result<U>> binder) {
        return build().bind(binder);
    }

    /**
     * Collapses the builder and continues with {@code next}, accumulating failures.
     *
     * @see Result#bindAll(Result)
     */
    public <U> Result<U> bindAll(Result<U> next) {
        return build().bindAll(next);
    }
}
