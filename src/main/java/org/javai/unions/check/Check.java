package org.javai.unions.check;

import java.util.function.Predicate;
import org.javai.unions.Failure;

/**
 * A predicate that knows which {@link Failure} to report when it does not hold.
 *
 * <p>Checks plug into both deferred-validation builders: on the result path they
 * disqualify a value with {@link #failure()}, on the option path they are plain predicates.
 *
 * <pre>{@code
 * Result<String> name = Result.validate(input)
 *     .check(StringChecks.notBlank())
 *     .check(StringChecks.shorterThanOrEqualTo(64)
 *         .withFailure(Failure.validation("Customer.NameTooLong", "Name is too long")))
 *     .build();
 * }</pre>
 *
 * @param <T> the type of value checked
 */
public interface Check<T> extends Predicate<T> {

    /**
     * The failure reported when {@link #test} returns false.
     */
    Failure failure();

    /**
     * Returns a check with the same predicate that reports {@code failure} instead.
     */
    default Check<T> withFailure(Failure failure) {
        return of(this, failure);
    }

    static <T> Check<T> of(Predicate<? super T> predicate, Failure failure) {
        return new PredicateCheck<>(predicate, failure);
    }
}
