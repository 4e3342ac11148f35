package org.javai.unions;

import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * A condition paired with the failure to report when it does not hold.
 * The condition is evaluated lazily, by {@link UnitResults#ensure(Requirement...)} or
 * {@link UnitResults#ensureAll(Requirement...)}.
 *
 * @param condition the condition to evaluate
 * @param failure the failure reported when the condition is false
 */
public record Requirement(BooleanSupplier condition, Failure failure) {

    public Requirement {
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(failure, "failure must not be null");
    }

    public static Requirement of(BooleanSupplier condition, Failure failure) {
        return new Requirement(condition, failure);
    }

    /**
     * A requirement whose condition is already known.
     */
    public static Requirement of(boolean holds, Failure failure) {
        return new Requirement(() -> holds, failure);
    }

    public boolean holds() {
        return condition.getAsBoolean();
    }
}
