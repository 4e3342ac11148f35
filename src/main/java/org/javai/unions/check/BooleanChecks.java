package org.javai.unions.check;

import org.javai.unions.Failure;

public final class BooleanChecks {

    public static final Failure NOT_TRUE = Failure.validation("BooleanError.NotTrue", "The value must be true.");
    public static final Failure NOT_FALSE = Failure.validation("BooleanError.NotFalse", "The value must be false.");

    private BooleanChecks() {
        // Utility class
    }

    public static Check<Boolean> isTrue() {
        return Check.of(Boolean.TRUE::equals, NOT_TRUE);
    }

    public static Check<Boolean> isFalse() {
        return Check.of(Boolean.FALSE::equals, NOT_FALSE);
    }
}
