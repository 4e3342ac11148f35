package org.javai.unions.check;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.function.IntPredicate;
import org.javai.unions.Failure;

/**
 * Named checks over numbers. Comparisons work on any {@link Comparable} value; sign checks
 * accept any {@link Number}. Default failures carry codes of the form {@code NumericError.*}.
 */
public final class NumericChecks {

    public static final Failure NOT_POSITIVE = Failure.validation("NumericError.NotPositive", "Value must be positive.");
    public static final Failure NOT_NEGATIVE = Failure.validation("NumericError.NotNegative", "Value must be negative.");
    public static final Failure NOT_ZERO = Failure.validation("NumericError.NotZero", "Value must be zero.");
    public static final Failure ZERO = Failure.validation("NumericError.Zero", "Value cannot be zero.");
    public static final Failure POSITIVE = Failure.validation("NumericError.Positive", "Value cannot be positive.");
    public static final Failure NEGATIVE = Failure.validation("NumericError.Negative", "Value cannot be negative.");

    private NumericChecks() {
        // Utility class
    }

    public static <N extends Comparable<? super N>> Check<N> greaterThan(N min) {
        Objects.requireNonNull(min, "min must not be null");
        return Check.of(v -> v.compareTo(min) > 0, tooSmall(min, false));
    }

    public static <N extends Comparable<? super N>> Check<N> greaterThanOrEqualTo(N min) {
        Objects.requireNonNull(min, "min must not be null");
        return Check.of(v -> v.compareTo(min) >= 0, tooSmall(min, true));
    }

    public static <N extends Comparable<? super N>> Check<N> lessThan(N max) {
        Objects.requireNonNull(max, "max must not be null");
        return Check.of(v -> v.compareTo(max) < 0, tooLarge(max, false));
    }

    public static <N extends Comparable<? super N>> Check<N> lessThanOrEqualTo(N max) {
        Objects.requireNonNull(max, "max must not be null");
        return Check.of(v -> v.compareTo(max) <= 0, tooLarge(max, true));
    }

    /**
     * Both bounds inclusive.
     */
    public static <N extends Comparable<? super N>> Check<N> inRange(N min, N max) {
        return inRange(min, true, max, true);
    }

    public static <N extends Comparable<? super N>> Check<N> inRange(N min, boolean minInclusive, N max, boolean maxInclusive) {
        Objects.requireNonNull(min, "min must not be null");
        Objects.requireNonNull(max, "max must not be null");
        return Check.of(v -> {
            int low = v.compareTo(min);
            int high = v.compareTo(max);
            return (minInclusive ? low >= 0 : low > 0) && (maxInclusive ? high <= 0 : high < 0);
        }, Failure.validation("NumericError.OutOfRange",
                "Value must be greater than " + orEqualTo(minInclusive) + min
                        + " and less than " + orEqualTo(maxInclusive) + max + "."));
    }

    public static Check<Number> positive() {
        return sign(sign -> sign > 0, NOT_POSITIVE);
    }

    public static Check<Number> negative() {
        return sign(sign -> sign < 0, NOT_NEGATIVE);
    }

    public static Check<Number> zero() {
        return sign(sign -> sign == 0, NOT_ZERO);
    }

    public static Check<Number> nonZero() {
        return sign(sign -> sign != 0, ZERO);
    }

    public static Check<Number> nonPositive() {
        return sign(sign -> sign <= 0, POSITIVE);
    }

    public static Check<Number> nonNegative() {
        return sign(sign -> sign >= 0, NEGATIVE);
    }

    /**
     * NaN has no sign and fails every sign check.
     */
    private static Check<Number> sign(IntPredicate accepted, Failure failure) {
        return Check.of(v -> !isNaN(v) && accepted.test(signum(v)), failure);
    }

    static int signum(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.signum();
        }
        if (value instanceof BigInteger integer) {
            return integer.signum();
        }
        if (value instanceof Double || value instanceof Float) {
            return (int) Math.signum(value.doubleValue());
        }
        return Long.signum(value.longValue());
    }

    private static boolean isNaN(Number value) {
        return (value instanceof Double || value instanceof Float) && Double.isNaN(value.doubleValue());
    }

    private static Failure tooSmall(Object min, boolean inclusive) {
        return Failure.validation("NumericError.TooSmall",
                "Value must be greater than " + orEqualTo(inclusive) + min + ".");
    }

    private static Failure tooLarge(Object max, boolean inclusive) {
        return Failure.validation("NumericError.TooLarge",
                "Value must be less than " + orEqualTo(inclusive) + max + ".");
    }

    private static String orEqualTo(boolean inclusive) {
        return inclusive ? "or equal to " : "";
    }
}
