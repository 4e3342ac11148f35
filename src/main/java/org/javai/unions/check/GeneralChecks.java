package org.javai.unions.check;

import java.util.Objects;
import org.javai.unions.Failure;

/**
 * Named equality checks for values of any type. {@link #NULL} and {@link #NOT_NULL} are the
 * default failures of {@code Results.ensureNotNull} and {@code Results.ensureNull}, which lift
 * possibly-null values before any check runs.
 */
public final class GeneralChecks {

    public static final Failure NOT_EQUAL = Failure.validation("Error.NotEqual", "Value must be equal to the expected value.");
    public static final Failure EQUAL = Failure.validation("Error.Equal", "Value must not be equal to the expected value.");
    public static final Failure NULL = Failure.validation("Error.Null", "Value cannot be null.");
    public static final Failure NOT_NULL = Failure.validation("Error.NotNull", "Value must be null.");

    private GeneralChecks() {
        // Utility class
    }

    public static <T> Check<T> equalTo(T expected) {
        return Check.of(value -> Objects.equals(value, expected), NOT_EQUAL);
    }

    public static <T> Check<T> notEqualTo(T unexpected) {
        return Check.of(value -> !Objects.equals(value, unexpected), EQUAL);
    }
}
