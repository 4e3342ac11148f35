package org.javai.unions.check;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.unions.Failure;

/**
 * Named checks that raw input (a name or an ordinal) denotes a constant of an enum type.
 */
public final class EnumChecks {

    public static final Failure NOT_DEFINED = Failure.validation("EnumError.NotDefined", "The value is not defined.");

    private EnumChecks() {
        // Utility class
    }

    /**
     * Holds when the string is the exact name of one of {@code enumType}'s constants.
     */
    public static <E extends Enum<E>> Check<String> definedName(Class<E> enumType) {
        Objects.requireNonNull(enumType, "enumType must not be null");
        Set<String> names = Arrays.stream(enumType.getEnumConstants())
                .map(Enum::name)
                .collect(Collectors.toUnmodifiableSet());
        return Check.of(names::contains, NOT_DEFINED);
    }

    public static <E extends Enum<E>> Check<Integer> definedOrdinal(Class<E> enumType) {
        Objects.requireNonNull(enumType, "enumType must not be null");
        int count = enumType.getEnumConstants().length;
        return Check.of(ordinal -> ordinal >= 0 && ordinal < count, NOT_DEFINED);
    }
}
