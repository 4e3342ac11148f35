package org.javai.unions.check;

import java.util.Objects;
import java.util.regex.Pattern;
import org.javai.unions.Failure;

/**
 * Named checks over strings. Default failures carry codes of the form {@code StringError.*}.
 */
public final class StringChecks {

    public static final Failure EMPTY = Failure.validation("StringError.Empty", "String cannot be empty.");
    public static final Failure NOT_EMPTY = Failure.validation("StringError.NotEmpty", "String must be empty.");

    static final Pattern EMAIL = Pattern.compile("^[\\w.-]+@([\\w-]+\\.)+[\\w-]{2,4}$");
    static final Pattern URL = Pattern.compile("^http(s)?://([\\w-]+\\.)+[\\w-]+(/[\\w ./?%&=-]*)?$");
    static final Pattern PHONE_NUMBER = Pattern.compile("^\\+?(\\d[\\d. -]+)?(\\([\\d. -]+\\))?[\\d. -]+\\d$");
    static final Pattern IP_ADDRESS = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");

    private StringChecks() {
        // Utility class
    }

    public static Check<String> empty() {
        return Check.of(String::isEmpty, NOT_EMPTY);
    }

    public static Check<String> notEmpty() {
        return Check.of(s -> !s.isEmpty(), EMPTY);
    }

    /**
     * Rejects empty and whitespace-only strings.
     */
    public static Check<String> notBlank() {
        return Check.of(s -> !s.isBlank(), EMPTY);
    }

    public static Check<String> hasLength(int length) {
        return Check.of(s -> s.length() == length, Failure.validation(
                "StringError.InvalidLength", "String must have exactly " + length + " characters."));
    }

    public static Check<String> longerThan(int length) {
        return Check.of(s -> s.length() > length, tooShort(length, false));
    }

    public static Check<String> longerThanOrEqualTo(int length) {
        return Check.of(s -> s.length() >= length, tooShort(length, true));
    }

    public static Check<String> shorterThan(int length) {
        return Check.of(s -> s.length() < length, tooLong(length, false));
    }

    public static Check<String> shorterThanOrEqualTo(int length) {
        return Check.of(s -> s.length() <= length, tooLong(length, true));
    }

    /**
     * Same as {@link #longerThanOrEqualTo(int)}.
     */
    public static Check<String> hasMinLength(int length) {
        return longerThanOrEqualTo(length);
    }

    /**
     * Same as {@link #shorterThanOrEqualTo(int)}.
     */
    public static Check<String> hasMaxLength(int length) {
        return shorterThanOrEqualTo(length);
    }

    /**
     * Holds when {@code pattern} finds a match anywhere in the string; anchor the pattern
     * to require a full match.
     */
    public static Check<String> matches(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return Check.of(s -> pattern.matcher(s).find(), Failure.validation(
                "StringError.NotMatch", "String must match the pattern '" + pattern.pattern() + "'."));
    }

    public static Check<String> matches(String regex) {
        return matches(Pattern.compile(regex));
    }

    public static Check<String> notMatches(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return Check.of(s -> !pattern.matcher(s).find(), Failure.validation(
                "StringError.Match", "String cannot match the pattern '" + pattern.pattern() + "'."));
    }

    public static Check<String> notMatches(String regex) {
        return notMatches(Pattern.compile(regex));
    }

    public static Check<String> contains(String substring) {
        Objects.requireNonNull(substring, "substring must not be null");
        return Check.of(s -> s.contains(substring), Failure.validation(
                "StringError.NotContain", "String must contain '" + substring + "'."));
    }

    public static Check<String> notContains(String substring) {
        Objects.requireNonNull(substring, "substring must not be null");
        return Check.of(s -> !s.contains(substring), Failure.validation(
                "StringError.Contain", "String cannot contain '" + substring + "'."));
    }

    public static Check<String> startsWith(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        return Check.of(s -> s.startsWith(prefix), Failure.validation(
                "StringError.NotStartWith", "String must start with '" + prefix + "'."));
    }

    public static Check<String> notStartsWith(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        return Check.of(s -> !s.startsWith(prefix), Failure.validation(
                "StringError.StartWith", "String cannot start with '" + prefix + "'."));
    }

    public static Check<String> endsWith(String suffix) {
        Objects.requireNonNull(suffix, "suffix must not be null");
        return Check.of(s -> s.endsWith(suffix), Failure.validation(
                "StringError.NotEndWith", "String must end with '" + suffix + "'."));
    }

    public static Check<String> notEndsWith(String suffix) {
        Objects.requireNonNull(suffix, "suffix must not be null");
        return Check.of(s -> !s.endsWith(suffix), Failure.validation(
                "StringError.EndWith", "String cannot end with '" + suffix + "'."));
    }

    // Common formats

    public static Check<String> email() {
        return matches(EMAIL);
    }

    /**
     * An absolute http or https URL.
     */
    public static Check<String> url() {
        return matches(URL);
    }

    public static Check<String> phoneNumber() {
        return matches(PHONE_NUMBER);
    }

    /**
     * A dotted-quad shape. Octet ranges are not checked.
     */
    public static Check<String> ipAddress() {
        return matches(IP_ADDRESS);
    }

    private static Failure tooShort(int length, boolean inclusive) {
        return Failure.validation("StringError.TooShort",
                "String must be " + (inclusive ? "at least" : "longer than") + " " + length + " characters.");
    }

    private static Failure tooLong(int length, boolean inclusive) {
        return Failure.validation("StringError.TooLong",
                "String must be " + (inclusive ? "at most" : "shorter than") + " " + length + " characters.");
    }
}
