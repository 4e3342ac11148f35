package org.javai.unions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A failure value: a machine-readable code, a human-readable message and, depending on
 * the {@link FailureKind}, read-only metadata or a list of child failures.
 *
 * <p>Failures are plain immutable values. Two failures are equal when they have the same
 * kind, code, message, metadata entries and child sequence; a validation failure is never
 * equal to a general one even if code and message match.
 *
 * <p>Only {@link FailureKind#AGGREGATE} failures carry children, and they are flattened on
 * construction so that an aggregate never contains another aggregate.
 *
 * @param kind the variant of failure
 * @param code machine-readable identifier, empty when not given
 * @param message human-readable description
 * @param metadata ordered key-value context, empty for kinds that carry none
 * @param errors child failures, non-empty only for aggregates
 */
public record Failure(
        FailureKind kind,
        String code,
        String message,
        Map<String, Object> metadata,
        List<Failure> errors
) {

    public static final String AGGREGATE_CODE = "Errors.Aggregate";
    public static final String AGGREGATE_MESSAGE = "Multiple errors occurred.";

    public Failure {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        metadata = copyMetadata(metadata);
        errors = errors == null ? List.of() : flatten(errors);

        if (!metadata.isEmpty() && !kind.carriesMetadata()) {
            throw new IllegalArgumentException(kind.typeName() + " does not carry metadata");
        }
        if (kind == FailureKind.AGGREGATE) {
            if (errors.size() < 2) {
                throw new IllegalArgumentException("an aggregate needs at least two failures");
            }
            if (!AGGREGATE_CODE.equals(code) || !AGGREGATE_MESSAGE.equals(message)) {
                throw new IllegalArgumentException(
                        "an aggregate has code '" + AGGREGATE_CODE + "' and message '" + AGGREGATE_MESSAGE + "'");
            }
        }
        if (kind != FailureKind.AGGREGATE && !errors.isEmpty()) {
            throw new IllegalArgumentException(kind.typeName() + " does not carry child failures");
        }
    }

    // === General failures ===

    /**
     * Lifts a plain message into a general failure with an empty code.
     */
    public static Failure of(String message) {
        return of("", message);
    }

    public static Failure of(String code, String message) {
        return new Failure(FailureKind.GENERAL, code, message, null, null);
    }

    /**
     * Reconstructs a failure of any non-aggregate kind, e.g. from a serialized form.
     *
     * @throws IllegalArgumentException if {@code kind} is {@link FailureKind#AGGREGATE}, or
     *         metadata is given for a kind that carries none
     */
    public static Failure of(FailureKind kind, String code, String message, Map<String, Object> metadata) {
        if (kind == FailureKind.AGGREGATE) {
            throw new IllegalArgumentException("aggregates are built from their child failures");
        }
        return new Failure(kind, code, message, metadata, null);
    }

    // === Metadata-carrying failures ===

    public static Failure validation(String message) {
        return validation("", message);
    }

    public static Failure validation(String code, String message) {
        return validation(code, message, Map.of());
    }

    public static Failure validation(String code, String message, Map<String, Object> metadata) {
        return new Failure(FailureKind.VALIDATION, code, message, metadata, null);
    }

    public static Failure notFound(String message) {
        return notFound("", message);
    }

    public static Failure notFound(String code, String message) {
        return notFound(code, message, Map.of());
    }

    public static Failure notFound(String code, String message, Map<String, Object> metadata) {
        return new Failure(FailureKind.NOT_FOUND, code, message, metadata, null);
    }

    public static Failure conflict(String message) {
        return conflict("", message);
    }

    public static Failure conflict(String code, String message) {
        return conflict(code, message, Map.of());
    }

    public static Failure conflict(String code, String message, Map<String, Object> metadata) {
        return new Failure(FailureKind.CONFLICT, code, message, metadata, null);
    }

    public static Failure authentication(String message) {
        return authentication("", message);
    }

    public static Failure authentication(String code, String message) {
        return authentication(code, message, Map.of());
    }

    public static Failure authentication(String code, String message, Map<String, Object> metadata) {
        return new Failure(FailureKind.AUTHENTICATION, code, message, metadata, null);
    }

    public static Failure authorization(String message) {
        return authorization("", message);
    }

    public static Failure authorization(String code, String message) {
        return authorization(code, message, Map.of());
    }

    public static Failure authorization(String code, String message, Map<String, Object> metadata) {
        return new Failure(FailureKind.AUTHORIZATION, code, message, metadata, null);
    }

    /**
     * Creates an aggregate over the given failures. Only the accumulating combinators and
     * {@link FailureBuilder} build aggregates.
     */
    static Failure aggregate(List<Failure> errors) {
        return new Failure(FailureKind.AGGREGATE, AGGREGATE_CODE, AGGREGATE_MESSAGE, null, errors);
    }

    // === Queries ===

    public boolean isAggregate() {
        return kind == FailureKind.AGGREGATE;
    }

    public boolean hasCode() {
        return !code.isEmpty();
    }

    /**
     * Returns the metadata value stored under {@code key}, if any.
     */
    public Option<Object> metadataValue(String key) {
        return Option.ofNullable(metadata.get(key));
    }

    /**
     * Renders as {@code "TypeName: code - message"}, or {@code "TypeName: message"} when the
     * code is empty. Metadata is appended as {@code " - Metadata: k: v, ..."}; aggregates
     * append their children in parentheses.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.typeName()).append(": ");
        if (hasCode()) {
            sb.append(code).append(" - ");
        }
        sb.append(message);

        if (!metadata.isEmpty()) {
            sb.append(" - Metadata: ").append(metadata.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining(", ")));
        }
        if (isAggregate()) {
            sb.append(" ( ").append(errors.stream()
                    .map(Failure::toString)
                    .collect(Collectors.joining(", "))).append(" )");
        }
        return sb.toString();
    }

    private static Map<String, Object> copyMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> copy.put(
                Objects.requireNonNull(key, "metadata keys must not be null"),
                Objects.requireNonNull(value, "metadata values must not be null")));
        return Collections.unmodifiableMap(copy);
    }

    private static List<Failure> flatten(List<Failure> errors) {
        List<Failure> flat = new ArrayList<>(errors.size());
        for (Failure error : errors) {
            Objects.requireNonNull(error, "child failures must not be null");
            if (error.isAggregate()) {
                flat.addAll(error.errors());
            } else {
                flat.add(error);
            }
        }
        return List.copyOf(flat);
    }
}
