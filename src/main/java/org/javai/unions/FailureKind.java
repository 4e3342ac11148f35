package org.javai.unions;

import java.util.Objects;

/**
 * The closed set of failure variants.
 *
 * <p>Every {@link Failure} carries exactly one kind. The kind decides how the failure
 * renders, whether it may carry metadata, and whether it wraps child failures.
 */
public enum FailureKind {

    /**
     * Anything not fitting a more specific kind.
     */
    GENERAL("Error", false),

    /**
     * Input or business-rule violation.
     */
    VALIDATION("ValidationError", true),

    /**
     * A requested entity is absent.
     */
    NOT_FOUND("NotFoundError", true),

    /**
     * The operation contradicts current state (duplicate key, version mismatch).
     */
    CONFLICT("ConflictError", true),

    /**
     * Identity could not be established.
     */
    AUTHENTICATION("AuthenticationError", true),

    /**
     * Identity established but privileges are insufficient.
     */
    AUTHORIZATION("AuthorizationError", true),

    /**
     * Two or more failures reported together. Never nested.
     */
    AGGREGATE("AggregateError", false);

    private final String typeName;
    private final boolean carriesMetadata;

    FailureKind(String typeName, boolean carriesMetadata) {
        this.typeName = typeName;
        this.carriesMetadata = carriesMetadata;
    }

    /**
     * The name used when rendering a failure and as the serialized type discriminator.
     */
    public String typeName() {
        return typeName;
    }

    public boolean carriesMetadata() {
        return carriesMetadata;
    }

    /**
     * Looks up a kind by its {@link #typeName()}.
     *
     * @param typeName the discriminator, e.g. {@code "NotFoundError"}
     * @return the matching kind, or none if the name is unknown
     */
    public static Option<FailureKind> fromTypeName(String typeName) {
        Objects.requireNonNull(typeName, "typeName must not be null");
        for (FailureKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return Option.some(kind);
            }
        }
        return Option.none();
    }
}
