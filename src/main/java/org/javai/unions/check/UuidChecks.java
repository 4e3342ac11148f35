package org.javai.unions.check;

import java.util.UUID;
import org.javai.unions.Failure;

/**
 * Named checks over {@link UUID}s, where "empty" means the nil UUID (all bits zero).
 */
public final class UuidChecks {

    public static final UUID NIL = new UUID(0L, 0L);

    public static final Failure EMPTY = Failure.validation("GuidError.Empty", "Value cannot be empty.");
    public static final Failure NOT_EMPTY = Failure.validation("GuidError.NotEmpty", "Value must be empty.");

    private UuidChecks() {
        // Utility class
    }

    public static Check<UUID> empty() {
        return Check.of(NIL::equals, NOT_EMPTY);
    }

    public static Check<UUID> notEmpty() {
        return Check.of(uuid -> !NIL.equals(uuid), EMPTY);
    }
}
