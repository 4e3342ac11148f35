package org.javai.unions.check;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.Temporal;
import java.util.Objects;
import java.util.function.IntPredicate;
import org.javai.unions.Failure;

/**
 * Named checks that compare a point in time with "now".
 *
 * <p>Supported values are {@link Instant}, {@link LocalDate}, {@link LocalDateTime},
 * {@link LocalTime}, {@link OffsetDateTime} and {@link ZonedDateTime}. Local values are
 * compared with the current date or time in the clock's zone. Every check has an overload
 * taking a {@link Clock} so tests can pin the current instant.
 */
public final class TemporalChecks {

    public static final Failure NOT_IN_PAST = Failure.validation("DateTimeError.NotInPast", "Date should be in the past.");
    public static final Failure NOT_IN_FUTURE = Failure.validation("DateTimeError.NotInFuture", "Date should be in the future.");
    public static final Failure IN_PAST = Failure.validation("DateTimeError.InPast", "Date cannot be in the past.");
    public static final Failure IN_FUTURE = Failure.validation("DateTimeError.InFuture", "Date cannot be in the future.");

    private TemporalChecks() {
        // Utility class
    }

    public static Check<Temporal> inPast() {
        return inPast(Clock.systemDefaultZone());
    }

    public static Check<Temporal> inPast(Clock clock) {
        return relativeToNow(clock, c -> c < 0, NOT_IN_PAST);
    }

    public static Check<Temporal> inFuture() {
        return inFuture(Clock.systemDefaultZone());
    }

    public static Check<Temporal> inFuture(Clock clock) {
        return relativeToNow(clock, c -> c > 0, NOT_IN_FUTURE);
    }

    public static Check<Temporal> inPastOrPresent() {
        return inPastOrPresent(Clock.systemDefaultZone());
    }

    public static Check<Temporal> inPastOrPresent(Clock clock) {
        return relativeToNow(clock, c -> c <= 0, IN_FUTURE);
    }

    public static Check<Temporal> inFutureOrPresent() {
        return inFutureOrPresent(Clock.systemDefaultZone());
    }

    public static Check<Temporal> inFutureOrPresent(Clock clock) {
        return relativeToNow(clock, c -> c >= 0, IN_PAST);
    }

    private static Check<Temporal> relativeToNow(Clock clock, IntPredicate accepted, Failure failure) {
        Objects.requireNonNull(clock, "clock must not be null");
        return Check.of(value -> accepted.test(compareToNow(value, clock)), failure);
    }

    /**
     * @throws IllegalArgumentException if the value is not one of the supported types
     */
    static int compareToNow(Temporal value, Clock clock) {
        if (value instanceof Instant instant) {
            return instant.compareTo(clock.instant());
        }
        if (value instanceof LocalDate date) {
            return date.compareTo(LocalDate.now(clock));
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.compareTo(LocalDateTime.now(clock));
        }
        if (value instanceof LocalTime time) {
            return time.compareTo(LocalTime.now(clock));
        }
        if (value instanceof OffsetDateTime || value instanceof ZonedDateTime) {
            return Instant.from(value).compareTo(clock.instant());
        }
        throw new IllegalArgumentException("Unsupported temporal type: " + value.getClass().getName());
    }
}
