package in.cryptai.util;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * UTC calendar helpers. Every slot, filter and read is keyed on UTC dates.
 */
public final class UtcDates {

    /** First instant of the date (inclusive). */
    public static Instant startOf(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /** First instant of the following date (exclusive upper bound). */
    public static Instant endOf(LocalDate date) {
        return date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public static LocalDate today(Clock clock) {
        return ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).toLocalDate();
    }

    public static LocalDate dateOf(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    private UtcDates() {}
}
