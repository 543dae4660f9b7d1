package io.sendflow.utils;

import io.sendflow.core.exception.InvalidInputException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

/**
 * Parses request timestamps.
 */
public final class Timestamps {
    private Timestamps() {
    }

    /**
     * Accepts ISO-8601 instants with an offset ("2026-01-20T09:30:00Z", "2026-01-20T09:30:00-03:00")
     * and local date-times ("2026-01-20T09:30", "2026-01-20 09:30:15") read in {@code zone}.
     */
    public static Instant parse(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("runAt", "runAt must not be blank");
        }
        String s = text.trim().replace(' ', 'T');

        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset, fall through to local date-time
        }

        try {
            return LocalDateTime.parse(s).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidInputException("runAt", "Invalid runAt, expected ISO date-time (YYYY-MM-DDTHH:MM): " + text);
        }
    }

    /**
     * Resolve an IANA zone id, falling back when {@code timezone} is null.
     */
    public static ZoneId zone(String timezone, ZoneId fallback) {
        if (timezone == null || timezone.isBlank()) {
            return fallback != null ? fallback : ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new InvalidInputException("timezone", "Unknown timezone: " + timezone);
        }
    }

    public static Instant laterOf(Instant a, Instant b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.isAfter(b) ? a : b;
    }
}
