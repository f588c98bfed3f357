package com.nudge.entity;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Conversions between the timestamp representations found on entity records
 * and whole-day / minute distances from the current time.
 */
public final class Timestamps {

    public static final long MILLIS_PER_DAY = 86_400_000L;
    public static final long MILLIS_PER_MINUTE = 60_000L;

    private Timestamps() {
    }

    /**
     * Convert a stored timestamp to epoch millis.
     * Accepts numbers (epoch millis), ISO dates (local midnight in {@code zone}),
     * ISO local date-times, offset date-times and instants.
     *
     * @param value Raw value, may be null
     * @param zone  Zone used for values that carry no offset
     * @return Epoch millis, or empty if the value is absent or unparseable
     */
    public static Optional<Long> toEpochMillis(Object value, ZoneId zone) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s) {
            return parse(s.trim(), zone);
        }
        return Optional.empty();
    }

    private static Optional<Long> parse(String text, ZoneId zone) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException ignored) {
            // not epoch millis, try the ISO forms below
        }
        try {
            if (!text.contains("T")) {
                return Optional.of(LocalDate.parse(text).atStartOfDay(zone).toInstant().toEpochMilli());
            }
            if (text.endsWith("Z")) {
                return Optional.of(Instant.parse(text).toEpochMilli());
            }
            try {
                return Optional.of(OffsetDateTime.parse(text).toInstant().toEpochMilli());
            } catch (DateTimeParseException e) {
                return Optional.of(LocalDateTime.parse(text).atZone(zone).toInstant().toEpochMilli());
            }
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Whole days elapsed since the given instant, rounded down.
     */
    public static long daysSince(long epochMillis, Clock clock) {
        return Math.floorDiv(clock.millis() - epochMillis, MILLIS_PER_DAY);
    }

    /**
     * Whole days until the given instant, rounded up. Negative once it has passed.
     */
    public static long daysUntil(long epochMillis, Clock clock) {
        return -Math.floorDiv(clock.millis() - epochMillis, MILLIS_PER_DAY);
    }

    /**
     * Fractional minutes elapsed since the given instant.
     */
    public static double minutesSince(long epochMillis, Clock clock) {
        return (clock.millis() - epochMillis) / (double) MILLIS_PER_MINUTE;
    }
}
