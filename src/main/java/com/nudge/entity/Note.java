package com.nudge.entity;

/**
 * A note attached to an entity.
 *
 * @param text      Note text
 * @param timestamp When the note was written (epoch millis or ISO text), may be null
 * @param date      Legacy date field, used when {@code timestamp} is absent
 */
public record Note(String text, Object timestamp, Object date) {

    public static Note at(long epochMillis, String text) {
        return new Note(text, epochMillis, null);
    }

    /**
     * The raw time value of this note: {@code timestamp}, falling back to {@code date}
     * when the timestamp is missing, blank or zero.
     */
    public Object rawTime() {
        return isUnset(timestamp) ? date : timestamp;
    }

    private static boolean isUnset(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Number n) {
            return n.doubleValue() == 0.0;
        }
        return value instanceof String s && s.isBlank();
    }
}
