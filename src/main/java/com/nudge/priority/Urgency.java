package com.nudge.priority;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of an action item. Lower severity rank sorts first.
 */
public enum Urgency {
    CRITICAL("critical", 0),
    WARNING("warning", 1),
    INFO("info", 2);

    private final String tag;
    private final int rank;

    Urgency(String tag, int rank) {
        this.tag = tag;
        this.rank = rank;
    }

    /**
     * Lowercase tag used in rule files and output, e.g. "critical".
     */
    public String tag() {
        return tag;
    }

    public int rank() {
        return rank;
    }

    /**
     * Parse a tag, case-insensitively.
     *
     * @return the urgency, or empty if the tag is null or unknown
     */
    public static Optional<Urgency> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.tag.equals(normalized)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return tag;
    }
}
