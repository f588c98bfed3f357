package com.nudge.condition;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Supported condition types, with the merge fields each one puts in its context.
 */
public enum ConditionType {
    PHASE_TIME("phase_time",
            "days_in_phase", "phase_name"),
    TASK_INCOMPLETE("task_incomplete",
            "days_in_phase", "days_since_created", "phase_name", "task_name"),
    TASK_STALE("task_stale",
            "days_in_phase", "phase_name"),
    DATE_EXPIRING("date_expiring",
            "days_until_expiry", "expiry_date"),
    TIME_SINCE_CREATION("time_since_creation",
            "minutes_since_created", "days_since_created", "phase_name"),
    LAST_NOTE_STALE("last_note_stale",
            "days_since_last_note", "phase_name"),
    SPRINT_DEADLINE("sprint_deadline",
            "sprint_day", "sprint_remaining", "sprint_stage", "days_in_phase", "phase_name");

    private final String tag;
    private final Set<String> contextFields;

    ConditionType(String tag, String... contextFields) {
        this.tag = tag;
        this.contextFields = Set.of(contextFields);
    }

    /**
     * Tag used in rule files, e.g. "phase_time".
     */
    public String tag() {
        return tag;
    }

    /**
     * Merge fields a matching result of this type may provide.
     */
    public Set<String> contextFields() {
        return contextFields;
    }

    /**
     * Look up a type by tag. Kebab-case and upper-case spellings are accepted.
     *
     * @return the type, or empty for a null or unknown tag
     */
    public static Optional<ConditionType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ConditionType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
