package com.nudge.entity;

import java.util.Map;

/**
 * Normalizes the stored task representations to a single done flag.
 * A task is done when stored as {@code true}, or as an object whose
 * {@code completed} entry is {@code true}.
 */
public final class TaskStatus {

    private TaskStatus() {
    }

    public static boolean isDone(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Map<?, ?> map) {
            return Boolean.TRUE.equals(map.get("completed"));
        }
        return false;
    }
}
