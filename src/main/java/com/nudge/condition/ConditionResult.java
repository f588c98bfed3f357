package com.nudge.condition;

import java.util.Map;

/**
 * Outcome of evaluating one condition against one entity.
 *
 * @param matches Whether the condition matched
 * @param context Values computed while matching, available to templates as merge fields
 */
public record ConditionResult(boolean matches, Map<String, Object> context) {

    private static final ConditionResult NO_MATCH = new ConditionResult(false, Map.of());

    public ConditionResult {
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public static ConditionResult noMatch() {
        return NO_MATCH;
    }

    public static ConditionResult matched(Map<String, Object> context) {
        return new ConditionResult(true, context);
    }
}
