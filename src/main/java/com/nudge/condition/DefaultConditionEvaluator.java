package com.nudge.condition;

import com.nudge.condition.impl.DateExpiringCondition;
import com.nudge.condition.impl.LastNoteStaleCondition;
import com.nudge.condition.impl.PhaseTimeCondition;
import com.nudge.condition.impl.SprintDeadlineCondition;
import com.nudge.condition.impl.TaskIncompleteCondition;
import com.nudge.condition.impl.TaskStaleCondition;
import com.nudge.condition.impl.TimeSinceCreationCondition;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default implementation of ConditionEvaluator.
 * Holds one shared instance per condition type.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    private final Map<ConditionType, Condition> conditions = new EnumMap<>(ConditionType.class);

    public DefaultConditionEvaluator() {
        for (ConditionType type : ConditionType.values()) {
            conditions.put(type, create(type));
        }
    }

    @Override
    public Condition get(ConditionType type) {
        return conditions.get(type);
    }

    private static Condition create(ConditionType type) {
        return switch (type) {
            case PHASE_TIME -> PhaseTimeCondition.INSTANCE;
            case TASK_INCOMPLETE -> TaskIncompleteCondition.INSTANCE;
            case TASK_STALE -> TaskStaleCondition.INSTANCE;
            case DATE_EXPIRING -> DateExpiringCondition.INSTANCE;
            case TIME_SINCE_CREATION -> TimeSinceCreationCondition.INSTANCE;
            case LAST_NOTE_STALE -> LastNoteStaleCondition.INSTANCE;
            case SPRINT_DEADLINE -> SprintDeadlineCondition.INSTANCE;
        };
    }
}
