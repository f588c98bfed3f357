package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;

import java.util.Map;
import java.util.Optional;

/**
 * Matches when a task is still open after {@code min_days} days.
 * <p>
 * Settings: {@code task_id}, {@code phase}, {@code min_days}.
 * With a phase filter the elapsed time is days in that phase; without one it is
 * days since the entity was created.
 */
public class TaskIncompleteCondition implements Condition {

    public static final TaskIncompleteCondition INSTANCE = new TaskIncompleteCondition();

    private TaskIncompleteCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        Optional<String> taskId = config.getString("task_id");
        if (taskId.isEmpty() || adapter.isTaskDone(entity, taskId.get())) {
            return ConditionResult.noMatch();
        }

        long daysInPhase = adapter.daysInPhase(entity);
        long daysSinceCreation = adapter.daysSinceCreation(entity);
        long relevantDays = config.getString(PhaseFilter.PHASE).isPresent() ? daysInPhase : daysSinceCreation;
        if (relevantDays < config.getNumber("min_days", 0)) {
            return ConditionResult.noMatch();
        }

        return ConditionResult.matched(Map.of(
                "days_in_phase", daysInPhase,
                "days_since_created", daysSinceCreation,
                "phase_name", phase,
                "task_name", taskId.get()));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TASK_INCOMPLETE;
    }

    @Override
    public String toString() {
        return "TASK_INCOMPLETE";
    }
}
