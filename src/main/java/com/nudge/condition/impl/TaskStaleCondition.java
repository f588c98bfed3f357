package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;
import com.nudge.entity.Timestamps;

import java.util.Map;
import java.util.Optional;

/**
 * Matches when one task is done but its follow-up is still open
 * {@code min_days} days after the phase was entered.
 * <p>
 * Settings: {@code done_task_id}, {@code pending_task_id}, {@code phase}, {@code min_days}.
 * Without a stored entry timestamp for {@code phase} the condition never matches.
 */
public class TaskStaleCondition implements Condition {

    public static final TaskStaleCondition INSTANCE = new TaskStaleCondition();

    private TaskStaleCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        Optional<String> doneTask = config.getString("done_task_id");
        Optional<String> pendingTask = config.getString("pending_task_id");
        if (doneTask.isEmpty() || pendingTask.isEmpty()) {
            return ConditionResult.noMatch();
        }
        if (!adapter.isTaskDone(entity, doneTask.get()) || adapter.isTaskDone(entity, pendingTask.get())) {
            return ConditionResult.noMatch();
        }

        Optional<Long> phaseStart = adapter.phaseTimestamp(entity, config.getString(PhaseFilter.PHASE).orElse(null));
        if (phaseStart.isEmpty()) {
            return ConditionResult.noMatch();
        }

        long daysSince = Timestamps.daysSince(phaseStart.get(), adapter.clock());
        if (daysSince < config.getNumber("min_days", 0)) {
            return ConditionResult.noMatch();
        }

        return ConditionResult.matched(Map.of(
                "days_in_phase", daysSince,
                "phase_name", phase));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TASK_STALE;
    }

    @Override
    public String toString() {
        return "TASK_STALE";
    }
}
