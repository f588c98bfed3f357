package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;

import java.util.Map;
import java.util.Optional;

/**
 * Matches once an entity is older than a threshold.
 * <p>
 * Settings: {@code min_minutes} or {@code min_days}, {@code phase}, {@code task_not_done}.
 * {@code min_minutes} wins when both thresholds are set; with neither the
 * condition never matches. A done {@code task_not_done} task suppresses the match.
 */
public class TimeSinceCreationCondition implements Condition {

    public static final TimeSinceCreationCondition INSTANCE = new TimeSinceCreationCondition();

    private TimeSinceCreationCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        Optional<String> suppressingTask = config.getString("task_not_done");
        if (suppressingTask.isPresent() && adapter.isTaskDone(entity, suppressingTask.get())) {
            return ConditionResult.noMatch();
        }

        double minMinutes = config.getNumber("min_minutes", 0);
        if (minMinutes != 0) {
            double minutesSince = adapter.minutesSinceCreation(entity);
            if (minutesSince < minMinutes) {
                return ConditionResult.noMatch();
            }
            return ConditionResult.matched(Map.of(
                    "minutes_since_created", Math.round(minutesSince),
                    "days_since_created", adapter.daysSinceCreation(entity),
                    "phase_name", phase));
        }

        double minDays = config.getNumber("min_days", 0);
        if (minDays != 0) {
            long daysSince = adapter.daysSinceCreation(entity);
            if (daysSince < minDays) {
                return ConditionResult.noMatch();
            }
            return ConditionResult.matched(Map.of(
                    "days_since_created", daysSince,
                    "phase_name", phase));
        }

        return ConditionResult.noMatch();
    }

    @Override
    public ConditionType getType() {
        return ConditionType.TIME_SINCE_CREATION;
    }

    @Override
    public String toString() {
        return "TIME_SINCE_CREATION";
    }
}
