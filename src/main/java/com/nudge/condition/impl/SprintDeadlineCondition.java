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
 * Countdown for phases that must be finished within a fixed window.
 * <p>
 * Settings: {@code phase}, {@code warning_day} (default 3), {@code critical_day}
 * (default 5), {@code expired_day} (default 7). Matches from the warning day on;
 * requires a stored entry timestamp for {@code phase}.
 */
public class SprintDeadlineCondition implements Condition {

    public static final SprintDeadlineCondition INSTANCE = new SprintDeadlineCondition();

    static final double DEFAULT_WARNING_DAY = 3;
    static final double DEFAULT_CRITICAL_DAY = 5;
    static final double DEFAULT_EXPIRED_DAY = 7;

    private SprintDeadlineCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        Optional<Long> sprintStart = adapter.phaseTimestamp(entity, config.getString(PhaseFilter.PHASE).orElse(null));
        if (sprintStart.isEmpty()) {
            return ConditionResult.noMatch();
        }

        long sprintDay = Timestamps.daysSince(sprintStart.get(), adapter.clock());
        if (sprintDay < config.getNumber("warning_day", DEFAULT_WARNING_DAY)) {
            return ConditionResult.noMatch();
        }

        double criticalDay = config.getNumber("critical_day", DEFAULT_CRITICAL_DAY);
        double expiredDay = config.getNumber("expired_day", DEFAULT_EXPIRED_DAY);
        long remaining = Math.max(0L, (long) Math.ceil(expiredDay - sprintDay));

        return ConditionResult.matched(Map.of(
                "sprint_day", sprintDay,
                "sprint_remaining", remaining,
                "sprint_stage", stage(sprintDay, criticalDay, expiredDay),
                "days_in_phase", sprintDay,
                "phase_name", phase));
    }

    private static String stage(long sprintDay, double criticalDay, double expiredDay) {
        if (sprintDay >= expiredDay) {
            return "expired";
        }
        if (sprintDay >= criticalDay) {
            return "critical";
        }
        return "warning";
    }

    @Override
    public ConditionType getType() {
        return ConditionType.SPRINT_DEADLINE;
    }

    @Override
    public String toString() {
        return "SPRINT_DEADLINE";
    }
}
