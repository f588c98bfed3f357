package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;

import java.util.Map;
import java.util.Optional;

/**
 * Matches when an entity has been in a phase for at least {@code min_days} days.
 * <p>
 * Settings: {@code phase}, {@code min_days}, {@code exclude_phases}.
 * The phase {@value #ANY_ACTIVE_PHASE} matches every phase not listed in
 * {@code exclude_phases}.
 */
public class PhaseTimeCondition implements Condition {

    public static final PhaseTimeCondition INSTANCE = new PhaseTimeCondition();

    public static final String ANY_ACTIVE_PHASE = "_any_active";

    private PhaseTimeCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        Optional<String> target = config.getString(PhaseFilter.PHASE);

        if (target.isPresent() && ANY_ACTIVE_PHASE.equals(target.get())) {
            if (config.getStringList("exclude_phases").contains(phase)) {
                return ConditionResult.noMatch();
            }
        } else if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        long daysInPhase = adapter.daysInPhase(entity);
        if (daysInPhase < config.getNumber("min_days", 0)) {
            return ConditionResult.noMatch();
        }

        return ConditionResult.matched(Map.of(
                "days_in_phase", daysInPhase,
                "phase_name", phase));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.PHASE_TIME;
    }

    @Override
    public String toString() {
        return "PHASE_TIME";
    }
}
