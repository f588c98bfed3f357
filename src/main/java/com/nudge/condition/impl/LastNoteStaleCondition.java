package com.nudge.condition.impl;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.ConditionType;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;
import com.nudge.entity.Timestamps;

import java.util.Map;

/**
 * Matches when nobody has written a note for {@code min_days} days.
 * An entity without notes counts from its creation.
 * <p>
 * Settings: {@code min_days}, {@code phase}.
 */
public class LastNoteStaleCondition implements Condition {

    public static final LastNoteStaleCondition INSTANCE = new LastNoteStaleCondition();

    private LastNoteStaleCondition() {
    }

    @Override
    public <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter) {
        String phase = adapter.phase(entity);
        if (!PhaseFilter.passes(config, phase)) {
            return ConditionResult.noMatch();
        }

        long daysSinceLastNote = adapter.lastNoteDate(entity)
                .map(ts -> Timestamps.daysSince(ts, adapter.clock()))
                .orElseGet(() -> adapter.daysSinceCreation(entity));

        if (daysSinceLastNote < config.getNumber("min_days", 0)) {
            return ConditionResult.noMatch();
        }

        return ConditionResult.matched(Map.of(
                "days_since_last_note", daysSinceLastNote,
                "phase_name", phase));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.LAST_NOTE_STALE;
    }

    @Override
    public String toString() {
        return "LAST_NOTE_STALE";
    }
}
