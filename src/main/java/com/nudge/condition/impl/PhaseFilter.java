package com.nudge.condition.impl;

import com.nudge.config.ConditionConfig;

import java.util.Optional;

/**
 * Optional {@code phase} setting shared by most conditions.
 */
final class PhaseFilter {

    static final String PHASE = "phase";

    private PhaseFilter() {
    }

    /**
     * Whether the entity's phase passes the condition's phase filter.
     * No filter configured means every phase passes.
     */
    static boolean passes(ConditionConfig config, String actualPhase) {
        Optional<String> required = config.getString(PHASE);
        return required.isEmpty() || required.get().equals(actualPhase);
    }
}
