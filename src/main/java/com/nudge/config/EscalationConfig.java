package com.nudge.config;

import com.nudge.priority.Urgency;

/**
 * Escalation clause of a rule.
 *
 * @param minDays Days (in phase or since creation, whichever is larger) before escalating
 * @param urgency Urgency that replaces the rule's base urgency
 */
public record EscalationConfig(double minDays, Urgency urgency) {

    /**
     * Whether the clause applies at the given elapsed days.
     * A clause without a positive threshold or without an urgency never applies.
     */
    public boolean appliesAt(long days) {
        return minDays > 0 && urgency != null && days >= minDays;
    }
}
