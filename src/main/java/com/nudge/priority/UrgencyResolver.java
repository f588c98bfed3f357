package com.nudge.priority;

import com.nudge.config.EscalationConfig;
import com.nudge.config.RuleConfig;
import com.nudge.entity.EntityAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the urgency of a matched rule.
 * Starts from the rule's base urgency and applies its escalation clause, if any,
 * once the entity has been in its phase (or in the pipeline) long enough.
 * Escalation is a plain override: it is not required to raise severity.
 */
public class UrgencyResolver {

    private static final Logger log = LoggerFactory.getLogger(UrgencyResolver.class);

    /**
     * @param rule    Matched rule
     * @param entity  Entity the rule matched
     * @param adapter Adapter for the entity's record kind
     * @return Resolved urgency, never null
     */
    public <E> Urgency resolve(RuleConfig rule, E entity, EntityAdapter<E> adapter) {
        Urgency urgency = rule.urgency();
        EscalationConfig escalation = rule.escalation();
        if (escalation == null) {
            return urgency;
        }

        long relevantDays = Math.max(adapter.daysInPhase(entity), adapter.daysSinceCreation(entity));
        if (escalation.appliesAt(relevantDays)) {
            log.debug("Rule {} escalated from {} to {} at {} days",
                    rule.id(), urgency, escalation.urgency(), relevantDays);
            return escalation.urgency();
        }
        return urgency;
    }
}
