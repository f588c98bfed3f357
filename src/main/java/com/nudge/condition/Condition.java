package com.nudge.condition;

import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;

/**
 * A condition kind that can be evaluated against any record kind through its adapter.
 * Implementations are stateless. Missing data yields a non-match, never an exception.
 */
public interface Condition {

    /**
     * Evaluate this condition.
     *
     * @param entity  Entity snapshot
     * @param config  Rule-specific condition settings
     * @param adapter Adapter for the entity's record kind
     * @return match verdict and the merge-field context
     */
    <E> ConditionResult evaluate(E entity, ConditionConfig config, EntityAdapter<E> adapter);

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
