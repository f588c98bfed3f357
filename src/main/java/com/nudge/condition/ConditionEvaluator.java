package com.nudge.condition;

import com.nudge.config.ConditionConfig;
import com.nudge.entity.EntityAdapter;

import java.util.Optional;

/**
 * Registry of conditions keyed by condition type.
 */
public interface ConditionEvaluator {

    /**
     * Get the condition for a type.
     *
     * @param type Condition type
     * @return Condition instance
     */
    Condition get(ConditionType type);

    /**
     * Get the condition for a rule's type tag.
     *
     * @param tag Condition type tag, e.g. "task_stale"
     * @return Condition instance, or empty if the tag is unknown
     */
    default Optional<Condition> forTag(String tag) {
        return ConditionType.fromTag(tag).map(this::get);
    }

    /**
     * Evaluate a condition type directly against an entity.
     */
    default <E> ConditionResult evaluate(ConditionType type, E entity, ConditionConfig config,
                                         EntityAdapter<E> adapter) {
        return get(type).evaluate(entity, config, adapter);
    }
}
