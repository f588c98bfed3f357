package com.nudge.engine;

import com.nudge.config.RuleConfig;
import com.nudge.core.ActionItem;
import com.nudge.core.ActionItemReport;
import com.nudge.core.EntityBatch;
import com.nudge.core.EvaluationOptions;
import com.nudge.entity.EntityAdapter;

import java.util.List;

/**
 * Evaluates action item rules against entity snapshots.
 * <p>
 * Evaluation is a pure function of its inputs: no I/O, no state kept between
 * calls, and no exception escapes to the caller. A rule that cannot be evaluated
 * is skipped; the worst outcome is a partial or empty result.
 */
public interface ActionItemEngine {

    /**
     * Evaluate rules against entities of a single record kind.
     *
     * @param entities Entity snapshots
     * @param rules    Rules of any record kind; only enabled rules of the adapter's kind are used
     * @param adapter  Adapter for the entities
     * @param options  Urgency filter and limit, may be null
     * @return Items ordered by urgency then name
     */
    <E> List<ActionItem> evaluate(List<E> entities, List<RuleConfig> rules, EntityAdapter<E> adapter,
                                  EvaluationOptions options);

    default <E> List<ActionItem> evaluate(List<E> entities, List<RuleConfig> rules, EntityAdapter<E> adapter) {
        return evaluate(entities, rules, adapter, EvaluationOptions.defaults());
    }

    /**
     * Evaluate rules against several record kinds and merge the results into one report.
     *
     * @param batches Entities grouped with their adapters
     * @param rules   Rules of any record kind
     * @param options Urgency filter, record-kind filter and limit, may be null
     * @return Report with the ordered (and possibly truncated) items and pre-limit totals
     */
    ActionItemReport evaluateAll(List<EntityBatch<?>> batches, List<RuleConfig> rules, EvaluationOptions options);

    /**
     * Evaluate rules against a single entity, e.g. for a detail view.
     *
     * @return Items ordered by urgency; empty for archived or terminal entities
     */
    <E> List<ActionItem> evaluateEntity(E entity, List<RuleConfig> rules, EntityAdapter<E> adapter);
}
