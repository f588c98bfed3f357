package com.nudge.engine;

import com.nudge.condition.Condition;
import com.nudge.condition.ConditionEvaluator;
import com.nudge.condition.ConditionResult;
import com.nudge.condition.DefaultConditionEvaluator;
import com.nudge.config.RuleConfig;
import com.nudge.core.ActionItem;
import com.nudge.core.ActionItemReport;
import com.nudge.core.EntityBatch;
import com.nudge.core.EvaluationOptions;
import com.nudge.entity.EntityAdapter;
import com.nudge.priority.ActionItemOrder;
import com.nudge.priority.Urgency;
import com.nudge.priority.UrgencyResolver;
import com.nudge.template.MergeFieldTemplateResolver;
import com.nudge.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of ActionItemEngine.
 * <p>
 * For each batch: rules are narrowed to the batch's record kind and bound to their
 * condition once; archived and terminal entities are skipped; each (entity, rule)
 * pair is evaluated inside its own error boundary. Matches become items with
 * resolved urgency and templates, which are then filtered, ordered and truncated.
 */
public class DefaultActionItemEngine implements ActionItemEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultActionItemEngine.class);

    static final String NAME_FIELD = "name";
    static final String UNNAMED = "Unnamed";

    private final ConditionEvaluator conditionEvaluator;
    private final UrgencyResolver urgencyResolver;
    private final TemplateResolver templateResolver;

    public DefaultActionItemEngine() {
        this(new DefaultConditionEvaluator(), new UrgencyResolver(), new MergeFieldTemplateResolver());
    }

    public DefaultActionItemEngine(ConditionEvaluator conditionEvaluator,
                                   UrgencyResolver urgencyResolver,
                                   TemplateResolver templateResolver) {
        this.conditionEvaluator = conditionEvaluator;
        this.urgencyResolver = urgencyResolver;
        this.templateResolver = templateResolver;
        log.info("ActionItemEngine initialized with {}", conditionEvaluator.getClass().getSimpleName());
    }

    @Override
    public <E> List<ActionItem> evaluate(List<E> entities, List<RuleConfig> rules, EntityAdapter<E> adapter,
                                         EvaluationOptions options) {
        if (adapter == null) {
            log.warn("No entity adapter supplied, nothing to evaluate");
            return List.of();
        }
        return evaluateAll(List.of(EntityBatch.of(entities, adapter)), rules, options).items();
    }

    @Override
    public ActionItemReport evaluateAll(List<EntityBatch<?>> batches, List<RuleConfig> rules,
                                        EvaluationOptions options) {
        if (batches == null || batches.isEmpty() || rules == null || rules.isEmpty()) {
            return ActionItemReport.empty();
        }
        EvaluationOptions effective = options != null ? options : EvaluationOptions.defaults();

        List<ActionItem> items = new ArrayList<>();
        for (EntityBatch<?> batch : batches) {
            if (batch != null) {
                collect(batch, rules, effective, items);
            }
        }

        items.sort(ActionItemOrder.BY_URGENCY_THEN_NAME);

        Map<Urgency, Integer> counts = new EnumMap<>(Urgency.class);
        for (ActionItem item : items) {
            counts.merge(item.urgency(), 1, Integer::sum);
        }

        List<ActionItem> shown = effective.getLimit()
                .filter(limit -> limit < items.size())
                .map(limit -> items.subList(0, limit))
                .orElse(items);

        log.debug("Evaluated {} batches: {} items, showing {}", batches.size(), items.size(), shown.size());
        return new ActionItemReport(shown, items.size(), counts);
    }

    @Override
    public <E> List<ActionItem> evaluateEntity(E entity, List<RuleConfig> rules, EntityAdapter<E> adapter) {
        if (entity == null || adapter == null || rules == null) {
            return List.of();
        }
        Optional<String> kind = recordKindOf(adapter);
        if (kind.isEmpty()) {
            return List.of();
        }
        List<ActionItem> items = new ArrayList<>(itemsFor(entity, kind.get(), bind(rules, kind.get()), adapter));
        items.sort(ActionItemOrder.BY_URGENCY_THEN_NAME);
        return items;
    }

    private <E> void collect(EntityBatch<E> batch, List<RuleConfig> rules, EvaluationOptions options,
                             List<ActionItem> sink) {
        EntityAdapter<E> adapter = batch.adapter();
        Optional<String> kind = recordKindOf(adapter);
        if (kind.isEmpty() || !options.includesKind(kind.get())) {
            return;
        }
        List<BoundRule> bound = bind(rules, kind.get());
        if (bound.isEmpty()) {
            log.debug("No evaluable rules for record kind '{}'", kind.get());
            return;
        }

        for (E entity : batch.entities()) {
            if (entity == null) {
                continue;
            }
            for (ActionItem item : itemsFor(entity, kind.get(), bound, adapter)) {
                if (options.accepts(item.urgency())) {
                    sink.add(item);
                }
            }
        }
    }

    /**
     * The adapter's record kind, or empty when the adapter cannot report one.
     * A batch without a record kind is skipped.
     */
    private Optional<String> recordKindOf(EntityAdapter<?> adapter) {
        try {
            String kind = adapter.recordKind();
            if (kind == null || kind.isBlank()) {
                log.warn("Skipping batch: {} reports no record kind", adapter.getClass().getName());
                return Optional.empty();
            }
            return Optional.of(kind);
        } catch (RuntimeException e) {
            log.warn("Skipping batch: {} failed to report its record kind", adapter.getClass().getName(), e);
            return Optional.empty();
        }
    }

    /**
     * Keep enabled rules of the record kind and attach their condition.
     * Rules with an unknown condition type are dropped for this call.
     */
    private List<BoundRule> bind(List<RuleConfig> rules, String recordKind) {
        List<BoundRule> bound = new ArrayList<>();
        for (RuleConfig rule : rules) {
            if (rule == null || !rule.enabled() || !recordKind.equals(rule.recordKind())) {
                continue;
            }
            Optional<Condition> condition = conditionEvaluator.forTag(rule.conditionType());
            if (condition.isEmpty()) {
                log.warn("Skipping rule {}: unknown condition type '{}'", rule.id(), rule.conditionType());
                continue;
            }
            bound.add(new BoundRule(rule, condition.get()));
        }
        return bound;
    }

    private <E> List<ActionItem> itemsFor(E entity, String recordKind, List<BoundRule> rules,
                                          EntityAdapter<E> adapter) {
        try {
            if (adapter.isArchived(entity) || adapter.isTerminalPhase(entity)) {
                return List.of();
            }
        } catch (RuntimeException e) {
            log.warn("Skipping {} entity: adapter failed to read it", recordKind, e);
            return List.of();
        }

        List<ActionItem> items = new ArrayList<>();
        for (BoundRule bound : rules) {
            RuleConfig rule = bound.rule();
            try {
                ConditionResult result = bound.condition().evaluate(entity, rule.condition(), adapter);
                if (result.matches()) {
                    items.add(toItem(entity, recordKind, rule, result, adapter));
                }
            } catch (RuntimeException e) {
                log.warn("Action item rule error [{}]", rule.id(), e);
            }
        }
        return items;
    }

    private <E> ActionItem toItem(E entity, String recordKind, RuleConfig rule, ConditionResult result,
                                  EntityAdapter<E> adapter) {
        Urgency urgency = urgencyResolver.resolve(rule, entity, adapter);
        String name = adapter.name(entity);
        if (name == null || name.isBlank()) {
            name = UNNAMED;
        }

        Map<String, Object> context = new HashMap<>(result.context());
        context.put(NAME_FIELD, name);

        return new ActionItem(
                adapter.id(entity),
                recordKind,
                name,
                urgency,
                rule.icon(),
                templateResolver.resolve(rule.titleTemplate(), context),
                templateResolver.resolve(rule.detailTemplate(), context),
                templateResolver.resolve(rule.actionTemplate(), context),
                rule.id());
    }

    private record BoundRule(RuleConfig rule, Condition condition) {
    }
}
