package com.nudge.engine;

import com.nudge.config.RuleStore;
import com.nudge.core.ActionItem;
import com.nudge.core.ActionItemReport;
import com.nudge.core.EntityBatch;
import com.nudge.core.EvaluationOptions;
import com.nudge.entity.EntityAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the engine against the rules currently held by a {@link RuleStore}.
 */
public class ActionItemService {

    private static final Logger log = LoggerFactory.getLogger(ActionItemService.class);

    private final RuleStore ruleStore;
    private final ActionItemEngine engine;
    private final Integer defaultLimit;

    public ActionItemService(RuleStore ruleStore, ActionItemEngine engine) {
        this(ruleStore, engine, null);
    }

    /**
     * @param defaultLimit Limit applied when the caller's options carry none; null or non-positive for unlimited
     */
    public ActionItemService(RuleStore ruleStore, ActionItemEngine engine, Integer defaultLimit) {
        this.ruleStore = ruleStore;
        this.engine = engine;
        this.defaultLimit = defaultLimit != null && defaultLimit > 0 ? defaultLimit : null;
    }

    public ActionItemReport report(List<EntityBatch<?>> batches, EvaluationOptions options) {
        EvaluationOptions effective = withDefaultLimit(options != null ? options : EvaluationOptions.defaults());
        ActionItemReport report = engine.evaluateAll(batches, ruleStore.getRules(), effective);
        log.debug("Report: {} of {} items, counts {}", report.showing(), report.total(), report.countsByUrgency());
        return report;
    }

    public <E> List<ActionItem> itemsFor(E entity, EntityAdapter<E> adapter) {
        return engine.evaluateEntity(entity, ruleStore.getRules(adapter.recordKind()), adapter);
    }

    public void refreshRules() {
        ruleStore.refresh();
    }

    private EvaluationOptions withDefaultLimit(EvaluationOptions options) {
        if (defaultLimit == null || options.getLimit().isPresent()) {
            return options;
        }
        return EvaluationOptions.builder()
                .urgency(options.getUrgency().orElse(null))
                .recordKind(options.getRecordKind().orElse(null))
                .limit(defaultLimit)
                .build();
    }
}
