package com.nudge.engine;

import com.nudge.FixedClocks;
import com.nudge.config.RuleConfig;
import com.nudge.config.RuleStore;
import com.nudge.core.ActionItem;
import com.nudge.core.ActionItemReport;
import com.nudge.core.EntityBatch;
import com.nudge.core.EvaluationOptions;
import com.nudge.entity.Applicant;
import com.nudge.entity.ApplicantAdapter;
import com.nudge.priority.Urgency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ActionItemService.
 */
class ActionItemServiceTest {

    private CountingRuleStore ruleStore;
    private ApplicantAdapter adapter;
    private List<EntityBatch<?>> batches;

    @BeforeEach
    void setUp() {
        ruleStore = new CountingRuleStore(List.of(
                RuleConfig.builder()
                        .id("stalled")
                        .recordKind("applicant")
                        .conditionType("phase_time")
                        .condition(Map.of("min_days", 1))
                        .urgency(Urgency.WARNING)
                        .title("{{name}}")
                        .build(),
                RuleConfig.builder()
                        .id("lead_only")
                        .recordKind("lead")
                        .conditionType("phase_time")
                        .title("lead")
                        .build()));
        adapter = new ApplicantAdapter(FixedClocks.UTC);
        batches = List.of(EntityBatch.of(List.of(applicant("a-1", "Ann"), applicant("a-2", "Bob"),
                applicant("a-3", "Cal")), adapter));
    }

    @Test
    @DisplayName("Default limit applies when the caller sets none")
    void defaultLimit() {
        ActionItemService service = new ActionItemService(ruleStore, new DefaultActionItemEngine(), 2);

        ActionItemReport report = service.report(batches, null);

        assertEquals(3, report.total());
        assertEquals(2, report.showing());
    }

    @Test
    @DisplayName("Caller limit and filters win over the default limit")
    void callerLimitWins() {
        ActionItemService service = new ActionItemService(ruleStore, new DefaultActionItemEngine(), 2);

        ActionItemReport report = service.report(batches,
                EvaluationOptions.builder().urgency(Urgency.WARNING).limit(3).build());
        ActionItemReport infoOnly = service.report(batches,
                EvaluationOptions.builder().urgency(Urgency.INFO).build());

        assertEquals(3, report.showing());
        assertTrue(infoOnly.isEmpty());
    }

    @Test
    @DisplayName("Items for one entity use only that record kind's rules")
    void itemsForEntity() {
        ActionItemService service = new ActionItemService(ruleStore, new DefaultActionItemEngine());

        List<ActionItem> items = service.itemsFor(applicant("a-1", "Ann"), adapter);

        assertEquals(1, items.size());
        assertEquals("stalled", items.get(0).ruleId());
    }

    @Test
    @DisplayName("Refresh is delegated to the rule store")
    void refreshDelegates() {
        ActionItemService service = new ActionItemService(ruleStore, new DefaultActionItemEngine());

        service.refreshRules();
        service.refreshRules();

        assertEquals(2, ruleStore.refreshes);
    }

    private static Applicant applicant(String id, String name) {
        return Applicant.builder()
                .id(id)
                .name(name, "Test")
                .calculatedPhase("intake")
                .phaseEntered("intake", FixedClocks.daysAgo(2))
                .build();
    }

    private static class CountingRuleStore implements RuleStore {
        private final List<RuleConfig> rules;
        private int refreshes;

        CountingRuleStore(List<RuleConfig> rules) {
            this.rules = rules;
        }

        @Override
        public List<RuleConfig> getRules() {
            return rules;
        }

        @Override
        public void refresh() {
            refreshes++;
        }
    }
}
