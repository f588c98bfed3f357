package com.nudge.condition.impl;

import com.nudge.FixedClocks;
import com.nudge.condition.ConditionResult;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.Applicant;
import com.nudge.entity.ApplicantAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskIncompleteCondition.
 */
class TaskIncompleteConditionTest {

    private final ApplicantAdapter adapter = new ApplicantAdapter(FixedClocks.UTC);
    private final TaskIncompleteCondition condition = TaskIncompleteCondition.INSTANCE;

    @Test
    @DisplayName("Open task in the configured phase matches with full context")
    void openTaskMatches() {
        ConditionConfig config = ConditionConfig.of(Map.of("phase", "onboarding", "task_id", "offer_letter", "min_days", 2));

        ConditionResult result = condition.evaluate(onboarding(3, 10, false), config, adapter);

        assertTrue(result.matches());
        assertEquals(3L, result.context().get("days_in_phase"));
        assertEquals(10L, result.context().get("days_since_created"));
        assertEquals("onboarding", result.context().get("phase_name"));
        assertEquals("offer_letter", result.context().get("task_name"));
    }

    @Test
    @DisplayName("Completed task does not match")
    void completedTask() {
        ConditionConfig config = ConditionConfig.of(Map.of("task_id", "offer_letter"));

        assertFalse(condition.evaluate(onboarding(3, 10, true), config, adapter).matches());
    }

    @Test
    @DisplayName("With a phase, min_days counts days in phase")
    void phaseUsesDaysInPhase() {
        ConditionConfig config = ConditionConfig.of(Map.of("phase", "onboarding", "task_id", "offer_letter", "min_days", 5));

        assertFalse(condition.evaluate(onboarding(3, 10, false), config, adapter).matches());
    }

    @Test
    @DisplayName("Without a phase, min_days counts days since creation")
    void noPhaseUsesDaysSinceCreation() {
        ConditionConfig config = ConditionConfig.of(Map.of("task_id", "offer_letter", "min_days", 5));

        assertTrue(condition.evaluate(onboarding(3, 10, false), config, adapter).matches());
    }

    @Test
    @DisplayName("A blank phase counts as no phase, so min_days counts days since creation")
    void blankPhaseUsesDaysSinceCreation() {
        ConditionConfig config = ConditionConfig.of(Map.of("phase", "", "task_id", "offer_letter", "min_days", 5));

        assertTrue(condition.evaluate(onboarding(3, 10, false), config, adapter).matches());
    }

    @Test
    @DisplayName("Missing task id never matches")
    void missingTaskId() {
        ConditionConfig config = ConditionConfig.of(Map.of("phase", "onboarding"));

        assertFalse(condition.evaluate(onboarding(3, 10, false), config, adapter).matches());
    }

    @Test
    @DisplayName("Task absent from the task map counts as incomplete")
    void absentTaskIsIncomplete() {
        Applicant applicant = Applicant.builder()
                .calculatedPhase("onboarding")
                .applicationDate(FixedClocks.daysAgo(1))
                .build();

        assertTrue(condition.evaluate(applicant, ConditionConfig.of(Map.of("task_id", "i9_form")), adapter).matches());
    }

    private static Applicant onboarding(long daysInPhase, long daysSinceCreated, boolean offerSent) {
        return Applicant.builder()
                .id("a-1")
                .calculatedPhase("onboarding")
                .phaseEntered("onboarding", FixedClocks.daysAgo(daysInPhase))
                .applicationDate(FixedClocks.daysAgo(daysSinceCreated))
                .task("offer_letter", offerSent)
                .build();
    }
}
