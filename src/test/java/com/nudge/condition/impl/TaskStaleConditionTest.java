package com.nudge.condition.impl;

import com.nudge.FixedClocks;
import com.nudge.condition.ConditionResult;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.Applicant;
import com.nudge.entity.ApplicantAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TaskStaleCondition.
 */
class TaskStaleConditionTest {

    private final ApplicantAdapter adapter = new ApplicantAdapter(FixedClocks.UTC);
    private final TaskStaleCondition condition = TaskStaleCondition.INSTANCE;

    private ConditionConfig config;

    @BeforeEach
    void setUp() {
        config = ConditionConfig.of(Map.of(
                "phase", "interview",
                "done_task_id", "interview_scheduled",
                "pending_task_id", "interview_completed",
                "min_days", 5));
    }

    @Test
    @DisplayName("Done task without follow-up matches after min_days")
    void staleFollowUp() {
        Applicant applicant = interview(6, true, false);

        ConditionResult result = condition.evaluate(applicant, config, adapter);

        assertTrue(result.matches());
        assertEquals(Map.of("days_in_phase", 6L, "phase_name", "interview"), result.context());
    }

    @Test
    @DisplayName("Not yet stale before min_days")
    void tooEarly() {
        assertFalse(condition.evaluate(interview(4, true, false), config, adapter).matches());
    }

    @Test
    @DisplayName("Follow-up done or trigger task open does not match")
    void taskStates() {
        assertFalse(condition.evaluate(interview(10, true, true), config, adapter).matches());
        assertFalse(condition.evaluate(interview(10, false, false), config, adapter).matches());
    }

    @Test
    @DisplayName("No stored phase timestamp does not match")
    void noPhaseTimestamp() {
        Applicant applicant = Applicant.builder()
                .calculatedPhase("interview")
                .applicationDate(FixedClocks.daysAgo(30))
                .task("interview_scheduled", true)
                .build();

        assertFalse(condition.evaluate(applicant, config, adapter).matches());
    }

    @Test
    @DisplayName("Both task ids are required")
    void bothIdsRequired() {
        ConditionConfig onlyDone = ConditionConfig.of(Map.of("phase", "interview", "done_task_id", "interview_scheduled"));

        assertFalse(condition.evaluate(interview(10, true, false), onlyDone, adapter).matches());
    }

    private static Applicant interview(long days, boolean scheduled, boolean completed) {
        return Applicant.builder()
                .calculatedPhase("interview")
                .phaseEntered("interview", FixedClocks.daysAgo(days))
                .task("interview_scheduled", scheduled)
                .task("interview_completed", completed)
                .build();
    }
}
