package com.nudge.entity;

import com.nudge.FixedClocks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ApplicantAdapter.
 */
class ApplicantAdapterTest {

    private final ApplicantAdapter adapter = new ApplicantAdapter(FixedClocks.UTC);

    @Test
    @DisplayName("Phase override wins over calculated phase")
    void overrideWins() {
        Applicant applicant = Applicant.builder()
                .id("a-1")
                .phaseOverride("interview")
                .calculatedPhase("intake")
                .build();

        assertEquals("interview", adapter.phase(applicant));
    }

    @Test
    @DisplayName("Calculated phase is used without override, intake without either")
    void phaseFallbacks() {
        assertEquals("onboarding", adapter.phase(Applicant.builder().calculatedPhase("onboarding").build()));
        assertEquals("onboarding", adapter.phase(Applicant.builder().phaseOverride(" ").calculatedPhase("onboarding").build()));
        assertEquals("intake", adapter.phase(Applicant.builder().build()));
    }

    @Test
    @DisplayName("Name is trimmed and falls back to Unnamed")
    void nameFormatting() {
        assertEquals("Maria Lopez", adapter.name(Applicant.builder().name("Maria", "Lopez").build()));
        assertEquals("Maria", adapter.name(Applicant.builder().name("Maria", null).build()));
        assertEquals("Lopez", adapter.name(Applicant.builder().name(null, "Lopez").build()));
        assertEquals("Unnamed", adapter.name(Applicant.builder().name("  ", "").build()));
    }

    @Test
    @DisplayName("Days in phase come from the current phase's entry timestamp")
    void daysInPhase() {
        Applicant applicant = Applicant.builder()
                .calculatedPhase("onboarding")
                .phaseEntered("intake", FixedClocks.daysAgo(30))
                .phaseEntered("onboarding", FixedClocks.daysAgo(6))
                .build();

        assertEquals(6, adapter.daysInPhase(applicant));
    }

    @Test
    @DisplayName("Missing or zero phase timestamp means zero days in phase")
    void missingPhaseTimestamp() {
        Applicant noTimestamp = Applicant.builder().calculatedPhase("onboarding").build();
        Applicant zeroTimestamp = Applicant.builder()
                .calculatedPhase("onboarding")
                .phaseEntered("onboarding", 0L)
                .build();

        assertEquals(0, adapter.daysInPhase(noTimestamp));
        assertEquals(0, adapter.daysInPhase(zeroTimestamp));
        assertEquals(Optional.empty(), adapter.phaseTimestamp(zeroTimestamp, "onboarding"));
    }

    @Test
    @DisplayName("Creation time is the application date")
    void creationFromApplicationDate() {
        Applicant applicant = Applicant.builder().applicationDate(FixedClocks.daysAgo(12)).build();

        assertEquals(12, adapter.daysSinceCreation(applicant));
        assertEquals(12 * 24 * 60, adapter.minutesSinceCreation(applicant), 1e-9);
    }

    @Test
    @DisplayName("No application date means zero days and minutes")
    void noApplicationDate() {
        Applicant applicant = Applicant.builder().build();

        assertEquals(0, adapter.daysSinceCreation(applicant));
        assertEquals(0.0, adapter.minutesSinceCreation(applicant));
    }

    @Test
    @DisplayName("Tasks are done when true or completed")
    void taskCompletion() {
        Applicant applicant = Applicant.builder()
                .task("plain", true)
                .task("rich", Map.of("completed", true, "completedAt", 1L, "completedBy", "x"))
                .task("open", false)
                .task("rich_open", Map.of("completed", false))
                .task("odd", "yes")
                .build();

        assertTrue(adapter.isTaskDone(applicant, "plain"));
        assertTrue(adapter.isTaskDone(applicant, "rich"));
        assertFalse(adapter.isTaskDone(applicant, "open"));
        assertFalse(adapter.isTaskDone(applicant, "rich_open"));
        assertFalse(adapter.isTaskDone(applicant, "odd"));
        assertFalse(adapter.isTaskDone(applicant, "missing"));
        assertFalse(adapter.isTaskDone(applicant, null));
    }

    @Test
    @DisplayName("Last note date is the latest parseable note time")
    void lastNoteDate() {
        Applicant applicant = Applicant.builder()
                .note(Note.at(FixedClocks.daysAgo(9), "older"))
                .note(new Note("newer, date only", null, "2026-03-12"))
                .note(new Note("unparseable", "soon", null))
                .build();

        long expected = FixedClocks.NOW.toEpochMilli()
                - 3 * Timestamps.MILLIS_PER_DAY - 12 * 3_600_000L;
        assertEquals(Optional.of(expected), adapter.lastNoteDate(applicant));
    }

    @Test
    @DisplayName("No notes means no last note date")
    void noNotes() {
        assertEquals(Optional.empty(), adapter.lastNoteDate(Applicant.builder().build()));
    }

    @Test
    @DisplayName("Date fields are read from attributes, blank means absent")
    void dateFields() {
        Applicant applicant = Applicant.builder()
                .attribute("hcaExpiration", "2026-04-01")
                .attribute("tbTest", "")
                .build();

        assertEquals(Optional.of("2026-04-01"), adapter.dateField(applicant, "hcaExpiration"));
        assertEquals(Optional.empty(), adapter.dateField(applicant, "tbTest"));
        assertEquals(Optional.empty(), adapter.dateField(applicant, "cprExpiration"));
    }

    @Test
    @DisplayName("Archived flag is exposed, applicants are never terminal")
    void archivedAndTerminal() {
        Applicant archived = Applicant.builder().archived(true).calculatedPhase("orientation").build();

        assertTrue(adapter.isArchived(archived));
        assertFalse(adapter.isTerminalPhase(archived));
        assertEquals("applicant", adapter.recordKind());
    }
}
