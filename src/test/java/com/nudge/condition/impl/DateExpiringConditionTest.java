package com.nudge.condition.impl;

import com.nudge.FixedClocks;
import com.nudge.condition.ConditionResult;
import com.nudge.config.ConditionConfig;
import com.nudge.entity.Applicant;
import com.nudge.entity.ApplicantAdapter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DateExpiringCondition.
 * "Now" is 2026-03-15T12:00Z, so a date-only value N days ahead is N days away once rounded up.
 */
class DateExpiringConditionTest {

    private final ApplicantAdapter adapter = new ApplicantAdapter(FixedClocks.UTC);
    private final DateExpiringCondition condition = DateExpiringCondition.INSTANCE;

    @Test
    @DisplayName("Date within the warning window matches with days left and formatted date")
    void expiringSoon() {
        ConditionConfig config = ConditionConfig.of(Map.of("field", "hcaExpiration", "days_warning", 30));

        ConditionResult result = condition.evaluate(expiringOn("2026-03-25"), config, adapter);

        assertTrue(result.matches());
        assertEquals(10L, result.context().get("days_until_expiry"));
        assertEquals("Mar 25", result.context().get("expiry_date"));
    }

    @ParameterizedTest
    @DisplayName("Warning window defaults to 30 days")
    @CsvSource({
            "2026-04-14, true",
            "2026-04-15, false",
            "2026-03-01, false"
    })
    void defaultWindow(String date, boolean expected) {
        ConditionConfig config = ConditionConfig.of(Map.of("field", "hcaExpiration"));

        assertEquals(expected, condition.evaluate(expiringOn(date), config, adapter).matches());
    }

    @Test
    @DisplayName("Expired mode reports days overdue as a positive number")
    void expiredMode() {
        ConditionConfig config = ConditionConfig.of(Map.of("field", "hcaExpiration", "days_until", -1));

        ConditionResult result = condition.evaluate(expiringOn("2026-03-05"), config, adapter);

        assertTrue(result.matches());
        assertEquals(10L, result.context().get("days_until_expiry"));
        assertEquals("Mar 5", result.context().get("expiry_date"));
    }

    @Test
    @DisplayName("Expired mode ignores dates still in the future")
    void expiredModeFutureDate() {
        ConditionConfig config = ConditionConfig.of(Map.of("field", "hcaExpiration", "days_until", -1));

        assertFalse(condition.evaluate(expiringOn("2026-03-20"), config, adapter).matches());
    }

    @Test
    @DisplayName("Dates inside the exclusion band are left to tighter rules")
    void exclusionBand() {
        ConditionConfig config = ConditionConfig.of(Map.of(
                "field", "hcaExpiration",
                "days_warning", 60,
                "days_exclude_under", 15));

        assertFalse(condition.evaluate(expiringOn("2026-03-25"), config, adapter).matches());
        assertTrue(condition.evaluate(expiringOn("2026-04-04"), config, adapter).matches());
    }

    @Test
    @DisplayName("Missing, blank or unparseable dates do not match")
    void missingDate() {
        ConditionConfig config = ConditionConfig.of(Map.of("field", "hcaExpiration"));

        assertFalse(condition.evaluate(Applicant.builder().build(), config, adapter).matches());
        assertFalse(condition.evaluate(expiringOn(""), config, adapter).matches());
        assertFalse(condition.evaluate(expiringOn("soon"), config, adapter).matches());
    }

    @Test
    @DisplayName("No field configured never matches")
    void noField() {
        assertFalse(condition.evaluate(expiringOn("2026-03-20"), ConditionConfig.empty(), adapter).matches());
    }

    private static Applicant expiringOn(String date) {
        return Applicant.builder()
                .id("a-1")
                .calculatedPhase("orientation")
                .attribute("hcaExpiration", date)
                .build();
    }
}
