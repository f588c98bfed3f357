package com.nudge.config;

import com.nudge.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConditionConfig.
 */
class ConditionConfigTest {

    @Test
    @DisplayName("Kebab-case keys are normalized to snake_case")
    void normalizesKeys() {
        ConditionConfig config = ConditionConfig.of(Map.of("min-days", 3, "task_id", "offer_letter"));

        assertTrue(config.has("min_days"));
        assertEquals(Optional.of(3.0), config.getNumber("min_days"));
        assertEquals(Optional.of("offer_letter"), config.getString("task_id"));
    }

    @Test
    @DisplayName("Numeric strings are accepted, zero or absent falls back")
    void numbers() {
        ConditionConfig config = ConditionConfig.of(Map.of("a", "4.5", "zero", 0, "blank", " "));

        assertEquals(4.5, config.getNumber("a", 1));
        assertEquals(30, config.getNumber("zero", 30));
        assertEquals(30, config.getNumber("missing", 30));
        assertEquals(Optional.empty(), config.getNumber("blank"));
    }

    @Test
    @DisplayName("Non-numeric values are a configuration error")
    void nonNumeric() {
        ConditionConfig config = ConditionConfig.of(Map.of("min_days", "three", "flag", true));

        assertThrows(ConfigurationException.class, () -> config.getNumber("min_days", 0));
        assertThrows(ConfigurationException.class, () -> config.getNumber("flag"));
    }

    @Test
    @DisplayName("Blank strings and nulls are absent")
    void blankStrings() {
        Map<String, Object> settings = new HashMap<>();
        settings.put("phase", "  ");
        settings.put("task_id", null);
        ConditionConfig config = ConditionConfig.of(settings);

        assertEquals(Optional.empty(), config.getString("phase"));
        assertFalse(config.has("task_id"));
    }

    @Test
    @DisplayName("String lists accept lists and single values")
    void stringLists() {
        ConditionConfig config = ConditionConfig.of(Map.of("list", List.of("intake", "orientation"), "single", "intake"));

        assertEquals(List.of("intake", "orientation"), config.getStringList("list"));
        assertEquals(List.of("intake"), config.getStringList("single"));
        assertEquals(List.of(), config.getStringList("missing"));
    }

    @Test
    @DisplayName("Empty settings are equal to empty()")
    void emptyEquality() {
        assertEquals(ConditionConfig.empty(), ConditionConfig.of(null));
        assertEquals(ConditionConfig.empty(), ConditionConfig.of(Map.of()));
        assertEquals(ConditionConfig.of(Map.of("min-days", 1)), ConditionConfig.of(Map.of("min_days", 1)));
    }
}
