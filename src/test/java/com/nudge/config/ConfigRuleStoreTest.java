package com.nudge.config;

import com.nudge.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigRuleStore.
 */
class ConfigRuleStoreTest {

    private static final String ONE_RULE = """
            name: store
            version: "1"
            rules:
              - id: first
                record-kind: lead
                condition-type: phase_time
            """;

    private static final String TWO_RULES = """
            name: store
            version: "2"
            rules:
              - id: first
                record-kind: lead
                condition-type: phase_time
              - id: second
                record-kind: applicant
                condition-type: last_note_stale
            """;

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Serves enabled rules, filtered by record kind on request")
    void servesRules() {
        ConfigRuleStore store = new ConfigRuleStore("classpath:rules/test-rules.yaml");

        assertEquals(5, store.getRules().size());
        assertEquals(List.of("lead_first_response", "lead_gone_quiet"),
                store.getRules("lead").stream().map(RuleConfig::id).toList());
        assertTrue(store.getRules("client").isEmpty());
    }

    @Test
    @DisplayName("Refresh picks up changes to the file")
    void refreshReloads() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, ONE_RULE);
        ConfigRuleStore store = new ConfigRuleStore(file.toString());
        assertEquals(1, store.getRules().size());

        Files.writeString(file, TWO_RULES);
        store.refresh();

        assertEquals(2, store.getRules().size());
        assertEquals("2", store.getRuleSet().version());
    }

    @Test
    @DisplayName("Failed refresh keeps the previous rules and rethrows")
    void failedRefreshKeepsSnapshot() throws IOException {
        Path file = tempDir.resolve("rules.yaml");
        Files.writeString(file, ONE_RULE);
        ConfigRuleStore store = new ConfigRuleStore(file.toString());

        Files.writeString(file, "rules:\n  - record-kind: lead\n");

        assertThrows(ConfigurationException.class, store::refresh);
        assertEquals(List.of("first"), store.getRules().stream().map(RuleConfig::id).toList());
    }

    @Test
    @DisplayName("Construction fails fast on an invalid file")
    void failsFast() {
        assertThrows(ConfigurationException.class, () -> new ConfigRuleStore("classpath:rules/broken-rules.yaml"));
    }
}
