package com.nudge.config;

import java.util.Comparator;
import java.util.List;

/**
 * A loaded rule file.
 *
 * @param name    Rule set name
 * @param version Rule set version
 * @param rules   All rules in file order, enabled or not
 */
public record RuleSetConfig(String name, String version, List<RuleConfig> rules) {

    public RuleSetConfig {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Enabled rules ordered by sort order (file order for ties).
     */
    public List<RuleConfig> enabledRules() {
        return rules.stream()
                .filter(RuleConfig::enabled)
                .sorted(Comparator.comparingInt(RuleConfig::sortOrder))
                .toList();
    }
}
