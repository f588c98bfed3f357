package com.nudge.config;

import java.util.List;
import java.util.Objects;

/**
 * Source of the active rule set.
 */
public interface RuleStore {

    /**
     * Enabled rules of every record kind, ordered by sort order.
     */
    List<RuleConfig> getRules();

    /**
     * Enabled rules of one record kind, ordered by sort order.
     */
    default List<RuleConfig> getRules(String recordKind) {
        return getRules().stream()
                .filter(rule -> Objects.equals(rule.recordKind(), recordKind))
                .toList();
    }

    /**
     * Reload rules from the underlying source.
     *
     * @throws com.nudge.exception.ConfigurationException if the source cannot be loaded;
     *         the previously loaded rules stay active
     */
    void refresh();
}
