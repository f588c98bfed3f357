package com.nudge.config;

import com.nudge.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RuleStore backed by a YAML rule file, loaded through {@link ConfigLoader}.
 * Readers always see a complete snapshot; a refresh swaps it atomically.
 */
public class ConfigRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigRuleStore.class);

    private final String path;
    private volatile RuleSetConfig ruleSet;

    public ConfigRuleStore(String path) {
        this.path = path;
        this.ruleSet = ConfigLoader.load(path);
    }

    @Override
    public List<RuleConfig> getRules() {
        return ruleSet.enabledRules();
    }

    public RuleSetConfig getRuleSet() {
        return ruleSet;
    }

    public String getPath() {
        return path;
    }

    @Override
    public void refresh() {
        try {
            RuleSetConfig reloaded = ConfigLoader.load(path);
            this.ruleSet = reloaded;
            log.info("Refreshed rules from {}: {} rules", path, reloaded.rules().size());
        } catch (ConfigurationException e) {
            log.error("Failed to refresh rules from {}, keeping {} v{}", path, ruleSet.name(), ruleSet.version(), e);
            throw e;
        }
    }
}
