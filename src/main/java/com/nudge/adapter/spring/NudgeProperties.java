package com.nudge.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Nudge.
 */
@ConfigurationProperties(prefix = "nudge")
public class NudgeProperties {

    /**
     * Whether Nudge is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the rule file.
     * Supports classpath: prefix for classpath resources.
     */
    private String rulesPath = "classpath:nudge-rules.yaml";

    /**
     * Maximum number of items in a report when the caller sets no limit.
     * Unset or non-positive means unlimited.
     */
    private Integer defaultLimit;

    /**
     * Zone used for day arithmetic and date-only values. Defaults to the system zone.
     */
    private String timeZone;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getRulesPath() {
        return rulesPath;
    }

    public void setRulesPath(String rulesPath) {
        this.rulesPath = rulesPath;
    }

    public Integer getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(Integer defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }
}
