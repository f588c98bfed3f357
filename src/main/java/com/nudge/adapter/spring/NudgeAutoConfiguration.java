package com.nudge.adapter.spring;

import com.nudge.config.ConfigRuleStore;
import com.nudge.config.RuleStore;
import com.nudge.engine.ActionItemEngine;
import com.nudge.engine.ActionItemService;
import com.nudge.engine.DefaultActionItemEngine;
import com.nudge.entity.ApplicantAdapter;
import com.nudge.entity.EntityReader;
import com.nudge.entity.LeadAdapter;
import com.nudge.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Spring Boot auto-configuration for Nudge.
 */
@Configuration
@ConditionalOnProperty(prefix = "nudge", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(NudgeProperties.class)
public class NudgeAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NudgeAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock nudgeClock(NudgeProperties properties) {
        String zone = properties.getTimeZone();
        if (zone == null || zone.isBlank()) {
            return Clock.systemDefaultZone();
        }
        try {
            return Clock.system(ZoneId.of(zone.trim()));
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid nudge.time-zone: " + zone, e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public ApplicantAdapter applicantAdapter(Clock clock) {
        return new ApplicantAdapter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public LeadAdapter leadAdapter(Clock clock) {
        return new LeadAdapter(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EntityReader entityReader() {
        return new EntityReader();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleStore ruleStore(NudgeProperties properties) {
        log.info("Loading action item rules from: {}", properties.getRulesPath());
        return new ConfigRuleStore(properties.getRulesPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionItemEngine actionItemEngine() {
        return new DefaultActionItemEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionItemService actionItemService(RuleStore ruleStore, ActionItemEngine engine,
                                               NudgeProperties properties) {
        log.info("Creating ActionItemService (default limit: {})",
                properties.getDefaultLimit() != null ? properties.getDefaultLimit() : "none");
        return new ActionItemService(ruleStore, engine, properties.getDefaultLimit());
    }
}
