package com.nudge.config;

import com.nudge.priority.Urgency;

import java.util.Map;

/**
 * An externally authored action item rule.
 *
 * @param id             Rule identifier
 * @param recordKind     Record kind the rule applies to, e.g. "applicant" or "lead"
 * @param conditionType  Condition type tag, e.g. "phase_time"; unknown tags are skipped at evaluation
 * @param condition      Condition settings, shape depends on the condition type
 * @param urgency        Base urgency
 * @param escalation     Optional escalation clause, may be null
 * @param icon           Icon shown next to the item
 * @param label          Short label for rule listings
 * @param titleTemplate  Title template with {{field}} merge fields
 * @param detailTemplate Detail template
 * @param actionTemplate Suggested action template
 * @param enabled        Disabled rules are never evaluated
 * @param sortOrder      Position of the rule in listings
 */
public record RuleConfig(
        String id,
        String recordKind,
        String conditionType,
        ConditionConfig condition,
        Urgency urgency,
        EscalationConfig escalation,
        String icon,
        String label,
        String titleTemplate,
        String detailTemplate,
        String actionTemplate,
        boolean enabled,
        int sortOrder
) {
    public static final String DEFAULT_ICON = "📋";

    public RuleConfig {
        condition = condition != null ? condition : ConditionConfig.empty();
        urgency = urgency != null ? urgency : Urgency.INFO;
        icon = icon != null && !icon.isBlank() ? icon : DEFAULT_ICON;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for RuleConfig. Rules are enabled by default.
     */
    public static class Builder {
        private String id;
        private String recordKind;
        private String conditionType;
        private ConditionConfig condition;
        private Urgency urgency;
        private EscalationConfig escalation;
        private String icon;
        private String label;
        private String titleTemplate;
        private String detailTemplate;
        private String actionTemplate;
        private boolean enabled = true;
        private int sortOrder;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder recordKind(String recordKind) {
            this.recordKind = recordKind;
            return this;
        }

        public Builder conditionType(String conditionType) {
            this.conditionType = conditionType;
            return this;
        }

        public Builder condition(ConditionConfig condition) {
            this.condition = condition;
            return this;
        }

        public Builder condition(Map<String, ?> settings) {
            this.condition = ConditionConfig.of(settings);
            return this;
        }

        public Builder urgency(Urgency urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder escalation(EscalationConfig escalation) {
            this.escalation = escalation;
            return this;
        }

        public Builder icon(String icon) {
            this.icon = icon;
            return this;
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder title(String titleTemplate) {
            this.titleTemplate = titleTemplate;
            return this;
        }

        public Builder detail(String detailTemplate) {
            this.detailTemplate = detailTemplate;
            return this;
        }

        public Builder action(String actionTemplate) {
            this.actionTemplate = actionTemplate;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder sortOrder(int sortOrder) {
            this.sortOrder = sortOrder;
            return this;
        }

        public RuleConfig build() {
            return new RuleConfig(id, recordKind, conditionType, condition, urgency, escalation,
                    icon, label, titleTemplate, detailTemplate, actionTemplate, enabled, sortOrder);
        }
    }
}
