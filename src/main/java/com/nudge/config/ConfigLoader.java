package com.nudge.config;

import com.nudge.condition.ConditionType;
import com.nudge.exception.ConfigurationException;
import com.nudge.priority.Urgency;
import com.nudge.template.MergeFieldTemplateResolver;
import com.nudge.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads action item rules from YAML files.
 * <p>
 * Keys may be written kebab-case ({@code record-kind}) or snake_case
 * ({@code record_kind}). The rule list lives under {@code rules}, either at the
 * root or under a {@code nudge} section.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TemplateResolver TEMPLATES = new MergeFieldTemplateResolver();

    private static final String NAME_FIELD = "name";

    /**
     * Load rules from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the rule file
     * @return Loaded rule set
     */
    public static RuleSetConfig load(String path) {
        log.info("Loading action item rules from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rules from: " + path, e);
        }
    }

    /**
     * Parse rules from YAML text.
     */
    public static RuleSetConfig loadFromString(String yaml) {
        return parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static RuleSetConfig parseYaml(InputStream inputStream) {
        Object loaded;
        try {
            loaded = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new ConfigurationException("Rule file is not valid YAML", e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Rule file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Rule file must be a mapping with a 'rules' list");
        }

        Map<String, Object> root = (Map<String, Object>) loaded;
        // Rules could be at root or under 'nudge' key
        Map<String, Object> section = root.get("nudge") instanceof Map
                ? (Map<String, Object>) root.get("nudge")
                : root;

        String name = getString(section, "default-rules", "name");
        String version = getString(section, "1.0", "version");

        Object rulesValue = section.get("rules");
        if (rulesValue != null && !(rulesValue instanceof List)) {
            throw new ConfigurationException("'rules' must be a list");
        }
        List<Object> rawRules = rulesValue == null ? List.of() : (List<Object>) rulesValue;
        if (rawRules.isEmpty()) {
            log.warn("Rule set '{}' has no rules", name);
        }

        List<RuleConfig> rules = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rawRules.size(); i++) {
            if (!(rawRules.get(i) instanceof Map)) {
                throw new ConfigurationException("Rule at index " + i + " is not a mapping");
            }
            RuleConfig rule = parseRule((Map<String, Object>) rawRules.get(i), i);
            if (!ids.add(rule.id())) {
                throw new ConfigurationException("Duplicate rule id: " + rule.id());
            }
            rules.add(rule);
        }

        RuleSetConfig config = new RuleSetConfig(name, version, rules);
        log.info("Loaded rule set: {} v{} with {} rules ({} enabled)",
                name, version, rules.size(), config.enabledRules().size());
        return config;
    }

    @SuppressWarnings("unchecked")
    private static RuleConfig parseRule(Map<String, Object> map, int index) {
        String id = getString(map, null, "id");
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Rule at index " + index + " has no id");
        }

        String recordKind = getString(map, null, "record-kind", "entity-type");
        if (recordKind == null || recordKind.isBlank()) {
            throw new ConfigurationException("Rule " + id + " has no record-kind");
        }

        String conditionType = getString(map, null, "condition-type");
        Optional<ConditionType> type = ConditionType.fromTag(conditionType);
        if (type.isEmpty()) {
            log.warn("Rule {} has unknown condition type '{}', it will never match", id, conditionType);
        }

        Object conditionValue = lookup(map, "condition", "condition-config");
        if (conditionValue != null && !(conditionValue instanceof Map)) {
            throw new ConfigurationException("Rule " + id + ": condition must be a mapping");
        }

        RuleConfig rule = RuleConfig.builder()
                .id(id)
                .recordKind(recordKind)
                .conditionType(conditionType)
                .condition(conditionValue == null
                        ? ConditionConfig.empty()
                        : ConditionConfig.of((Map<?, ?>) conditionValue))
                .urgency(parseUrgency(getString(map, null, "urgency"), id, Urgency.INFO))
                .escalation(parseEscalation(lookup(map, "escalation", "urgency-escalation"), id))
                .icon(getString(map, RuleConfig.DEFAULT_ICON, "icon"))
                .label(getString(map, id, "label"))
                .title(getString(map, "", "title", "title-template"))
                .detail(getString(map, "", "detail", "detail-template"))
                .action(getString(map, "", "action", "action-template"))
                .enabled(getBoolean(map, true, "enabled"))
                .sortOrder(getInt(map, index * 10, id, "sort-order"))
                .build();

        type.ifPresent(t -> warnOnUnknownFields(rule, t));
        return rule;
    }

    private static Urgency parseUrgency(String tag, String ruleId, Urgency defaultValue) {
        if (tag == null) {
            return defaultValue;
        }
        return Urgency.fromTag(tag).orElseThrow(() -> new ConfigurationException(
                "Rule " + ruleId + " has invalid urgency '" + tag + "'"));
    }

    @SuppressWarnings("unchecked")
    private static EscalationConfig parseEscalation(Object value, String ruleId) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Rule " + ruleId + ": escalation must be a mapping");
        }
        Map<String, Object> map = (Map<String, Object>) value;
        double minDays = getDouble(map, ruleId, "min-days");
        Urgency urgency = parseUrgency(getString(map, null, "urgency"), ruleId, null);
        if (minDays <= 0 || urgency == null) {
            log.warn("Rule {} escalation needs a positive min-days and an urgency, it will never apply", ruleId);
        }
        return new EscalationConfig(minDays, urgency);
    }

    /**
     * Warn about merge fields the rule's condition never provides.
     * Those are rendered verbatim, which is rarely what the author wants.
     */
    private static void warnOnUnknownFields(RuleConfig rule, ConditionType type) {
        Set<String> available = new HashSet<>(type.contextFields());
        available.add(NAME_FIELD);

        Set<String> unknown = new LinkedHashSet<>();
        for (String template : List.of(rule.titleTemplate(), rule.detailTemplate(), rule.actionTemplate())) {
            for (String field : TEMPLATES.fieldsOf(template)) {
                if (!available.contains(field)) {
                    unknown.add(field);
                }
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Rule {} references fields {} not provided by {}", rule.id(), unknown, type.tag());
        }
    }

    // Helper methods

    /**
     * Look up the first present key, trying each in kebab-case and snake_case.
     */
    private static Object lookup(Map<String, Object> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value == null) {
                value = map.get(key.replace('-', '_'));
            }
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String getString(Map<String, Object> map, String defaultValue, String... keys) {
        Object value = lookup(map, keys);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, int defaultValue, String ruleId, String... keys) {
        Object value = lookup(map, keys);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Rule " + ruleId + ": '" + keys[0] + "' is not an integer: " + value, e);
        }
    }

    private static double getDouble(Map<String, Object> map, String ruleId, String... keys) {
        Object value = lookup(map, keys);
        if (value == null) return 0;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Rule " + ruleId + ": '" + keys[0] + "' is not a number: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, boolean defaultValue, String... keys) {
        Object value = lookup(map, keys);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
