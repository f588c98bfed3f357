package com.nudge.config;

import com.nudge.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of a rule's condition. The shape depends on the condition type,
 * e.g. {@code {phase: verification, min_days: 3}} for a phase-time condition.
 * <p>
 * Keys are stored in snake_case; kebab-case keys from rule files are normalized.
 * Numeric accessors throw {@link ConfigurationException} when a value is present
 * but is not a number.
 */
public final class ConditionConfig {

    private static final ConditionConfig EMPTY = new ConditionConfig(Map.of());

    private final Map<String, Object> settings;

    private ConditionConfig(Map<String, Object> settings) {
        this.settings = settings;
    }

    public static ConditionConfig empty() {
        return EMPTY;
    }

    /**
     * Build settings from a raw map. Non-string keys, as YAML yields for {@code 3: intake},
     * are read as their text.
     */
    public static ConditionConfig of(Map<?, ?> settings) {
        if (settings == null || settings.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> normalized = new LinkedHashMap<>();
        settings.forEach((key, value) -> {
            if (key != null) {
                normalized.put(String.valueOf(key).replace('-', '_'), value);
            }
        });
        return new ConditionConfig(Collections.unmodifiableMap(normalized));
    }

    /**
     * Whether the key is present with a non-null value.
     */
    public boolean has(String key) {
        return settings.get(key) != null;
    }

    /**
     * Get a non-blank string setting.
     */
    public Optional<String> getString(String key) {
        Object value = settings.get(key);
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Get a list setting as strings. A single value is read as a one-element list.
     */
    public List<String> getStringList(String key) {
        Object value = settings.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        return List.of(value.toString());
    }

    /**
     * Get a numeric setting.
     *
     * @return the number, or empty if absent
     * @throws ConfigurationException if the value is present but not numeric
     */
    public Optional<Double> getNumber(String key) {
        Object value = settings.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Condition setting '" + key + "' is not numeric: " + s, e);
            }
        }
        if (value instanceof String) {
            return Optional.empty();
        }
        throw new ConfigurationException("Condition setting '" + key + "' is not numeric: " + value);
    }

    /**
     * Get a numeric setting, using {@code fallback} when it is absent or zero.
     */
    public double getNumber(String key, double fallback) {
        double value = getNumber(key).orElse(0.0);
        return value != 0.0 ? value : fallback;
    }

    public Map<String, Object> asMap() {
        return settings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return settings.equals(((ConditionConfig) o).settings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(settings);
    }

    @Override
    public String toString() {
        return "ConditionConfig" + settings;
    }
}
