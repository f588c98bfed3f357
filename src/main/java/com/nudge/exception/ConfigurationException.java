package com.nudge.exception;

/**
 * Exception thrown when a rule file or a rule setting is invalid.
 * Raised while loading rules, and by condition settings that cannot be
 * read as the expected type.
 */
public class ConfigurationException extends NudgeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
