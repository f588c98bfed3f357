package com.nudge.exception;

/**
 * Base exception for the action item engine.
 */
public class NudgeException extends RuntimeException {

    public NudgeException(String message) {
        super(message);
    }

    public NudgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
