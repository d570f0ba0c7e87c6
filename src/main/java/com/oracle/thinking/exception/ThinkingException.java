package com.oracle.thinking.exception;

/**
 * Base type for the conditions the engine reports to callers. Each subtype carries a stable code.
 */
public abstract class ThinkingException extends RuntimeException {

    protected ThinkingException(String message) {
        super(message);
    }

    protected ThinkingException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String getCode();
}
