package com.oracle.thinking.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Malformed input. Raised before any state is touched.
 */
public class ThoughtValidationException extends ThinkingException {

    private final Map<String, String> fieldErrors;

    public ThoughtValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ThoughtValidationException(String message, Map<String, String> fieldErrors) {
        super(message);
        this.fieldErrors = Map.copyOf(fieldErrors);
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }

    @Override
    public String getCode() {
        return "VALIDATION_ERROR";
    }
}
