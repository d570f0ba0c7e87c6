package com.oracle.thinking.exception;

/**
 * Blocked content or a malformed session id.
 */
public class ThoughtSecurityException extends ThinkingException {

    public ThoughtSecurityException(String message) {
        super(message);
    }

    @Override
    public String getCode() {
        return "SECURITY_ERROR";
    }
}
