package com.oracle.thinking.exception;

public class RateLimitExceededException extends ThoughtSecurityException {

    private final String sessionId;

    public RateLimitExceededException(String sessionId, int maxPerWindow) {
        super("Rate limit exceeded: max " + maxPerWindow + " thoughts per minute");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    @Override
    public String getCode() {
        return "RATE_LIMIT_EXCEEDED";
    }
}
