package com.oracle.thinking.core;

import com.oracle.thinking.model.SecurityStatus;

public interface SecurityService {

    /**
     * Strips script tags, script URIs and inline handlers. Other content passes through unchanged.
     */
    String sanitizeContent(String content);

    /**
     * Rejects blocked content and, when a session id is given, thoughts over the session's rate limit.
     *
     * @throws com.oracle.thinking.exception.ThoughtSecurityException when the thought is refused
     */
    void validateThought(String thought, String sessionId);

    boolean validateSession(String sessionId);

    String generateSessionId();

    SecurityStatus getSecurityStatus();
}
