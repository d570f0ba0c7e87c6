package com.oracle.thinking.core.impl;

import com.oracle.thinking.config.ThinkingSecurityConfig;
import com.oracle.thinking.core.SecurityService;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.exception.RateLimitExceededException;
import com.oracle.thinking.exception.ThoughtSecurityException;
import com.oracle.thinking.model.SecurityStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Slf4j
public class SecureThoughtSecurity implements SecurityService {

    static final int MAX_SESSION_ID_LENGTH = 100;

    // fixed list, configuration cannot extend it
    private static final List<Pattern> SANITIZE_PATTERNS = List.of(
            Pattern.compile("<script[^>]*>.*?</script>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("javascript:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("eval\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Function\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("on\\w+=", Pattern.CASE_INSENSITIVE)
    );

    private final ThinkingSecurityConfig config;
    private final SessionTracker sessionTracker;
    private final List<Pattern> blockedPatterns;

    public SecureThoughtSecurity(ThinkingSecurityConfig config, SessionTracker sessionTracker) {
        this.config = config;
        this.sessionTracker = sessionTracker;
        this.blockedPatterns = compile(config.getBlockedPatterns());
    }

    private static List<Pattern> compile(List<String> sources) {
        List<Pattern> compiled = new ArrayList<>();
        if (sources == null) {
            return compiled;
        }
        for (String source : sources) {
            try {
                compiled.add(Pattern.compile(source, Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
            } catch (PatternSyntaxException e) {
                log.warn("Skipping malformed blocked pattern '{}': {}", source, e.getDescription());
            }
        }
        return List.copyOf(compiled);
    }

    @Override
    public String sanitizeContent(String content) {
        if (content == null) {
            return null;
        }
        String sanitized = content;
        for (Pattern pattern : SANITIZE_PATTERNS) {
            sanitized = pattern.matcher(sanitized).replaceAll("");
        }
        return sanitized;
    }

    /**
     * Blocked content is checked first, so a refused thought does not use up the session's budget.
     */
    @Override
    public void validateThought(String thought, String sessionId) {
        for (Pattern pattern : blockedPatterns) {
            if (pattern.matcher(thought).find()) {
                log.warn("Blocked thought for session {} matching pattern {}", sessionId, pattern.pattern());
                throw new ThoughtSecurityException("Thought contains prohibited content");
            }
        }
        if (sessionId != null && !sessionId.isEmpty()
                && !sessionTracker.checkAndRecordThought(sessionId, config.getMaxThoughtsPerMinute())) {
            log.warn("Rate limit exceeded for session {}", sessionId);
            throw new RateLimitExceededException(sessionId, config.getMaxThoughtsPerMinute());
        }
    }

    @Override
    public boolean validateSession(String sessionId) {
        return sessionId != null && !sessionId.isEmpty() && sessionId.length() <= MAX_SESSION_ID_LENGTH;
    }

    @Override
    public String generateSessionId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public SecurityStatus getSecurityStatus() {
        return SecurityStatus.builder()
                .status("healthy")
                .blockedPatterns(blockedPatterns.size())
                .maxThoughtsPerMinute(config.getMaxThoughtsPerMinute())
                .build();
    }
}
