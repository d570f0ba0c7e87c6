package com.oracle.thinking.core.impl;

import com.oracle.thinking.MutableClock;
import com.oracle.thinking.config.ThinkingSecurityConfig;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.exception.RateLimitExceededException;
import com.oracle.thinking.exception.ThoughtSecurityException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecureThoughtSecurityTest {

    private ThinkingSecurityConfig config;
    private SessionTracker tracker;
    private SecureThoughtSecurity security;

    @BeforeEach
    void setUp() {
        config = new ThinkingSecurityConfig();
        config.setMaxThoughtsPerMinute(3);
        tracker = new SessionTracker(0, 3_600_000L, 60_000L, new MutableClock(0L));
        security = new SecureThoughtSecurity(config, tracker);
    }

    @AfterEach
    void tearDown() {
        tracker.destroy();
    }

    @Test
    void shouldRejectBlockedContentIdenticallyOnRepeatedCalls() {
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> security.validateThought("open document.cookie now", ""))
                    .isInstanceOf(ThoughtSecurityException.class)
                    .hasMessageContaining("prohibited");
        }
    }

    @Test
    void shouldSkipMalformedPatterns() {
        config.setBlockedPatterns(List.of("([unclosed", "forbidden"));
        SecureThoughtSecurity custom = new SecureThoughtSecurity(config, tracker);

        assertThat(custom.getSecurityStatus().getBlockedPatterns()).isEqualTo(1);
        assertThatThrownBy(() -> custom.validateThought("a FORBIDDEN word", null))
                .isInstanceOf(ThoughtSecurityException.class);
        assertThatCode(() -> custom.validateThought("([unclosed is fine", null)).doesNotThrowAnyException();
    }

    @Test
    void shouldEnforceRateLimitPerSession() {
        security.validateThought("one", "s1");
        security.validateThought("two", "s1");
        security.validateThought("three", "s1");

        assertThatThrownBy(() -> security.validateThought("four", "s1"))
                .isInstanceOf(RateLimitExceededException.class);
        assertThatCode(() -> security.validateThought("four", "s2")).doesNotThrowAnyException();
    }

    @Test
    void shouldNotSpendBudgetOnBlockedThoughts() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> security.validateThought("run payload.exe", "s1"))
                    .isNotInstanceOf(RateLimitExceededException.class);
        }

        assertThatCode(() -> security.validateThought("clean", "s1")).doesNotThrowAnyException();
    }

    @Test
    void shouldSkipRateLimitWithoutSession() {
        for (int i = 0; i < 10; i++) {
            security.validateThought("thought " + i, "");
        }
        assertThat(tracker.getTrackedSessionCount()).isZero();
    }

    @Test
    void shouldStripScriptsAndHandlers() {
        String input = "Hello <script type=\"x\">alert(1)</script>world javascript:go() eval(x) "
                + "new Function(y) <img onerror=bad>";

        String sanitized = security.sanitizeContent(input);

        assertThat(sanitized)
                .doesNotContainIgnoringCase("<script")
                .doesNotContainIgnoringCase("javascript:")
                .doesNotContain("eval(")
                .doesNotContain("Function(")
                .doesNotContain("onerror=")
                .contains("Hello", "world");
        assertThat(security.sanitizeContent("plain text")).isEqualTo("plain text");
    }

    @Test
    void shouldValidateSessionIdLength() {
        assertThat(security.validateSession("abc")).isTrue();
        assertThat(security.validateSession("x".repeat(100))).isTrue();
        assertThat(security.validateSession("x".repeat(101))).isFalse();
        assertThat(security.validateSession("")).isFalse();
        assertThat(security.validateSession(null)).isFalse();
    }

    @Test
    void shouldGenerateRandomUuids() {
        String first = security.generateSessionId();
        String second = security.generateSessionId();

        assertThat(UUID.fromString(first).version()).isEqualTo(4);
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void shouldReportDefaultPatternCount() {
        assertThat(security.getSecurityStatus().getStatus()).isEqualTo("healthy");
        assertThat(security.getSecurityStatus().getBlockedPatterns())
                .isEqualTo(ThinkingSecurityConfig.DEFAULT_BLOCKED_PATTERNS.size());
    }
}
