package com.oracle.thinking.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "thinking.security")
@Validated
@Data
public class ThinkingSecurityConfig {

    public static final List<String> DEFAULT_BLOCKED_PATTERNS = List.of(
            "<script[^>]*>.*?</script>",
            "javascript:",
            "data:text/html",
            "eval\\s*\\(",
            "function\\s*\\(",
            "document\\.",
            "window\\.",
            "\\.php",
            "\\.exe",
            "\\.bat",
            "\\.cmd"
    );

    @Min(1)
    @Max(1000)
    private int maxThoughtsPerMinute = 60;

    /**
     * Case-insensitive regular expressions; a thought matching any of them is rejected
     */
    private List<String> blockedPatterns = new ArrayList<>(DEFAULT_BLOCKED_PATTERNS);

    @Min(0)
    private long sessionCleanupInterval = 60_000L;

    @Min(1)
    private long sessionExpiry = 3_600_000L;

    @Min(1)
    private long rateWindow = 60_000L;
}
