package com.oracle.thinking.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "thinking")
@Validated
@Data
public class ThinkingConfig {

    /**
     * Capacity of the main thought history
     */
    @Min(1)
    @Max(10000)
    private int maxHistorySize = 1000;

    /**
     * Longest accepted thought text, in characters
     */
    @Min(1)
    @Max(100000)
    private int maxThoughtLength = 5000;

    /**
     * Branches whose newest thought is older than this are dropped by the sweep (ms)
     */
    @Min(1)
    private long maxBranchAge = 3_600_000L;

    /**
     * Capacity of each branch's own sequence
     */
    @Min(1)
    private int maxThoughtsPerBranch = 100;

    /**
     * Period of the history sweep in ms, 0 disables it
     */
    @Min(0)
    private long cleanupInterval = 300_000L;

    /**
     * Log the text of every admitted thought
     */
    private boolean enableThoughtLogging = true;
}
