package com.oracle.thinking.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "thinking.mcts")
@Validated
@Data
public class MctsConfig {

    /**
     * Node ceiling per session tree. Root and cursor are always kept, so at least 2.
     */
    @Min(2)
    @Max(100000)
    private int maxNodesPerTree = 500;

    /**
     * Trees untouched for longer than this are evicted (ms)
     */
    @Min(1)
    private long maxTreeAge = 3_600_000L;

    @DecimalMin("0.0")
    @DecimalMax("10.0")
    private double explorationConstant = Math.sqrt(2);

    /**
     * Build a tree for every session that submits thoughts
     */
    private boolean enableAutoTree = true;
}
