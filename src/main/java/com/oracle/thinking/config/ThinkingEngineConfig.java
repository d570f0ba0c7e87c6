package com.oracle.thinking.config;

import com.oracle.thinking.core.ConfidenceAssessor;
import com.oracle.thinking.core.MetricsCollector;
import com.oracle.thinking.core.SecurityService;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.core.ThoughtTreeService;
import com.oracle.thinking.core.impl.BasicMetricsCollector;
import com.oracle.thinking.core.impl.BoundedThoughtManager;
import com.oracle.thinking.core.impl.KeywordConfidenceAssessor;
import com.oracle.thinking.core.impl.SecureThoughtSecurity;
import com.oracle.thinking.core.impl.SecureThoughtStorage;
import com.oracle.thinking.core.impl.ThoughtTreeManager;
import com.oracle.thinking.strategy.ThinkingModeEngine;
import com.oracle.thinking.tree.MctsEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Composes the engine. Each component is built once here and handed to its dependents, and
 * the ones owning background sweeps are torn down through {@code destroy}.
 */
@Configuration
public class ThinkingEngineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "destroy")
    public SessionTracker sessionTracker(ThinkingSecurityConfig securityConfig, Clock clock) {
        return new SessionTracker(securityConfig.getSessionCleanupInterval(),
                securityConfig.getSessionExpiry(), securityConfig.getRateWindow(), clock);
    }

    @Bean(destroyMethod = "destroy")
    public ThoughtStorage thoughtStorage(ThinkingConfig thinkingConfig, Clock clock) {
        return new SecureThoughtStorage(new BoundedThoughtManager(thinkingConfig, clock));
    }

    @Bean
    public SecurityService securityService(ThinkingSecurityConfig securityConfig, SessionTracker sessionTracker) {
        return new SecureThoughtSecurity(securityConfig, sessionTracker);
    }

    @Bean
    public MctsEngine mctsEngine(MctsConfig mctsConfig) {
        return new MctsEngine(mctsConfig.getExplorationConstant());
    }

    @Bean
    public ThinkingModeEngine thinkingModeEngine() {
        return new ThinkingModeEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfidenceAssessor confidenceAssessor() {
        return new KeywordConfidenceAssessor();
    }

    @Bean(destroyMethod = "destroy")
    public ThoughtTreeService thoughtTreeService(MctsConfig mctsConfig, MctsEngine mctsEngine,
                                                 ThinkingModeEngine thinkingModeEngine,
                                                 ConfidenceAssessor confidenceAssessor,
                                                 SessionTracker sessionTracker, Clock clock) {
        return new ThoughtTreeManager(mctsConfig, mctsEngine, thinkingModeEngine,
                confidenceAssessor, sessionTracker, clock);
    }

    @Bean(destroyMethod = "destroy")
    public MetricsCollector metricsCollector(SessionTracker sessionTracker, ThoughtStorage thoughtStorage, Clock clock) {
        return new BasicMetricsCollector(sessionTracker, thoughtStorage, clock);
    }
}
