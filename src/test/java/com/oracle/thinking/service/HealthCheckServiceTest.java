package com.oracle.thinking.service;

import com.oracle.thinking.MutableClock;
import com.oracle.thinking.core.MetricsCollector;
import com.oracle.thinking.core.SecurityService;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.model.HealthStatus;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.SecurityStatus;
import com.oracle.thinking.model.StorageStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HealthCheckServiceTest {

    @Mock
    private MetricsCollector metrics;

    @Mock
    private ThoughtStorage storage;

    @Mock
    private SecurityService security;

    private HealthCheckService healthCheckService;

    @BeforeEach
    void setUp() {
        healthCheckService = new HealthCheckService(metrics, storage, security, new MutableClock(42L));
    }

    private static MetricsSnapshot snapshot(long heapUsed, double avgResponse, long total, long failed) {
        return MetricsSnapshot.builder()
                .system(MetricsSnapshot.SystemMetrics.builder().heapUsedBytes(heapUsed).heapMaxBytes(1000).build())
                .requests(MetricsSnapshot.RequestMetrics.builder()
                        .averageResponseTime(avgResponse)
                        .totalRequests(total)
                        .failedRequests(failed)
                        .successfulRequests(total - failed)
                        .build())
                .thoughts(MetricsSnapshot.ThoughtMetrics.builder().build())
                .build();
    }

    private void stubStorageAndSecurity(int historySize) {
        when(storage.getStats()).thenReturn(StorageStats.builder().historySize(historySize).historyCapacity(100).build());
        when(security.getSecurityStatus()).thenReturn(
                SecurityStatus.builder().status("healthy").blockedPatterns(11).maxThoughtsPerMinute(60).build());
    }

    @Test
    void shouldReportHealthyWhenAllChecksPass() {
        when(metrics.getMetrics()).thenReturn(snapshot(100, 20, 100, 1));
        stubStorageAndSecurity(10);

        HealthStatus health = healthCheckService.checkHealth();

        assertThat(health.getStatus()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.getChecks()).containsOnlyKeys("memory", "responseTime", "errorRate", "storage", "security");
        assertThat(health.getTimestamp()).isEqualTo(42L);
    }

    @Test
    void shouldTakeWorstCheck() {
        when(metrics.getMetrics()).thenReturn(snapshot(800, 20, 100, 10));
        stubStorageAndSecurity(95);

        HealthStatus health = healthCheckService.checkHealth();

        assertThat(health.getChecks().get("memory").getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.getChecks().get("storage").getStatus()).isEqualTo(HealthStatus.DEGRADED);
        assertThat(health.getChecks().get("errorRate").getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(health.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void shouldGradeResponseTime() {
        assertThat(healthCheckService.checkResponseTime(snapshot(0, 200, 1, 0).getRequests()).getStatus())
                .isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthCheckService.checkResponseTime(snapshot(0, 500, 1, 0).getRequests()).getStatus())
                .isEqualTo(HealthStatus.DEGRADED);
        assertThat(healthCheckService.checkResponseTime(snapshot(0, 1500, 1, 0).getRequests()).getStatus())
                .isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void shouldTreatNoTrafficAsHealthy() {
        assertThat(healthCheckService.checkErrorRate(snapshot(0, 0, 0, 0).getRequests()).getStatus())
                .isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void shouldFallBackToCommittedHeapWhenMaxUndefined() {
        MetricsSnapshot.SystemMetrics system = MetricsSnapshot.SystemMetrics.builder()
                .heapUsedBytes(95).heapMaxBytes(-1).heapCommittedBytes(100).build();

        HealthStatus.Check check = healthCheckService.checkMemory(system);

        assertThat(check.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(check.getMessage()).isEqualTo("Heap usage 95.0%");
    }

    @Test
    void shouldFlagUnhealthySecurity() {
        HealthStatus.Check check = healthCheckService.checkSecurity(
                SecurityStatus.builder().status("compromised").blockedPatterns(0).build());

        assertThat(check.getStatus()).isEqualTo(HealthStatus.UNHEALTHY);
    }
}
