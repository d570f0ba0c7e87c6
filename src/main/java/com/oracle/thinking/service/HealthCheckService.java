package com.oracle.thinking.service;

import com.oracle.thinking.core.MetricsCollector;
import com.oracle.thinking.core.SecurityService;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.model.HealthStatus;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.SecurityStatus;
import com.oracle.thinking.model.StorageStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rolls memory, latency, error rate, storage fill and security state up into one status.
 * The overall status is the worst of the individual checks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthCheckService {

    static final double MEMORY_DEGRADED_PERCENT = 75;
    static final double MEMORY_UNHEALTHY_PERCENT = 90;
    static final double RESPONSE_DEGRADED_MS = 200;
    static final double RESPONSE_UNHEALTHY_MS = 1000;
    static final double ERROR_DEGRADED_PERCENT = 2;
    static final double ERROR_UNHEALTHY_PERCENT = 5;
    static final double STORAGE_DEGRADED_PERCENT = 90;

    private static final List<String> SEVERITY =
            List.of(HealthStatus.HEALTHY, HealthStatus.DEGRADED, HealthStatus.UNHEALTHY);

    private final MetricsCollector metrics;
    private final ThoughtStorage storage;
    private final SecurityService security;
    private final Clock clock;

    public HealthStatus checkHealth() {
        MetricsSnapshot snapshot = metrics.getMetrics();
        Map<String, HealthStatus.Check> checks = new LinkedHashMap<>();
        checks.put("memory", checkMemory(snapshot.getSystem()));
        checks.put("responseTime", checkResponseTime(snapshot.getRequests()));
        checks.put("errorRate", checkErrorRate(snapshot.getRequests()));
        checks.put("storage", checkStorage(storage.getStats()));
        checks.put("security", checkSecurity(security.getSecurityStatus()));

        String overall = checks.values().stream()
                .map(HealthStatus.Check::getStatus)
                .max((a, b) -> Integer.compare(SEVERITY.indexOf(a), SEVERITY.indexOf(b)))
                .orElse(HealthStatus.HEALTHY);
        if (!HealthStatus.HEALTHY.equals(overall)) {
            log.warn("Health check reports {}", overall);
        }
        return HealthStatus.builder()
                .status(overall)
                .checks(checks)
                .timestamp(clock.millis())
                .build();
    }

    HealthStatus.Check checkMemory(MetricsSnapshot.SystemMetrics system) {
        // max is -1 when the heap is unbounded
        long limit = system.getHeapMaxBytes() > 0 ? system.getHeapMaxBytes() : system.getHeapCommittedBytes();
        double percent = limit > 0 ? 100.0 * system.getHeapUsedBytes() / limit : 0;
        String status = grade(percent, MEMORY_DEGRADED_PERCENT, MEMORY_UNHEALTHY_PERCENT);
        return check(status, String.format(Locale.ROOT, "Heap usage %.1f%%", percent),
                Map.of("heapUsedBytes", system.getHeapUsedBytes(), "heapLimitBytes", limit));
    }

    HealthStatus.Check checkResponseTime(MetricsSnapshot.RequestMetrics requests) {
        double average = requests.getAverageResponseTime();
        String status = grade(average, RESPONSE_DEGRADED_MS, RESPONSE_UNHEALTHY_MS);
        return check(status, String.format(Locale.ROOT, "Average response time %.1f ms", average),
                Map.of("averageResponseTime", average));
    }

    HealthStatus.Check checkErrorRate(MetricsSnapshot.RequestMetrics requests) {
        double percent = requests.getTotalRequests() == 0 ? 0
                : 100.0 * requests.getFailedRequests() / requests.getTotalRequests();
        String status = grade(percent, ERROR_DEGRADED_PERCENT, ERROR_UNHEALTHY_PERCENT);
        return check(status, String.format(Locale.ROOT, "Error rate %.1f%%", percent),
                Map.of("failedRequests", requests.getFailedRequests(), "totalRequests", requests.getTotalRequests()));
    }

    HealthStatus.Check checkStorage(StorageStats stats) {
        double percent = stats.getHistoryCapacity() == 0 ? 0
                : 100.0 * stats.getHistorySize() / stats.getHistoryCapacity();
        String status = percent > STORAGE_DEGRADED_PERCENT ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
        return check(status, String.format(Locale.ROOT, "History %.1f%% full", percent),
                Map.of("historySize", stats.getHistorySize(), "historyCapacity", stats.getHistoryCapacity()));
    }

    HealthStatus.Check checkSecurity(SecurityStatus status) {
        boolean healthy = "healthy".equals(status.getStatus());
        return check(healthy ? HealthStatus.HEALTHY : HealthStatus.UNHEALTHY,
                status.getBlockedPatterns() + " blocked patterns active",
                Map.of("blockedPatterns", status.getBlockedPatterns()));
    }

    private static String grade(double value, double degraded, double unhealthy) {
        if (value > unhealthy) {
            return HealthStatus.UNHEALTHY;
        }
        return value > degraded ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private static HealthStatus.Check check(String status, String message, Map<String, Object> details) {
        return HealthStatus.Check.builder().status(status).message(message).details(details).build();
    }
}
