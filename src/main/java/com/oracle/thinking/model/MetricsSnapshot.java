package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsSnapshot {

    private RequestMetrics requests;

    private ThoughtMetrics thoughts;

    private SystemMetrics system;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RequestMetrics {
        private long totalRequests;
        private long successfulRequests;
        private long failedRequests;
        private double averageResponseTime;
        private Long lastRequestTime;
        private int requestsPerMinute;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ThoughtMetrics {
        private long totalThoughts;
        private long averageThoughtLength;
        private int thoughtsPerMinute;
        private long revisionCount;
        private int branchCount;
        private int activeSessions;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SystemMetrics {
        private long heapUsedBytes;
        private long heapMaxBytes;
        private long heapCommittedBytes;
        private int availableProcessors;
        private long uptimeMs;
        private long timestamp;
    }
}
