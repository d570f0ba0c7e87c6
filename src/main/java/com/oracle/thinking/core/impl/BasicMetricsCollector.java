package com.oracle.thinking.core.impl;

import com.oracle.thinking.core.CircularBuffer;
import com.oracle.thinking.core.MetricsCollector;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.ThoughtRecord;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Clock;

/**
 * In-memory request and thought counters. Per-minute rates count samples strictly newer
 * than one minute before the moment of reading.
 */
public class BasicMetricsCollector implements MetricsCollector {

    static final long RATE_WINDOW_MS = 60_000L;
    static final int RESPONSE_TIME_SAMPLES = 100;
    static final int RATE_SAMPLES = 1000;

    private final SessionTracker sessionTracker;
    private final ThoughtStorage storage;
    private final Clock clock;

    private final CircularBuffer<Long> responseTimes = new CircularBuffer<>(RESPONSE_TIME_SAMPLES);
    private final CircularBuffer<Long> requestTimestamps = new CircularBuffer<>(RATE_SAMPLES);
    private final CircularBuffer<Long> thoughtTimestamps = new CircularBuffer<>(RATE_SAMPLES);

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private Long lastRequestTime;
    private long totalThoughts;
    private long averageThoughtLength;
    private long revisionCount;

    public BasicMetricsCollector(SessionTracker sessionTracker, ThoughtStorage storage, Clock clock) {
        this.sessionTracker = sessionTracker;
        this.storage = storage;
        this.clock = clock;
    }

    @Override
    public synchronized void recordRequest(long durationMs, boolean success) {
        long now = clock.millis();
        totalRequests++;
        if (success) {
            successfulRequests++;
        } else {
            failedRequests++;
        }
        lastRequestTime = now;
        responseTimes.add(durationMs);
        requestTimestamps.add(now);
    }

    @Override
    public synchronized void recordThoughtProcessed(ThoughtRecord record) {
        long now = clock.millis();
        totalThoughts++;
        int length = record.getThought() == null ? 0 : record.getThought().length();
        averageThoughtLength = Math.round(
                (averageThoughtLength * (double) (totalThoughts - 1) + length) / totalThoughts);
        if (Boolean.TRUE.equals(record.getRevision())) {
            revisionCount++;
        }
        thoughtTimestamps.add(now);
    }

    @Override
    public synchronized MetricsSnapshot getMetrics() {
        long now = clock.millis();
        double averageResponseTime = responseTimes.getAll().stream()
                .mapToLong(Long::longValue).average().orElse(0.0);

        return MetricsSnapshot.builder()
                .requests(MetricsSnapshot.RequestMetrics.builder()
                        .totalRequests(totalRequests)
                        .successfulRequests(successfulRequests)
                        .failedRequests(failedRequests)
                        .averageResponseTime(averageResponseTime)
                        .lastRequestTime(lastRequestTime)
                        .requestsPerMinute(countSince(requestTimestamps, now))
                        .build())
                .thoughts(MetricsSnapshot.ThoughtMetrics.builder()
                        .totalThoughts(totalThoughts)
                        .averageThoughtLength(averageThoughtLength)
                        .thoughtsPerMinute(countSince(thoughtTimestamps, now))
                        .revisionCount(revisionCount)
                        .branchCount(storage.getBranches().size())
                        .activeSessions(sessionTracker.getActiveSessionCount())
                        .build())
                .system(systemMetrics(now))
                .build();
    }

    private static int countSince(CircularBuffer<Long> timestamps, long now) {
        long cutoff = now - RATE_WINDOW_MS;
        return (int) timestamps.getAll().stream().filter(ts -> ts > cutoff).count();
    }

    private static MetricsSnapshot.SystemMetrics systemMetrics(long now) {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return MetricsSnapshot.SystemMetrics.builder()
                .heapUsedBytes(heap.getUsed())
                .heapMaxBytes(heap.getMax())
                .heapCommittedBytes(heap.getCommitted())
                .availableProcessors(Runtime.getRuntime().availableProcessors())
                .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                .timestamp(now)
                .build();
    }

    @Override
    public synchronized void destroy() {
        responseTimes.clear();
        requestTimestamps.clear();
        thoughtTimestamps.clear();
        totalRequests = 0;
        successfulRequests = 0;
        failedRequests = 0;
        lastRequestTime = null;
        totalThoughts = 0;
        averageThoughtLength = 0;
        revisionCount = 0;
    }
}
