package com.oracle.thinking.core;

import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.ThoughtRecord;

public interface MetricsCollector {

    void recordRequest(long durationMs, boolean success);

    void recordThoughtProcessed(ThoughtRecord record);

    MetricsSnapshot getMetrics();

    void destroy();
}
