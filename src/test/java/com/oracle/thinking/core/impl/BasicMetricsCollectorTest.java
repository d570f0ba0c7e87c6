package com.oracle.thinking.core.impl;

import com.oracle.thinking.MutableClock;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.ThoughtRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BasicMetricsCollectorTest {

    private MutableClock clock;
    private SessionTracker tracker;
    private ThoughtStorage storage;
    private BasicMetricsCollector collector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(100_000L);
        tracker = mock(SessionTracker.class);
        storage = mock(ThoughtStorage.class);
        when(storage.getBranches()).thenReturn(List.of("a", "b"));
        when(tracker.getActiveSessionCount()).thenReturn(3);
        collector = new BasicMetricsCollector(tracker, storage, clock);
    }

    private static ThoughtRecord thought(String text, Boolean revision) {
        return ThoughtRecord.builder().thought(text).thoughtNumber(1).totalThoughts(1)
                .nextThoughtNeeded(false).revision(revision).build();
    }

    @Test
    void shouldCountRequests() {
        collector.recordRequest(10, true);
        collector.recordRequest(30, false);

        MetricsSnapshot.RequestMetrics requests = collector.getMetrics().getRequests();

        assertThat(requests.getTotalRequests()).isEqualTo(2);
        assertThat(requests.getSuccessfulRequests()).isEqualTo(1);
        assertThat(requests.getFailedRequests()).isEqualTo(1);
        assertThat(requests.getAverageResponseTime()).isEqualTo(20.0);
        assertThat(requests.getLastRequestTime()).isEqualTo(100_000L);
        assertThat(requests.getRequestsPerMinute()).isEqualTo(2);
    }

    @Test
    void shouldExcludeSamplesExactlyOneMinuteOld() {
        collector.recordRequest(5, true);
        clock.advance(60_000L);
        collector.recordRequest(5, true);

        assertThat(collector.getMetrics().getRequests().getRequestsPerMinute()).isEqualTo(1);
    }

    @Test
    void shouldDecayRatesWithoutNewSamples() {
        collector.recordThoughtProcessed(thought("abc", null));
        assertThat(collector.getMetrics().getThoughts().getThoughtsPerMinute()).isEqualTo(1);

        clock.advance(61_000L);

        assertThat(collector.getMetrics().getThoughts().getThoughtsPerMinute()).isZero();
        assertThat(collector.getMetrics().getThoughts().getTotalThoughts()).isEqualTo(1);
    }

    @Test
    void shouldTrackThoughtLengthAndRevisions() {
        collector.recordThoughtProcessed(thought("1234", null));
        collector.recordThoughtProcessed(thought("123456789", true));

        MetricsSnapshot.ThoughtMetrics thoughts = collector.getMetrics().getThoughts();

        assertThat(thoughts.getTotalThoughts()).isEqualTo(2);
        assertThat(thoughts.getAverageThoughtLength()).isEqualTo(7);
        assertThat(thoughts.getRevisionCount()).isEqualTo(1);
        assertThat(thoughts.getBranchCount()).isEqualTo(2);
        assertThat(thoughts.getActiveSessions()).isEqualTo(3);
    }

    @Test
    void shouldReportSystemMetrics() {
        MetricsSnapshot.SystemMetrics system = collector.getMetrics().getSystem();

        assertThat(system.getHeapUsedBytes()).isPositive();
        assertThat(system.getAvailableProcessors()).isPositive();
        assertThat(system.getTimestamp()).isEqualTo(100_000L);
    }

    @Test
    void shouldResetOnDestroy() {
        collector.recordRequest(10, true);
        collector.recordThoughtProcessed(thought("abc", true));

        collector.destroy();

        MetricsSnapshot snapshot = collector.getMetrics();
        assertThat(snapshot.getRequests().getTotalRequests()).isZero();
        assertThat(snapshot.getRequests().getLastRequestTime()).isNull();
        assertThat(snapshot.getRequests().getAverageResponseTime()).isZero();
        assertThat(snapshot.getThoughts().getTotalThoughts()).isZero();
        assertThat(snapshot.getThoughts().getRevisionCount()).isZero();
    }
}
