package com.oracle.thinking.core;

import com.oracle.thinking.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SessionTrackerTest {

    private MutableClock clock;
    private SessionTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        tracker = new SessionTracker(0, 3_600_000L, 60_000L, clock);
    }

    @AfterEach
    void tearDown() {
        tracker.destroy();
    }

    @Test
    void shouldRefuseThoughtsBeyondRateLimitWithinWindow() {
        assertThat(tracker.checkAndRecordThought("s1", 2)).isTrue();
        assertThat(tracker.checkAndRecordThought("s1", 2)).isTrue();
        assertThat(tracker.checkAndRecordThought("s1", 2)).isFalse();

        assertThat(tracker.checkAndRecordThought("s2", 2)).isTrue();
    }

    @Test
    void shouldResetRateWindowOnExpiry() {
        tracker.checkAndRecordThought("s1", 1);
        assertThat(tracker.checkAndRecordThought("s1", 1)).isFalse();

        clock.advance(60_000L);

        assertThat(tracker.checkAndRecordThought("s1", 1)).isTrue();
    }

    @Test
    void shouldCountOnlyRecentlyActiveSessions() {
        tracker.recordThought("old");
        clock.advance(3_000_000L);
        tracker.recordThought("fresh");
        clock.advance(700_000L);

        assertThat(tracker.getActiveSessionCount()).isEqualTo(1);
    }

    @Test
    void shouldNotifyEvictionListenersForIdleSessions() {
        List<String> evicted = new ArrayList<>();
        AtomicInteger cleanups = new AtomicInteger();
        tracker.onEviction(evicted::addAll);
        tracker.onPeriodicCleanup(cleanups::incrementAndGet);

        tracker.recordThought("idle");
        clock.advance(3_600_001L);
        tracker.recordThought("busy");
        tracker.cleanup();

        assertThat(evicted).containsExactly("idle");
        assertThat(tracker.isTracked("idle")).isFalse();
        assertThat(tracker.isTracked("busy")).isTrue();
        assertThat(cleanups.get()).isEqualTo(1);
    }

    @Test
    void shouldKeepRunningListenersWhenOneFails() {
        AtomicInteger calls = new AtomicInteger();
        tracker.onPeriodicCleanup(() -> {
            throw new IllegalStateException("boom");
        });
        tracker.onPeriodicCleanup(calls::incrementAndGet);
        tracker.onEviction(ids -> {
            throw new IllegalStateException("boom");
        });
        tracker.onEviction(ids -> calls.incrementAndGet());

        tracker.recordThought("idle");
        clock.advance(3_600_001L);
        tracker.cleanup();

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void shouldNotifyListenersOnExplicitEviction() {
        List<String> evicted = new ArrayList<>();
        tracker.onEviction(evicted::addAll);
        tracker.recordThought("s1");

        tracker.evict(List.of("s1"));

        assertThat(evicted).containsExactly("s1");
        assertThat(tracker.getTrackedSessionCount()).isZero();
    }

    @Test
    void shouldOnlyReportTrackedSessionsOnEvict() {
        List<String> evicted = new ArrayList<>();
        AtomicInteger notifications = new AtomicInteger();
        tracker.onEviction(ids -> {
            notifications.incrementAndGet();
            evicted.addAll(ids);
        });
        tracker.recordThought("s1");

        tracker.evict(List.of("s1", "never-seen"));
        tracker.evict(List.of("never-seen"));

        assertThat(evicted).containsExactly("s1");
        assertThat(notifications.get()).isEqualTo(1);
    }

    @Test
    void shouldForgetEverythingOnDestroy() {
        tracker.recordThought("s1");

        tracker.destroy();
        tracker.destroy();

        assertThat(tracker.getTrackedSessionCount()).isZero();
    }
}
