package com.oracle.thinking.core;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Tracks last activity and a fixed-window thought count per session. Idle sessions are
 * evicted by a periodic sweep, and subscribers are told which ids went away so per-session
 * state elsewhere can follow.
 */
@Slf4j
public class SessionTracker {

    public static final int MAX_TRACKED_SESSIONS = 10_000;
    private static final int PROACTIVE_CLEANUP_THRESHOLD = (int) (MAX_TRACKED_SESSIONS * 0.9);
    private static final int EVICTION_HEADROOM = 100;

    private final Map<String, SessionState> sessions = new HashMap<>();
    private final List<Consumer<List<String>>> evictionListeners = new CopyOnWriteArrayList<>();
    private final List<Runnable> cleanupListeners = new CopyOnWriteArrayList<>();
    private final long sessionExpiryMs;
    private final long rateWindowMs;
    private final Clock clock;
    private final RepeatingTask sweep;

    public SessionTracker(long cleanupIntervalMs, long sessionExpiryMs, long rateWindowMs, Clock clock) {
        this.sessionExpiryMs = sessionExpiryMs;
        this.rateWindowMs = rateWindowMs;
        this.clock = clock;
        this.sweep = RepeatingTask.start("session-tracker-sweep", cleanupIntervalMs, this::cleanup);
    }

    public void onEviction(Consumer<List<String>> listener) {
        evictionListeners.add(listener);
    }

    public void onPeriodicCleanup(Runnable listener) {
        cleanupListeners.add(listener);
    }

    /**
     * Records one thought for the session regardless of its rate budget.
     */
    public void recordThought(String sessionId) {
        boolean crowded;
        synchronized (this) {
            long now = clock.millis();
            stateFor(sessionId, now).record(now, rateWindowMs);
            crowded = sessions.size() > PROACTIVE_CLEANUP_THRESHOLD;
        }
        if (crowded) {
            cleanup();
        }
    }

    /**
     * Records a thought only if the session is still under {@code maxPerWindow} in its current window.
     *
     * @return false when the budget is exhausted; nothing is recorded in that case
     */
    public boolean checkAndRecordThought(String sessionId, int maxPerWindow) {
        boolean crowded;
        synchronized (this) {
            long now = clock.millis();
            SessionState state = stateFor(sessionId, now);
            state.rollWindow(now, rateWindowMs);
            if (state.windowCount >= maxPerWindow) {
                return false;
            }
            state.record(now, rateWindowMs);
            crowded = sessions.size() > PROACTIVE_CLEANUP_THRESHOLD;
        }
        if (crowded) {
            cleanup();
        }
        return true;
    }

    public synchronized int getActiveSessionCount() {
        long cutoff = clock.millis() - sessionExpiryMs;
        return (int) sessions.values().stream().filter(s -> s.lastAccess >= cutoff).count();
    }

    public synchronized int getTrackedSessionCount() {
        return sessions.size();
    }

    public synchronized boolean isTracked(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    /**
     * Drops the given sessions and notifies eviction listeners of the ones that were tracked.
     */
    public void evict(List<String> sessionIds) {
        List<String> removed = new ArrayList<>();
        synchronized (this) {
            for (String id : sessionIds) {
                if (sessions.remove(id) != null) {
                    removed.add(id);
                }
            }
        }
        if (!removed.isEmpty()) {
            notifyEviction(removed);
        }
        log.debug("Evicted {} of {} requested sessions", removed.size(), sessionIds.size());
    }

    /**
     * Evicts idle sessions, then the least recently active ones above the hard ceiling,
     * then runs every periodic-cleanup listener.
     */
    public void cleanup() {
        List<String> expired = new ArrayList<>();
        synchronized (this) {
            long cutoff = clock.millis() - sessionExpiryMs;
            sessions.entrySet().removeIf(e -> {
                if (e.getValue().lastAccess < cutoff) {
                    expired.add(e.getKey());
                    return true;
                }
                return false;
            });

            if (sessions.size() >= MAX_TRACKED_SESSIONS) {
                int toEvict = sessions.size() - MAX_TRACKED_SESSIONS + EVICTION_HEADROOM;
                sessions.entrySet().stream()
                        .sorted(Comparator.comparingLong(e -> e.getValue().lastAccess))
                        .limit(toEvict)
                        .map(Map.Entry::getKey)
                        .toList()
                        .forEach(id -> {
                            sessions.remove(id);
                            expired.add(id);
                        });
            }
        }

        if (!expired.isEmpty()) {
            log.info("Evicted {} idle sessions", expired.size());
            notifyEviction(expired);
        }
        for (Runnable listener : cleanupListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.error("Periodic cleanup listener failed: {}", e.getMessage(), e);
            }
        }
    }

    public void destroy() {
        sweep.cancel();
        synchronized (this) {
            sessions.clear();
        }
        evictionListeners.clear();
        cleanupListeners.clear();
    }

    private void notifyEviction(List<String> ids) {
        List<String> snapshot = List.copyOf(ids);
        for (Consumer<List<String>> listener : evictionListeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                log.error("Session eviction listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private SessionState stateFor(String sessionId, long now) {
        return sessions.computeIfAbsent(sessionId, id -> new SessionState(now));
    }

    private static final class SessionState {
        private long lastAccess;
        private long windowStart;
        private int windowCount;

        private SessionState(long now) {
            this.lastAccess = now;
            this.windowStart = now;
        }

        private void rollWindow(long now, long windowMs) {
            if (now - windowStart >= windowMs) {
                windowStart = now;
                windowCount = 0;
            }
        }

        private void record(long now, long windowMs) {
            rollWindow(now, windowMs);
            windowCount++;
            lastAccess = now;
        }
    }
}
