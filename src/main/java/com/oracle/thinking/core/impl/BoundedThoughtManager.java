package com.oracle.thinking.core.impl;

import com.oracle.thinking.config.ThinkingConfig;
import com.oracle.thinking.core.CircularBuffer;
import com.oracle.thinking.core.RepeatingTask;
import com.oracle.thinking.exception.ThoughtValidationException;
import com.oracle.thinking.model.StorageStats;
import com.oracle.thinking.model.ThoughtRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the main history in a ring buffer and each branch in its own capped sequence.
 * A periodic sweep drops branches that have gone quiet for longer than the configured age.
 */
@Slf4j
public class BoundedThoughtManager {

    static final long SESSION_ACTIVITY_TTL_MS = 3_600_000L;

    private final ThinkingConfig config;
    private final Clock clock;
    private final CircularBuffer<ThoughtRecord> history;
    private final Map<String, BranchData> branches = new LinkedHashMap<>();
    private final Map<String, Long> sessionActivity = new HashMap<>();
    private final RepeatingTask sweep;
    private boolean destroyed;

    public BoundedThoughtManager(ThinkingConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.history = new CircularBuffer<>(config.getMaxHistorySize());
        this.sweep = RepeatingTask.start("thought-history-sweep", config.getCleanupInterval(), this::cleanup);
    }

    /**
     * Appends a record the caller already owns; the record is stamped with the current time.
     */
    public synchronized ThoughtRecord addThought(ThoughtRecord record) {
        String thought = record.getThought();
        if (thought != null && thought.length() > config.getMaxThoughtLength()) {
            throw new ThoughtValidationException("Thought exceeds maximum length of "
                    + config.getMaxThoughtLength() + " characters");
        }
        long now = clock.millis();
        record.setTimestamp(now);
        history.add(record);

        if (record.getBranchId() != null && !record.getBranchId().isBlank()) {
            branches.computeIfAbsent(record.getBranchId(), id -> new BranchData(now))
                    .add(record, config.getMaxThoughtsPerBranch(), now);
        }
        if (record.getSessionId() != null) {
            sessionActivity.put(record.getSessionId(), now);
        }
        return record;
    }

    public synchronized List<ThoughtRecord> getHistory(int limit) {
        return history.getAll(limit);
    }

    public synchronized List<ThoughtRecord> getHistory() {
        return history.getAll();
    }

    public synchronized List<String> getBranches() {
        return new ArrayList<>(branches.keySet());
    }

    public synchronized List<ThoughtRecord> getBranch(String branchId) {
        BranchData branch = branches.get(branchId);
        return branch == null ? List.of() : new ArrayList<>(branch.thoughts);
    }

    public synchronized StorageStats getStats() {
        return StorageStats.builder()
                .historySize(history.size())
                .historyCapacity(history.capacity())
                .branchCount(branches.size())
                .sessionCount(sessionActivity.size())
                .oldestThought(history.getOldest().map(ThoughtRecord::getTimestamp).orElse(null))
                .newestThought(history.getNewest().map(ThoughtRecord::getTimestamp).orElse(null))
                .build();
    }

    public synchronized void clearHistory() {
        history.clear();
        branches.clear();
        sessionActivity.clear();
        log.info("Thought history cleared");
    }

    public synchronized void cleanup() {
        long now = clock.millis();
        int expired = 0;
        Iterator<Map.Entry<String, BranchData>> it = branches.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, BranchData> entry = it.next();
            BranchData branch = entry.getValue();
            if (now - branch.lastUpdated > config.getMaxBranchAge()) {
                it.remove();
                expired++;
            } else {
                branch.trim(config.getMaxThoughtsPerBranch());
            }
        }
        sessionActivity.values().removeIf(last -> now - last > SESSION_ACTIVITY_TTL_MS);
        if (expired > 0) {
            log.info("Removed {} expired branches", expired);
        }
    }

    public void destroy() {
        sweep.cancel();
        synchronized (this) {
            if (destroyed) {
                return;
            }
            destroyed = true;
            history.clear();
            branches.clear();
            sessionActivity.clear();
        }
    }

    private static final class BranchData {
        private final Deque<ThoughtRecord> thoughts = new ArrayDeque<>();
        private long lastUpdated;

        private BranchData(long now) {
            this.lastUpdated = now;
        }

        private void add(ThoughtRecord record, int maxThoughts, long now) {
            thoughts.addLast(record);
            lastUpdated = now;
            trim(maxThoughts);
        }

        private void trim(int maxThoughts) {
            while (thoughts.size() > maxThoughts) {
                thoughts.removeFirst();
            }
        }
    }
}
