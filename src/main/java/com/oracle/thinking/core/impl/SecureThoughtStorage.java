package com.oracle.thinking.core.impl;

import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.model.StorageStats;
import com.oracle.thinking.model.ThoughtRecord;

import java.util.List;
import java.util.UUID;

/**
 * Ingest boundary of the history: stores a private copy of every record, with a generated
 * anonymous session id when the caller supplied none. Reads hand out copies as well.
 */
public class SecureThoughtStorage implements ThoughtStorage {

    static final String ANONYMOUS_PREFIX = "anonymous-";

    private final BoundedThoughtManager manager;

    public SecureThoughtStorage(BoundedThoughtManager manager) {
        this.manager = manager;
    }

    @Override
    public ThoughtRecord addThought(ThoughtRecord record) {
        ThoughtRecord copy = record.toBuilder().build();
        if (copy.getSessionId() == null || copy.getSessionId().isEmpty()) {
            copy.setSessionId(ANONYMOUS_PREFIX + UUID.randomUUID());
        }
        return detach(manager.addThought(copy));
    }

    @Override
    public List<ThoughtRecord> getHistory() {
        return detachAll(manager.getHistory());
    }

    @Override
    public List<ThoughtRecord> getHistory(int limit) {
        return detachAll(manager.getHistory(limit));
    }

    @Override
    public List<String> getBranches() {
        return manager.getBranches();
    }

    @Override
    public List<ThoughtRecord> getBranch(String branchId) {
        return detachAll(manager.getBranch(branchId));
    }

    @Override
    public StorageStats getStats() {
        return manager.getStats();
    }

    @Override
    public void clearHistory() {
        manager.clearHistory();
    }

    @Override
    public void cleanup() {
        manager.cleanup();
    }

    @Override
    public void destroy() {
        manager.destroy();
    }

    private static ThoughtRecord detach(ThoughtRecord stored) {
        return stored.toBuilder().build();
    }

    private static List<ThoughtRecord> detachAll(List<ThoughtRecord> stored) {
        return stored.stream().map(SecureThoughtStorage::detach).toList();
    }
}
