package com.oracle.thinking.core;

import com.oracle.thinking.model.StorageStats;
import com.oracle.thinking.model.ThoughtRecord;

import java.util.List;

/**
 * Authoritative linear history of admitted thoughts, bounded by count and by branch age.
 */
public interface ThoughtStorage {

    /**
     * Stores a copy of the record. The argument itself is never modified.
     *
     * @return the stored copy
     */
    ThoughtRecord addThought(ThoughtRecord record);

    /**
     * All retained thoughts, oldest first.
     */
    List<ThoughtRecord> getHistory();

    /**
     * The most recent {@code limit} thoughts, oldest first.
     */
    List<ThoughtRecord> getHistory(int limit);

    /**
     * Ids of the branches currently held.
     */
    List<String> getBranches();

    List<ThoughtRecord> getBranch(String branchId);

    StorageStats getStats();

    void clearHistory();

    void cleanup();

    void destroy();
}
