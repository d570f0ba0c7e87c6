package com.oracle.thinking.core;

import com.oracle.thinking.model.BacktrackResult;
import com.oracle.thinking.model.EvaluationResult;
import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.ThinkingSummary;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.model.TreeRecordResult;
import com.oracle.thinking.strategy.SearchStrategy;
import com.oracle.thinking.strategy.ThinkingMode;
import com.oracle.thinking.strategy.ThinkingModeConfig;

import java.util.Optional;

/**
 * Per-session thought trees. Operations on a session without a tree fail with
 * {@link com.oracle.thinking.exception.TreeException}.
 */
public interface ThoughtTreeService {

    /**
     * Places the record in its session's tree.
     *
     * @return placement details, or null when tree building is off or the record has no session id
     */
    TreeRecordResult recordThought(ThoughtRecord record);

    BacktrackResult backtrack(String sessionId, String nodeId);

    EvaluationResult evaluate(String sessionId, String nodeId, double value);

    /**
     * @param strategy null selects the session mode's strategy, or balanced without a mode
     */
    Suggestion suggest(String sessionId, SearchStrategy strategy);

    ThinkingSummary getSummary(String sessionId, Integer maxDepth);

    ThinkingModeConfig setMode(String sessionId, ThinkingMode mode);

    Optional<ThinkingModeConfig> getMode(String sessionId);

    boolean hasTree(String sessionId);

    int getTreeCount();

    void removeSessions(Iterable<String> sessionIds);

    void cleanup();

    void destroy();
}
