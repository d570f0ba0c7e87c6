package com.oracle.thinking.service;

import com.oracle.thinking.config.ThinkingConfig;
import com.oracle.thinking.core.MetricsCollector;
import com.oracle.thinking.core.SecurityService;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtStorage;
import com.oracle.thinking.core.ThoughtTreeService;
import com.oracle.thinking.exception.ThoughtSecurityException;
import com.oracle.thinking.exception.ThoughtValidationException;
import com.oracle.thinking.model.BacktrackResult;
import com.oracle.thinking.model.EngineStats;
import com.oracle.thinking.model.EvaluationResult;
import com.oracle.thinking.model.MetricsSnapshot;
import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.ThinkingSummary;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.model.ThoughtResponse;
import com.oracle.thinking.model.TreeRecordResult;
import com.oracle.thinking.strategy.SearchStrategy;
import com.oracle.thinking.strategy.ThinkingMode;
import com.oracle.thinking.strategy.ThinkingModeConfig;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class SequentialThinkingService {

    private static final Pattern NODE_ID = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");

    private final ThinkingConfig thinkingConfig;
    private final ThoughtStorage storage;
    private final SecurityService security;
    private final ThoughtTreeService treeService;
    private final MetricsCollector metrics;
    private final SessionTracker sessionTracker;
    private final Validator validator;
    private final Clock clock;

    // one submit, backtrack, evaluate, mode switch or delete moves every component together
    private final Object stateLock = new Object();

    public ThoughtResponse submitThought(ThoughtRecord record) {
        validateRecord(record);
        return metered(() -> {
            synchronized (stateLock) {
                return recordThought(record);
            }
        });
    }

    private ThoughtResponse recordThought(ThoughtRecord record) {
        String sessionId = resolveSession(record.getSessionId());
        String sanitized = security.sanitizeContent(record.getThought());
        if (sanitized.isBlank()) {
            throw new ThoughtValidationException("Thought is empty after sanitization");
        }
        security.validateThought(sanitized, sessionId);

        ThoughtRecord stored = storage.addThought(record.toBuilder()
                .thought(sanitized)
                .sessionId(sessionId)
                .totalThoughts(Math.max(record.getTotalThoughts(), record.getThoughtNumber()))
                .build());
        TreeRecordResult placement = treeService.recordThought(stored);
        metrics.recordThoughtProcessed(stored);
        logThought(stored);

        ThoughtResponse.ThoughtResponseBuilder response = ThoughtResponse.builder()
                .thoughtNumber(stored.getThoughtNumber())
                .totalThoughts(stored.getTotalThoughts())
                .nextThoughtNeeded(stored.getNextThoughtNeeded())
                .branches(storage.getBranches())
                .thoughtHistoryLength(storage.getStats().getHistorySize())
                .sessionId(sessionId)
                .timestamp(stored.getTimestamp());
        if (placement != null) {
            response.nodeId(placement.getNodeId())
                    .parentNodeId(placement.getParentNodeId())
                    .treeStats(placement.getTreeStats())
                    .modeGuidance(placement.getModeGuidance());
        }
        return response.build();
    }

    public BacktrackResult backtrack(String sessionId, String nodeId) {
        requireSession(sessionId);
        requireNodeId(nodeId);
        return metered(() -> {
            synchronized (stateLock) {
                return treeService.backtrack(sessionId, nodeId);
            }
        });
    }

    public EvaluationResult evaluateNode(String sessionId, String nodeId, double value) {
        requireSession(sessionId);
        requireNodeId(nodeId);
        if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
            throw new ThoughtValidationException("Value must be between 0 and 1, got " + value,
                    Map.of("value", "must be between 0 and 1"));
        }
        return metered(() -> {
            synchronized (stateLock) {
                return treeService.evaluate(sessionId, nodeId, value);
            }
        });
    }

    public Suggestion suggestNext(String sessionId, String strategy) {
        requireSession(sessionId);
        SearchStrategy parsed = strategy == null || strategy.isBlank() ? null : SearchStrategy.from(strategy);
        return treeService.suggest(sessionId, parsed);
    }

    public ThinkingSummary getSummary(String sessionId, Integer maxDepth) {
        requireSession(sessionId);
        if (maxDepth != null && maxDepth < 0) {
            throw new ThoughtValidationException("maxDepth must not be negative",
                    Map.of("maxDepth", "must not be negative"));
        }
        return treeService.getSummary(sessionId, maxDepth);
    }

    public ThinkingModeConfig setThinkingMode(String sessionId, String mode) {
        requireSession(sessionId);
        ThinkingMode parsed = ThinkingMode.from(mode);
        return metered(() -> {
            synchronized (stateLock) {
                return treeService.setMode(sessionId, parsed);
            }
        });
    }

    /**
     * Most recent thoughts, oldest first, optionally narrowed to a session or a branch.
     */
    public List<ThoughtRecord> getHistory(String sessionId, String branchId, Integer limit) {
        if (limit != null && limit < 0) {
            throw new ThoughtValidationException("limit must not be negative", Map.of("limit", "must not be negative"));
        }
        List<ThoughtRecord> source = branchId != null && !branchId.isBlank()
                ? storage.getBranch(branchId)
                : storage.getHistory();
        if (sessionId != null && !sessionId.isBlank()) {
            source = source.stream().filter(r -> sessionId.equals(r.getSessionId())).toList();
        }
        if (limit != null && limit < source.size()) {
            source = source.subList(source.size() - limit, source.size());
        }
        return List.copyOf(source);
    }

    public EngineStats getStats() {
        return EngineStats.builder()
                .storage(storage.getStats())
                .security(security.getSecurityStatus())
                .activeTrees(treeService.getTreeCount())
                .activeSessions(sessionTracker.getActiveSessionCount())
                .build();
    }

    public MetricsSnapshot getMetrics() {
        return metrics.getMetrics();
    }

    /**
     * Forgets a session's rate window, tree and mode. History entries stay until they age out.
     */
    public void deleteSession(String sessionId) {
        requireSession(sessionId);
        synchronized (stateLock) {
            sessionTracker.evict(List.of(sessionId));
            // a session that only switched modes was never tracked, so drop its tree directly
            treeService.removeSessions(List.of(sessionId));
        }
        log.info("Session {} deleted", sessionId);
    }

    public void clearHistory() {
        storage.clearHistory();
    }

    private void validateRecord(ThoughtRecord record) {
        if (record == null) {
            throw new ThoughtValidationException("Thought record is required");
        }
        Set<ConstraintViolation<ThoughtRecord>> violations = validator.validate(record);
        if (!violations.isEmpty()) {
            Map<String, String> fieldErrors = violations.stream().collect(Collectors.toMap(
                    v -> v.getPropertyPath().toString(), ConstraintViolation::getMessage,
                    (first, second) -> first, LinkedHashMap::new));
            throw new ThoughtValidationException("Invalid thought record: " + String.join("; ", fieldErrors.values()),
                    fieldErrors);
        }
        if (record.getThought().length() > thinkingConfig.getMaxThoughtLength()) {
            throw new ThoughtValidationException("Thought exceeds maximum length of "
                    + thinkingConfig.getMaxThoughtLength() + " characters",
                    Map.of("thought", "too long"));
        }
        if (Boolean.TRUE.equals(record.getRevision()) && record.getRevisesThought() == null) {
            throw new ThoughtValidationException("isRevision requires revisesThought",
                    Map.of("revisesThought", "required when isRevision is true"));
        }
        if (record.getBranchFromThought() != null && (record.getBranchId() == null || record.getBranchId().isBlank())) {
            throw new ThoughtValidationException("branchFromThought requires branchId",
                    Map.of("branchId", "required when branchFromThought is set"));
        }
    }

    private String resolveSession(String sessionId) {
        if (sessionId == null) {
            return security.generateSessionId();
        }
        requireSession(sessionId);
        return sessionId;
    }

    private void requireSession(String sessionId) {
        if (!security.validateSession(sessionId)) {
            throw new ThoughtSecurityException("Invalid session id");
        }
    }

    private static void requireNodeId(String nodeId) {
        if (nodeId == null || !NODE_ID.matcher(nodeId).matches()) {
            throw new ThoughtValidationException("Invalid node id: " + nodeId, Map.of("nodeId", "invalid format"));
        }
    }

    private <T> T metered(Supplier<T> action) {
        long start = clock.millis();
        boolean success = false;
        try {
            T result = action.get();
            success = true;
            return result;
        } finally {
            metrics.recordRequest(clock.millis() - start, success);
        }
    }

    private void logThought(ThoughtRecord record) {
        String kind = Boolean.TRUE.equals(record.getRevision()) ? "revision of #" + record.getRevisesThought()
                : record.getBranchFromThought() != null ? "branch " + record.getBranchId() + " from #" + record.getBranchFromThought()
                : "thought";
        if (thinkingConfig.isEnableThoughtLogging()) {
            log.info("[{}] {}/{} ({}) {}", record.getSessionId(), record.getThoughtNumber(),
                    record.getTotalThoughts(), kind, record.getThought());
        } else {
            log.debug("[{}] {}/{} ({})", record.getSessionId(), record.getThoughtNumber(),
                    record.getTotalThoughts(), kind);
        }
    }
}
