package com.oracle.thinking.core.impl;

import com.oracle.thinking.config.MctsConfig;
import com.oracle.thinking.core.ConfidenceAssessor;
import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtTreeService;
import com.oracle.thinking.exception.TreeException;
import com.oracle.thinking.model.BacktrackResult;
import com.oracle.thinking.model.EvaluationResult;
import com.oracle.thinking.model.ModeGuidance;
import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.ThinkingSummary;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.model.TreeNodeInfo;
import com.oracle.thinking.model.TreeRecordResult;
import com.oracle.thinking.model.TreeStats;
import com.oracle.thinking.strategy.SearchStrategy;
import com.oracle.thinking.strategy.ThinkingMode;
import com.oracle.thinking.strategy.ThinkingModeConfig;
import com.oracle.thinking.strategy.ThinkingModeEngine;
import com.oracle.thinking.tree.MctsEngine;
import com.oracle.thinking.tree.ThoughtNode;
import com.oracle.thinking.tree.ThoughtTree;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of per-session thought trees and thinking modes. Trees follow the session
 * lifecycle of the {@link SessionTracker}: when a session is evicted its tree and mode go too.
 */
@Slf4j
public class ThoughtTreeManager implements ThoughtTreeService {

    public static final int MAX_CONCURRENT_TREES = 100;

    private final MctsConfig config;
    private final MctsEngine engine;
    private final ThinkingModeEngine modeEngine;
    private final ConfidenceAssessor confidenceAssessor;
    private final Clock clock;
    private final Map<String, ThoughtTree> trees = new HashMap<>();
    private final Map<String, ThinkingModeConfig> modes = new HashMap<>();

    public ThoughtTreeManager(MctsConfig config, MctsEngine engine, ThinkingModeEngine modeEngine,
                              ConfidenceAssessor confidenceAssessor, SessionTracker sessionTracker, Clock clock) {
        this.config = config;
        this.engine = engine;
        this.modeEngine = modeEngine;
        this.confidenceAssessor = confidenceAssessor;
        this.clock = clock;
        sessionTracker.onEviction(this::removeSessions);
        sessionTracker.onPeriodicCleanup(this::cleanup);
    }

    @Override
    public synchronized TreeRecordResult recordThought(ThoughtRecord record) {
        String sessionId = record.getSessionId();
        if (!config.isEnableAutoTree() || sessionId == null || sessionId.isEmpty()) {
            return null;
        }
        ThoughtTree tree = getOrCreateTree(sessionId);
        ThoughtNode node = tree.addThought(record);
        assessConfidence(tree, node);

        ThinkingModeConfig mode = modes.get(sessionId);
        if (mode != null && mode.isAutoEvaluate()) {
            engine.backpropagate(tree, node.getNodeId(), mode.getAutoEvalValue());
        }

        TreeStats stats = engine.getTreeStats(tree);
        ModeGuidance guidance = mode == null ? null : modeEngine.generateGuidance(mode, tree, engine, stats);
        log.debug("Placed thought #{} as {} under {} in session {}",
                node.getThoughtNumber(), node.getNodeId(), node.getParentId(), sessionId);

        return TreeRecordResult.builder()
                .nodeId(node.getNodeId())
                .parentNodeId(node.getParentId())
                .treeStats(stats)
                .modeGuidance(guidance)
                .build();
    }

    // advisory only: a failing assessor leaves the node without a confidence score
    private void assessConfidence(ThoughtTree tree, ThoughtNode node) {
        List<ThoughtNode> path = tree.getAncestorPath(node.getNodeId());
        List<ThoughtNode> ancestors = path.subList(0, path.size() - 1);
        List<String> context = ancestors.stream().map(ThoughtNode::getThought).toList();
        Double previous = ancestors.isEmpty() ? null : ancestors.get(ancestors.size() - 1).getConfidence();
        try {
            node.setConfidence(confidenceAssessor.assess(node.getThought(), context, previous).getConfidence());
        } catch (RuntimeException e) {
            log.warn("Confidence assessment failed for node {}: {}", node.getNodeId(), e.getMessage());
        }
    }

    @Override
    public synchronized BacktrackResult backtrack(String sessionId, String nodeId) {
        ThoughtTree tree = getTree(sessionId);
        ThoughtNode node = tree.setCursor(nodeId);
        List<TreeNodeInfo> children = tree.getChildren(nodeId).stream().map(engine::toNodeInfo).toList();
        return BacktrackResult.builder()
                .node(engine.toNodeInfo(node))
                .children(children)
                .treeStats(engine.getTreeStats(tree))
                .build();
    }

    @Override
    public synchronized EvaluationResult evaluate(String sessionId, String nodeId, double value) {
        ThoughtTree tree = getTree(sessionId);
        ThoughtNode node = tree.getNode(nodeId);
        int updated = engine.backpropagate(tree, nodeId, value);
        return EvaluationResult.builder()
                .nodeId(nodeId)
                .newVisitCount(node.getVisitCount())
                .newAverageValue(node.getAverageValue())
                .nodesUpdated(updated)
                .treeStats(engine.getTreeStats(tree))
                .build();
    }

    @Override
    public synchronized Suggestion suggest(String sessionId, SearchStrategy strategy) {
        ThoughtTree tree = getTree(sessionId);
        ThinkingModeConfig mode = modes.get(sessionId);
        SearchStrategy effective = strategy != null ? strategy
                : mode != null ? mode.getSuggestStrategy() : SearchStrategy.BALANCED;
        double c = mode != null ? mode.getExplorationConstant() : engine.getExplorationConstant();
        Suggestion suggestion = engine.suggestNext(tree, effective, c);
        suggestion.setTreeStats(engine.getTreeStats(tree));
        return suggestion;
    }

    @Override
    public synchronized ThinkingSummary getSummary(String sessionId, Integer maxDepth) {
        ThoughtTree tree = getTree(sessionId);
        ThinkingModeConfig mode = modes.get(sessionId);
        return ThinkingSummary.builder()
                .bestPath(engine.extractBestPath(tree))
                .treeStructure(tree.toStructure(maxDepth))
                .treeStats(engine.getTreeStats(tree))
                .mode(mode == null ? null : mode.getMode().value())
                .build();
    }

    @Override
    public synchronized ThinkingModeConfig setMode(String sessionId, ThinkingMode mode) {
        getOrCreateTree(sessionId);
        ThinkingModeConfig preset = modeEngine.getPreset(mode);
        modes.put(sessionId, preset);
        log.info("Session {} switched to {} mode", sessionId, mode.value());
        return preset;
    }

    @Override
    public synchronized Optional<ThinkingModeConfig> getMode(String sessionId) {
        return Optional.ofNullable(modes.get(sessionId));
    }

    @Override
    public synchronized boolean hasTree(String sessionId) {
        return trees.containsKey(sessionId);
    }

    @Override
    public synchronized int getTreeCount() {
        return trees.size();
    }

    @Override
    public synchronized void removeSessions(Iterable<String> sessionIds) {
        for (String id : sessionIds) {
            trees.remove(id);
            modes.remove(id);
        }
    }

    /**
     * Drops trees idle for longer than the configured age, then the least recently used ones
     * above {@link #MAX_CONCURRENT_TREES}.
     */
    @Override
    public synchronized void cleanup() {
        long cutoff = clock.millis() - config.getMaxTreeAge();
        List<String> stale = trees.entrySet().stream()
                .filter(e -> e.getValue().getLastAccessed() < cutoff)
                .map(Map.Entry::getKey)
                .toList();
        removeSessions(stale);
        int evicted = evictOverflow(null);
        if (!stale.isEmpty() || evicted > 0) {
            log.info("Tree cleanup removed {} stale and {} overflow trees", stale.size(), evicted);
        }
    }

    @Override
    public synchronized void destroy() {
        trees.clear();
        modes.clear();
    }

    private ThoughtTree getTree(String sessionId) {
        ThoughtTree tree = trees.get(sessionId);
        if (tree == null) {
            throw TreeException.noTree(sessionId);
        }
        tree.touch();
        return tree;
    }

    private ThoughtTree getOrCreateTree(String sessionId) {
        ThoughtTree tree = trees.get(sessionId);
        if (tree == null) {
            tree = new ThoughtTree(sessionId, config.getMaxNodesPerTree(), clock);
            trees.put(sessionId, tree);
            evictOverflow(sessionId);
        }
        tree.touch();
        return tree;
    }

    private int evictOverflow(String keep) {
        int excess = trees.size() - MAX_CONCURRENT_TREES;
        if (excess <= 0) {
            return 0;
        }
        List<String> victims = trees.entrySet().stream()
                .filter(e -> !e.getKey().equals(keep))
                .sorted(Comparator.comparingLong(e -> e.getValue().getLastAccessed()))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList();
        removeSessions(victims);
        return victims.size();
    }
}
