package com.oracle.thinking.tree;

import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.TreeNodeInfo;
import com.oracle.thinking.model.TreeStats;
import com.oracle.thinking.strategy.SearchStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stateless UCB1 scoring over a {@link ThoughtTree}.
 */
public class MctsEngine {

    public static final double DEFAULT_EXPLORATION_CONSTANT = Math.sqrt(2);

    private final double explorationConstant;

    public MctsEngine() {
        this(DEFAULT_EXPLORATION_CONSTANT);
    }

    public MctsEngine(double explorationConstant) {
        this.explorationConstant = explorationConstant;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    /**
     * UCB1 score. Unvisited nodes score positive infinity so they are always tried first.
     */
    public double computeUcb1(int visits, double totalValue, int parentVisits, double c) {
        if (visits == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double exploitation = totalValue / visits;
        double exploration = c * Math.sqrt(Math.log(Math.max(parentVisits, 1)) / visits);
        return exploitation + exploration;
    }

    /**
     * Adds one visit and {@code value} to the node and each of its ancestors.
     *
     * @return number of nodes updated, always the node's depth plus one
     */
    public int backpropagate(ThoughtTree tree, String nodeId, double value) {
        int updated = 0;
        for (ThoughtNode node : tree.getAncestorPath(nodeId)) {
            node.recordVisit(value);
            updated++;
        }
        tree.touch();
        return updated;
    }

    public Suggestion suggestNext(ThoughtTree tree, SearchStrategy strategy) {
        return suggestNext(tree, strategy, explorationConstant);
    }

    /**
     * Scores every non-terminal node against its parent's visit count. The best becomes the
     * suggestion and the others are returned best-first as alternatives.
     */
    public Suggestion suggestNext(ThoughtTree tree, SearchStrategy strategy, double baseConstant) {
        double c = strategy.explorationConstant(baseConstant);
        List<Suggestion.Candidate> scored = new ArrayList<>();
        for (ThoughtNode node : tree.getExpandableNodes()) {
            int parentVisits = node.getParentId() == null
                    ? node.getVisitCount()
                    : tree.getNode(node.getParentId()).getVisitCount();
            double score = computeUcb1(node.getVisitCount(), node.getTotalValue(), parentVisits, c);
            scored.add(Suggestion.Candidate.builder()
                    .nodeId(node.getNodeId())
                    .thoughtNumber(node.getThoughtNumber())
                    .thought(node.getThought())
                    .ucb1Score(score)
                    .build());
        }
        // stable sort, ties keep insertion order
        scored.sort(Comparator.comparingDouble(Suggestion.Candidate::getUcb1Score).reversed());

        if (scored.isEmpty()) {
            return Suggestion.builder().strategy(strategy.value()).build();
        }
        Suggestion.Candidate best = scored.get(0);
        best.setReason(Double.isInfinite(best.getUcb1Score())
                ? "Unexplored node, maximum exploration value"
                : String.format("Highest UCB1 score (%.3f) under %s strategy", best.getUcb1Score(), strategy.value()));
        return Suggestion.builder()
                .suggestion(best)
                .alternatives(new ArrayList<>(scored.subList(1, scored.size())))
                .strategy(strategy.value())
                .build();
    }

    /**
     * Root-to-leaf path that always steps into the child with the highest average value.
     */
    public List<TreeNodeInfo> extractBestPath(ThoughtTree tree) {
        List<TreeNodeInfo> path = new ArrayList<>();
        ThoughtNode current = tree.getRoot().orElse(null);
        while (current != null) {
            path.add(toNodeInfo(current));
            ThoughtNode best = null;
            for (ThoughtNode child : tree.getChildren(current.getNodeId())) {
                if (best == null || child.getAverageValue() > best.getAverageValue()) {
                    best = child;
                }
            }
            current = best;
        }
        return path;
    }

    public TreeStats getTreeStats(ThoughtTree tree) {
        if (tree.isEmpty()) {
            return TreeStats.empty();
        }
        int maxDepth = 0;
        int unexplored = 0;
        int terminal = 0;
        int visited = 0;
        double valueSum = 0;
        for (ThoughtNode node : tree.getAllNodes()) {
            maxDepth = Math.max(maxDepth, node.getDepth());
            if (node.isTerminal()) {
                terminal++;
            }
            if (node.getVisitCount() == 0) {
                unexplored++;
            } else {
                visited++;
                valueSum += node.getAverageValue();
            }
        }
        return TreeStats.builder()
                .totalNodes(tree.size())
                .maxDepth(maxDepth)
                .unexploredCount(unexplored)
                .averageValue(visited == 0 ? 0.0 : valueSum / visited)
                .terminalCount(terminal)
                .build();
    }

    public TreeNodeInfo toNodeInfo(ThoughtNode node) {
        return TreeNodeInfo.builder()
                .nodeId(node.getNodeId())
                .thoughtNumber(node.getThoughtNumber())
                .thought(node.getThought())
                .depth(node.getDepth())
                .visitCount(node.getVisitCount())
                .averageValue(node.getAverageValue())
                .childCount(node.getChildCount())
                .terminal(node.isTerminal())
                .confidence(node.getConfidence())
                .build();
    }
}
