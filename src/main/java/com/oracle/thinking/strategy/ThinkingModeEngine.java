package com.oracle.thinking.strategy;

import com.oracle.thinking.model.ModeGuidance;
import com.oracle.thinking.model.ModeGuidance.Action;
import com.oracle.thinking.model.ModeGuidance.Phase;
import com.oracle.thinking.model.Suggestion;
import com.oracle.thinking.model.TreeNodeInfo;
import com.oracle.thinking.model.TreeStats;
import com.oracle.thinking.tree.MctsEngine;
import com.oracle.thinking.tree.ThoughtNode;
import com.oracle.thinking.tree.ThoughtTree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the state of a session tree into advice for the next step: which phase the search is
 * in, what to do next, and a prompt describing it.
 */
public class ThinkingModeEngine {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{(\\w+)}}");
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern FIRST_SENTENCE = Pattern.compile("^(.+?[.!?])(?:\\s|$)");

    private static final String FALLBACK_TEMPLATE =
            "{{action}} at step {{thoughtNumber}} (depth {{currentDepth}}/{{targetDepthMax}}). {{totalNodes}} nodes so far.";

    private static final Map<String, String> TEMPLATES = Map.ofEntries(
            Map.entry("fast_continue",
                    "Step {{thoughtNumber}} of about {{targetDepthMax}}. Take the next direct step after \"{{currentThought}}\" and stay linear."),
            Map.entry("fast_conclude",
                    "Target depth reached ({{currentDepth}}/{{targetDepthMax}}). Condense the {{totalNodes}} steps into a short answer."),
            Map.entry("fast_evaluate",
                    "Check the quality of step {{thoughtNumber}} (depth {{currentDepth}}/{{targetDepthMax}}). Current value {{cursorValue}}."),
            Map.entry("expert_continue",
                    "Step {{thoughtNumber}}, depth {{currentDepth}}/{{targetDepthMax}}, {{unexploredCount}} unscored. What follows from \"{{currentThought}}\"?"),
            Map.entry("expert_branch",
                    "Decision point at {{branchFromNodeId}} with {{branchCount}}/{{maxBranches}} alternatives. Try another angle, method or assumption than \"{{currentThought}}\"."),
            Map.entry("expert_evaluate",
                    "{{unexploredCount}} nodes are unscored. Evaluate them to steer the search. Best path so far: {{bestPathSummary}}."),
            Map.entry("expert_backtrack",
                    "This path scores {{cursorValue}}, under the threshold. Return to {{backtrackToNodeId}} (depth {{backtrackDepth}}) and find the assumption that went wrong."),
            Map.entry("expert_conclude",
                    "Converged at {{convergenceScore}} (threshold {{convergenceThreshold}}). Turn the best path {{bestPathSummary}} into a final answer."),
            Map.entry("deep_continue",
                    "Depth {{currentDepth}}/{{targetDepthMax}}, {{totalNodes}} nodes, {{unexploredCount}} unscored. Which edge case or deeper implication does \"{{currentThought}}\" hide?"),
            Map.entry("deep_branch",
                    "{{branchCount}}/{{maxBranches}} alternatives from {{branchFromNodeId}}. Branch with a contrarian or adversarial view of \"{{currentThought}}\"."),
            Map.entry("deep_evaluate",
                    "{{unexploredCount}} nodes unscored over {{leafCount}} leaves. Score them before checking convergence. Best path: {{bestPathSummary}}."),
            Map.entry("deep_backtrack",
                    "This path scores {{cursorValue}}. Return to {{backtrackToNodeId}} (depth {{backtrackDepth}}), find the weakest link and explore its opposite."),
            Map.entry("deep_conclude",
                    "Converged at {{convergenceScore}} (threshold {{convergenceThreshold}}) over {{totalNodes}} nodes. Summarize, answer the counterarguments and state your confidence.")
    );

    public ThinkingModeConfig getPreset(ThinkingMode mode) {
        return ThinkingModeConfig.preset(mode);
    }

    public ModeGuidance generateGuidance(ThinkingModeConfig config, ThoughtTree tree, MctsEngine engine, TreeStats stats) {
        List<TreeNodeInfo> bestPath = engine.extractBestPath(tree);
        int currentDepth = stats.getMaxDepth();
        int evaluated = stats.getTotalNodes() - stats.getUnexploredCount();

        ModeGuidance.ConvergenceStatus convergence = convergenceStatus(config, bestPath, evaluated);
        Phase phase = determinePhase(config, currentDepth, evaluated, convergence);
        ModeGuidance guidance = determineAction(config, tree, engine, phase, currentDepth, convergence);
        guidance.setConvergenceStatus(convergence);

        Map<String, Object> params = templateParams(config, tree, stats, bestPath, guidance);
        String template = TEMPLATES.getOrDefault(
                config.getMode().value() + "_" + guidance.getRecommendedAction().value(), FALLBACK_TEMPLATE);

        ThoughtNode cursor = tree.getCursor().orElse(null);
        guidance.setMode(config.getMode());
        guidance.setCurrentPhase(phase);
        guidance.setTargetTotalThoughts(config.getTargetDepthMax());
        guidance.setThoughtPrompt(render(template, params));
        guidance.setProgressOverview(progressOverview(config, tree, stats, bestPath));
        guidance.setCritique(critique(config, tree, stats, bestPath));
        guidance.setConfidenceScore(cursor == null ? null : cursor.getConfidence());
        guidance.setPerspectiveSuggestions(perspectives(guidance.getRecommendedAction(),
                stats.getTotalNodes() - stats.getTerminalCount(), cursor));
        return guidance;
    }

    ModeGuidance.ConvergenceStatus convergenceStatus(ThinkingModeConfig config, List<TreeNodeInfo> bestPath, int evaluated) {
        if (config.getConvergenceThreshold() == 0) {
            return null;
        }
        double bestPathValue = bestPath.isEmpty() ? 0 : bestPath.get(bestPath.size() - 1).getAverageValue();
        List<TreeNodeInfo> visited = bestPath.stream().filter(n -> n.getVisitCount() > 0).toList();
        double score = 0;
        if (!visited.isEmpty()) {
            double mean = visited.stream().mapToDouble(TreeNodeInfo::getAverageValue).average().orElse(0);
            // unexplored steps on the path hold the score down
            score = mean * visited.size() / bestPath.size();
        }
        boolean converged = evaluated >= config.getMinEvaluationsBeforeConverge()
                && score >= config.getConvergenceThreshold();
        return new ModeGuidance.ConvergenceStatus(converged, score, bestPathValue);
    }

    Phase determinePhase(ThinkingModeConfig config, int currentDepth, int evaluated,
                         ModeGuidance.ConvergenceStatus convergence) {
        if (convergence != null && convergence.isConverged()) {
            return Phase.CONCLUDED;
        }
        if (config.getMode() == ThinkingMode.FAST && currentDepth >= config.getTargetDepthMax()) {
            return Phase.CONCLUDED;
        }
        if (config.getConvergenceThreshold() > 0 && evaluated >= config.getMinEvaluationsBeforeConverge()) {
            return Phase.CONVERGING;
        }
        if (evaluated > 0 && currentDepth >= config.getTargetDepthMin()) {
            return Phase.EVALUATING;
        }
        return Phase.EXPLORING;
    }

    private ModeGuidance determineAction(ThinkingModeConfig config, ThoughtTree tree, MctsEngine engine,
                                         Phase phase, int currentDepth, ModeGuidance.ConvergenceStatus convergence) {
        boolean concluded = phase == Phase.CONCLUDED
                || (config.getConvergenceThreshold() == 0 && currentDepth >= config.getTargetDepthMax());
        if (concluded) {
            String detail = convergence != null
                    ? String.format(Locale.ROOT, "score %.2f, threshold %s", convergence.getScore(), config.getConvergenceThreshold())
                    : currentDepth + "/" + config.getTargetDepthMax();
            return action(Action.CONCLUDE, "Target reached (" + detail + "). Conclude in " + config.getMode().value() + " mode.");
        }

        ThoughtNode cursor = tree.getCursor().orElse(null);
        if (cursor == null) {
            return action(Action.CONTINUE, "No thoughts yet. Submit one to begin.");
        }

        ModeGuidance backtrack = checkBacktrack(config, tree, cursor, currentDepth);
        if (backtrack != null) {
            return backtrack;
        }
        ModeGuidance branch = checkBranch(config, tree, engine, cursor, currentDepth);
        if (branch != null) {
            return branch;
        }

        if (!config.isAutoEvaluate()) {
            long unevaluated = tree.getLeafNodes().stream().filter(n -> n.getVisitCount() == 0).count();
            if (unevaluated > 0) {
                return action(Action.EVALUATE, unevaluated + " leaf node(s) unevaluated. Score them to guide the search.");
            }
        }
        return action(Action.CONTINUE, "Keep exploring in " + config.getMode().value() + " mode (depth "
                + currentDepth + "/" + config.getTargetDepthMax() + ").");
    }

    private ModeGuidance checkBacktrack(ThinkingModeConfig config, ThoughtTree tree, ThoughtNode cursor, int currentDepth) {
        if (!config.isEnableBacktracking() || cursor.getVisitCount() == 0 || config.getBacktrackThreshold() <= 0) {
            return null;
        }
        double average = cursor.getAverageValue();
        boolean eligible = cursor.getChildCount() > 0 || currentDepth > 1;
        if (average >= config.getBacktrackThreshold() || !eligible) {
            return null;
        }
        List<ThoughtNode> path = tree.getAncestorPath(cursor.getNodeId());
        if (path.size() <= 1) {
            return null;
        }
        ThoughtNode target = path.get(0);
        for (int i = path.size() - 2; i >= 0; i--) {
            ThoughtNode ancestor = path.get(i);
            if (ancestor.getChildCount() > 1 || !ancestor.isTerminal()) {
                target = ancestor;
                break;
            }
        }
        ModeGuidance guidance = action(Action.BACKTRACK, String.format(Locale.ROOT,
                "Current path scores %.2f (threshold %s). Backtrack to explore alternatives.",
                average, config.getBacktrackThreshold()));
        guidance.setBacktrackSuggestion(new ModeGuidance.BacktrackSuggestion(target.getNodeId(), target.getDepth(),
                "Node at depth " + target.getDepth() + " has better potential for branching."));
        return guidance;
    }

    private ModeGuidance checkBranch(ThinkingModeConfig config, ThoughtTree tree, MctsEngine engine,
                                     ThoughtNode cursor, int currentDepth) {
        if (cursor.getChildCount() >= config.getMaxBranchingFactor() || cursor.isTerminal()
                || currentDepth < config.getBranchMinDepth()) {
            return null;
        }
        String from = cursor.getNodeId();
        if (config.isUseMctsForBranching()) {
            Suggestion suggestion = engine.suggestNext(tree, config.getSuggestStrategy(), config.getExplorationConstant());
            if (suggestion.getSuggestion() != null) {
                from = suggestion.getSuggestion().getNodeId();
            }
        }
        int remaining = config.getMaxBranchingFactor() - cursor.getChildCount();
        ModeGuidance guidance = action(Action.BRANCH, cursor.getChildCount() + "/" + config.getMaxBranchingFactor()
                + " branches explored in " + config.getMode().value() + " mode. Consider an alternative approach.");
        guidance.setBranchingSuggestion(new ModeGuidance.BranchingSuggestion(from,
                "Node has room for " + remaining + " more branches."));
        return guidance;
    }

    private static ModeGuidance action(Action action, String reasoning) {
        return ModeGuidance.builder().recommendedAction(action).reasoning(reasoning).build();
    }

    private Map<String, Object> templateParams(ThinkingModeConfig config, ThoughtTree tree, TreeStats stats,
                                               List<TreeNodeInfo> bestPath, ModeGuidance guidance) {
        Map<String, Object> params = new HashMap<>();
        ThoughtNode cursor = tree.getCursor().orElse(null);
        int maxLength = config.getMaxThoughtDisplayLength();

        params.put("action", guidance.getRecommendedAction().value());
        params.put("thoughtNumber", cursor == null ? 0 : cursor.getThoughtNumber());
        params.put("currentDepth", cursor == null ? 0 : cursor.getDepth());
        params.put("branchCount", cursor == null ? 0 : cursor.getChildCount());
        params.put("currentThought", cursor == null ? "(none)" : compress(cursor.getThought(), maxLength));
        params.put("cursorValue", cursor == null || cursor.getVisitCount() == 0
                ? "unscored" : String.format(Locale.ROOT, "%.2f", cursor.getAverageValue()));
        params.put("targetDepthMin", config.getTargetDepthMin());
        params.put("targetDepthMax", config.getTargetDepthMax());
        params.put("totalNodes", stats.getTotalNodes());
        params.put("unexploredCount", stats.getUnexploredCount());
        params.put("leafCount", tree.getLeafNodes().size());
        params.put("maxBranches", config.getMaxBranchingFactor());
        params.put("convergenceThreshold", config.getConvergenceThreshold());
        params.put("convergenceScore", guidance.getConvergenceStatus() == null
                ? "N/A" : String.format(Locale.ROOT, "%.2f", guidance.getConvergenceStatus().getScore()));
        params.put("bestPathSummary", bestPath.isEmpty() ? "(none)" : bestPath.stream()
                .map(n -> String.valueOf(n.getThoughtNumber())).collect(Collectors.joining(" -> ")));
        if (guidance.getBranchingSuggestion() != null) {
            params.put("branchFromNodeId", guidance.getBranchingSuggestion().getFromNodeId());
        }
        if (guidance.getBacktrackSuggestion() != null) {
            params.put("backtrackToNodeId", guidance.getBacktrackSuggestion().getToNodeId());
            params.put("backtrackDepth", guidance.getBacktrackSuggestion().getDepth());
        }
        return params;
    }

    static String render(String template, Map<String, Object> params) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Object value = params.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value == null ? "" : String.valueOf(value)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String progressOverview(ThinkingModeConfig config, ThoughtTree tree, TreeStats stats, List<TreeNodeInfo> bestPath) {
        int interval = config.getProgressOverviewInterval();
        if (interval <= 0 || stats.getTotalNodes() == 0 || stats.getTotalNodes() % interval != 0) {
            return null;
        }
        int evaluated = stats.getTotalNodes() - stats.getUnexploredCount();
        String summary = bestPath.isEmpty() ? "(none)" : bestPath.stream()
                .map(n -> firstSentence(n.getThought())).collect(Collectors.joining(" -> "));
        double score = bestPath.isEmpty() ? 0 : bestPath.get(bestPath.size() - 1).getAverageValue();
        long singleChild = bestPath.stream().filter(n -> n.getChildCount() == 1).count();
        return String.format(Locale.ROOT,
                "PROGRESS [%d thoughts, depth %d/%d]: evaluated %d/%d, leaves %d, terminal %d.%n"
                        + "Best path (score %.2f): %s.%n"
                        + "Gaps: %d unscored, %d single-child steps to expand.",
                stats.getTotalNodes(), stats.getMaxDepth(), config.getTargetDepthMax(), evaluated, stats.getTotalNodes(),
                tree.getLeafNodes().size(), stats.getTerminalCount(), score, summary,
                stats.getUnexploredCount(), singleChild);
    }

    private String critique(ThinkingModeConfig config, ThoughtTree tree, TreeStats stats, List<TreeNodeInfo> bestPath) {
        if (!config.isEnableCritique() || bestPath.size() < 2) {
            return null;
        }
        TreeNodeInfo weakest = null;
        for (TreeNodeInfo node : bestPath) {
            if (node.getVisitCount() > 0 && (weakest == null || node.getAverageValue() < weakest.getAverageValue())) {
                weakest = node;
            }
        }
        int unchallenged = 0;
        int totalChildren = 0;
        for (int i = 0; i < bestPath.size(); i++) {
            totalChildren += bestPath.get(i).getChildCount();
            if (i > 0 && tree.getNode(bestPath.get(i - 1).getNodeId()).getChildCount() == 1) {
                unchallenged++;
            }
        }
        int theoreticalMax = bestPath.size() * config.getMaxBranchingFactor();
        long coverage = theoreticalMax > 0 ? Math.round(100.0 * totalChildren / theoreticalMax) : 0;
        double balance = stats.getTotalNodes() > 0 ? (double) bestPath.size() / stats.getTotalNodes() : 0;
        String balanceLabel = balance > 0.8 ? "one-sided" : balance > 0.5 ? "moderate" : "well-balanced";

        String weakestLine = weakest == null
                ? "Weakest: n/a, nothing scored yet."
                : String.format(Locale.ROOT, "Weakest: step %d (score %.2f) \"%s\".",
                weakest.getThoughtNumber(), weakest.getAverageValue(), compress(weakest.getThought(), 60));
        return String.join("\n",
                "CRITIQUE: " + weakestLine,
                String.format(Locale.ROOT, "Unchallenged: %d/%d steps have no alternative. Coverage: %d/%d branches (%d%%).",
                        unchallenged, bestPath.size() - 1, totalChildren, theoreticalMax, coverage),
                String.format(Locale.ROOT, "Balance: %s, %d%% of nodes on the best path.",
                        balanceLabel, Math.round(balance * 100)));
    }

    /**
     * Offers perspectives when the search needs scoring or has fanned out. The starting
     * perspective rotates with the cursor's thought number so repeated calls vary.
     */
    private List<ModeGuidance.PerspectiveSuggestion> perspectives(Action action, int openNodes, ThoughtNode cursor) {
        boolean stuck = action == Action.EVALUATE || action == Action.BACKTRACK;
        if (!stuck && openNodes < 2) {
            return new ArrayList<>();
        }
        Perspective[] all = Perspective.values();
        int count = Math.min(openNodes + 1, all.length);
        int offset = cursor == null ? 0 : cursor.getThoughtNumber() % all.length;
        List<ModeGuidance.PerspectiveSuggestion> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Perspective p = all[(offset + i) % all.length];
            result.add(new ModeGuidance.PerspectiveSuggestion(p.value(), p.getDescription()));
        }
        return result;
    }

    static String compress(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        String[] sentences = SENTENCE_BREAK.split(text);
        if (sentences.length < 2) {
            return truncateAtWord(text, maxLength);
        }
        String combined = sentences[0] + " [...] " + sentences[sentences.length - 1];
        if (combined.length() <= maxLength) {
            return combined;
        }
        String firstOnly = sentences[0] + " [...]";
        if (firstOnly.length() <= maxLength) {
            return firstOnly;
        }
        return truncateAtWord(sentences[0], maxLength);
    }

    private static String firstSentence(String text) {
        Matcher matcher = FIRST_SENTENCE.matcher(text);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return text.length() <= 50 ? text : truncateAtWord(text, 50);
    }

    private static String truncateAtWord(String text, int maxLength) {
        int cutoff = Math.max(maxLength - 3, 1);
        int lastSpace = text.lastIndexOf(' ', cutoff);
        int breakAt = lastSpace > 0 ? lastSpace : Math.min(cutoff, text.length());
        return text.substring(0, breakAt) + "...";
    }
}
