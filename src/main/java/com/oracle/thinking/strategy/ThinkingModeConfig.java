package com.oracle.thinking.strategy;

import lombok.Builder;
import lombok.Value;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tuning attached to a session once a thinking mode is chosen.
 */
@Value
@Builder(toBuilder = true)
public class ThinkingModeConfig {

    ThinkingMode mode;

    /** UCB1 exploration constant used for this session's suggestions */
    double explorationConstant;

    SearchStrategy suggestStrategy;

    int maxBranchingFactor;

    int targetDepthMin;

    int targetDepthMax;

    /** Score each new node with {@link #autoEvalValue} as soon as it is admitted */
    boolean autoEvaluate;

    double autoEvalValue;

    boolean enableBacktracking;

    int minEvaluationsBeforeConverge;

    /** Zero disables convergence tracking */
    double convergenceThreshold;

    int progressOverviewInterval;

    int maxThoughtDisplayLength;

    boolean enableCritique;

    double backtrackThreshold;

    int branchMinDepth;

    /** Pick the branch origin with a UCB1 search instead of the cursor */
    boolean useMctsForBranching;

    private static final Map<ThinkingMode, ThinkingModeConfig> PRESETS = new EnumMap<>(ThinkingMode.class);

    static {
        PRESETS.put(ThinkingMode.FAST, ThinkingModeConfig.builder()
                .mode(ThinkingMode.FAST)
                .explorationConstant(0.5)
                .suggestStrategy(SearchStrategy.EXPLOIT)
                .maxBranchingFactor(1)
                .targetDepthMin(3)
                .targetDepthMax(5)
                .autoEvaluate(true)
                .autoEvalValue(0.7)
                .enableBacktracking(false)
                .minEvaluationsBeforeConverge(0)
                .convergenceThreshold(0)
                .progressOverviewInterval(3)
                .maxThoughtDisplayLength(150)
                .enableCritique(false)
                .backtrackThreshold(0)
                .branchMinDepth(Integer.MAX_VALUE)
                .useMctsForBranching(false)
                .build());
        PRESETS.put(ThinkingMode.EXPERT, ThinkingModeConfig.builder()
                .mode(ThinkingMode.EXPERT)
                .explorationConstant(Math.sqrt(2))
                .suggestStrategy(SearchStrategy.BALANCED)
                .maxBranchingFactor(3)
                .targetDepthMin(5)
                .targetDepthMax(10)
                .autoEvaluate(false)
                .autoEvalValue(0)
                .enableBacktracking(true)
                .minEvaluationsBeforeConverge(3)
                .convergenceThreshold(0.7)
                .progressOverviewInterval(4)
                .maxThoughtDisplayLength(250)
                .enableCritique(true)
                .backtrackThreshold(0.4)
                .branchMinDepth(2)
                .useMctsForBranching(false)
                .build());
        PRESETS.put(ThinkingMode.DEEP, ThinkingModeConfig.builder()
                .mode(ThinkingMode.DEEP)
                .explorationConstant(2.0)
                .suggestStrategy(SearchStrategy.EXPLORE)
                .maxBranchingFactor(5)
                .targetDepthMin(10)
                .targetDepthMax(20)
                .autoEvaluate(false)
                .autoEvalValue(0)
                .enableBacktracking(true)
                .minEvaluationsBeforeConverge(5)
                .convergenceThreshold(0.85)
                .progressOverviewInterval(5)
                .maxThoughtDisplayLength(300)
                .enableCritique(true)
                .backtrackThreshold(0.5)
                .branchMinDepth(0)
                .useMctsForBranching(true)
                .build());
    }

    public static ThinkingModeConfig preset(ThinkingMode mode) {
        return PRESETS.get(mode);
    }
}
