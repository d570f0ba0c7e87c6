package com.oracle.thinking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.oracle.thinking.strategy.ThinkingMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Mode-specific advice returned alongside an admitted thought.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModeGuidance {

    private ThinkingMode mode;

    private Phase currentPhase;

    private Action recommendedAction;

    private String reasoning;

    private int targetTotalThoughts;

    private ConvergenceStatus convergenceStatus;

    private BranchingSuggestion branchingSuggestion;

    private BacktrackSuggestion backtrackSuggestion;

    private String thoughtPrompt;

    private String progressOverview;

    private String critique;

    private Double confidenceScore;

    @Builder.Default
    private List<PerspectiveSuggestion> perspectiveSuggestions = new ArrayList<>();

    public enum Phase {
        EXPLORING, EVALUATING, CONVERGING, CONCLUDED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public enum Action {
        CONTINUE, BRANCH, EVALUATE, BACKTRACK, CONCLUDE;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConvergenceStatus {
        private boolean converged;
        private double score;
        private double bestPathValue;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BranchingSuggestion {
        private String fromNodeId;
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BacktrackSuggestion {
        private String toNodeId;
        private int depth;
        private String reason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PerspectiveSuggestion {
        private String perspective;
        private String description;
    }
}
