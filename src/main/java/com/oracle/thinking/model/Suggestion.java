package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a UCB1 search over expandable nodes. {@code suggestion} is null when every node is terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Suggestion {

    private Candidate suggestion;

    @Builder.Default
    private List<Candidate> alternatives = new ArrayList<>();

    private String strategy;

    private TreeStats treeStats;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Candidate {
        private String nodeId;
        private int thoughtNumber;
        private String thought;
        private double ucb1Score;
        private String reason;
    }
}
