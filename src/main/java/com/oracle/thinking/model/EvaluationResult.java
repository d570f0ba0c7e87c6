package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationResult {

    private String nodeId;

    private int newVisitCount;

    private double newAverageValue;

    private int nodesUpdated;

    private TreeStats treeStats;
}
