package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreeStats {

    private int totalNodes;

    private int maxDepth;

    private int unexploredCount;

    /**
     * Mean of the average values of visited nodes, 0 when nothing has been evaluated
     */
    private double averageValue;

    private int terminalCount;

    public static TreeStats empty() {
        return new TreeStats();
    }
}
