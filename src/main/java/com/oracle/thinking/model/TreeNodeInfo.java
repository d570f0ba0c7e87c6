package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-facing view of a tree node.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreeNodeInfo {

    private String nodeId;

    private int thoughtNumber;

    private String thought;

    private int depth;

    private int visitCount;

    private double averageValue;

    private int childCount;

    private boolean terminal;

    private Double confidence;
}
