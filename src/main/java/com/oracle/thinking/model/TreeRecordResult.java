package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TreeRecordResult {

    private String nodeId;

    private String parentNodeId;

    private TreeStats treeStats;

    private ModeGuidance modeGuidance;
}
