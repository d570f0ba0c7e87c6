package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktrackResult {

    private TreeNodeInfo node;

    private List<TreeNodeInfo> children;

    private TreeStats treeStats;
}
