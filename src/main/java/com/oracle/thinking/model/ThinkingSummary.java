package com.oracle.thinking.model;

import com.oracle.thinking.tree.TreeStructure;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThinkingSummary {

    private List<TreeNodeInfo> bestPath;

    private TreeStructure treeStructure;

    private TreeStats treeStats;

    private String mode;
}
