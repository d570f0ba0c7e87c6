package com.oracle.thinking.tree;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Serialized form of a thought tree: either a node with its children, or a marker standing
 * in for children cut off by a depth limit.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
public sealed interface TreeStructure permits TreeStructure.Node, TreeStructure.Truncated {

    @Value
    @Builder
    @JsonTypeName("node")
    final class Node implements TreeStructure {
        String nodeId;
        int thoughtNumber;
        String thought;
        int depth;
        int visitCount;
        double averageValue;
        boolean terminal;
        boolean cursor;
        int childCount;
        List<TreeStructure> children;
    }

    @Value
    @JsonTypeName("truncated")
    final class Truncated implements TreeStructure {
        int childCount;

        public String getMessage() {
            return childCount + " children truncated";
        }
    }
}
