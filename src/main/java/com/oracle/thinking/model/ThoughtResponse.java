package com.oracle.thinking.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThoughtResponse {

    private Integer thoughtNumber;

    private Integer totalThoughts;

    private Boolean nextThoughtNeeded;

    @Builder.Default
    private List<String> branches = new ArrayList<>();

    private Integer thoughtHistoryLength;

    private String sessionId;

    private Long timestamp;

    private String nodeId;

    private String parentNodeId;

    private TreeStats treeStats;

    private ModeGuidance modeGuidance;
}
