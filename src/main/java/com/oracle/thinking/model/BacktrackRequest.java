package com.oracle.thinking.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktrackRequest {

    @NotBlank(message = "Node id cannot be blank")
    private String nodeId;
}
