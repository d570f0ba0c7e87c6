package com.oracle.thinking.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateRequest {

    @NotBlank(message = "Node id cannot be blank")
    private String nodeId;

    @NotNull(message = "Value is required")
    @DecimalMin(value = "0.0", message = "Value must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "Value must be between 0 and 1")
    private Double value;
}
