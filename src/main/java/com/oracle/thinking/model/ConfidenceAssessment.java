package com.oracle.thinking.model;

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
public class ConfidenceAssessment {

    private double confidence;

    @Builder.Default
    private List<String> factors = new ArrayList<>();
}
