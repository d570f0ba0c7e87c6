package com.oracle.thinking.core;

import com.oracle.thinking.model.ConfidenceAssessment;

import java.util.List;

public interface ConfidenceAssessor {

    /**
     * Scores how confident a thought reads, in [0, 1].
     *
     * @param thought            the thought being scored
     * @param context            earlier thoughts on the same path, oldest first
     * @param previousConfidence confidence of the preceding thought, or null
     */
    ConfidenceAssessment assess(String thought, List<String> context, Double previousConfidence);
}
