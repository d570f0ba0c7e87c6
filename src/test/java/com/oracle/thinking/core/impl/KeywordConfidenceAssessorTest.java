package com.oracle.thinking.core.impl;

import com.oracle.thinking.model.ConfidenceAssessment;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class KeywordConfidenceAssessorTest {

    private final KeywordConfidenceAssessor assessor = new KeywordConfidenceAssessor();

    @Test
    void shouldStartFromBaseForNeutralText() {
        ConfidenceAssessment result = assessor.assess("The cache holds recent entries.", List.of(), null);

        assertThat(result.getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(result.getFactors()).isEmpty();
    }

    @Test
    void shouldRaiseForAssertiveEvidence() {
        ConfidenceAssessment result = assessor.assess(
                "We must index the column because the benchmark demonstrated it.", List.of(), null);

        assertThat(result.getConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(result.getFactors()).containsExactly("assertive language", "evidence-based");
    }

    @Test
    void shouldLowerForHedgedQuestion() {
        ConfidenceAssessment result = assessor.assess("Maybe the lock is the culprit?", List.of(), null);

        assertThat(result.getConfidence()).isCloseTo(0.45, within(1e-9));
        assertThat(result.getFactors()).containsExactly("hedging language", "question form");
    }

    @Test
    void shouldClampAtZero() {
        ConfidenceAssessment result = assessor.assess(
                "Perhaps, I am not sure and it is unclear, maybe?", List.of(), null);

        assertThat(result.getConfidence()).isBetween(0.0, 1.0);
        assertThat(result.getFactors()).contains("explicit uncertainty");
    }

    @Test
    void shouldPenalizeRepeatingConfidentPredecessor() {
        String previous = "Database latency dominates request handling time";

        ConfidenceAssessment repeated = assessor.assess(
                "Database latency dominates request handling time", List.of(previous), 0.8);
        ConfidenceAssessment lowPrior = assessor.assess(
                "Database latency dominates request handling time", List.of(previous), 0.5);

        assertThat(repeated.getFactors()).contains("repetitive content");
        assertThat(repeated.getConfidence()).isCloseTo(0.6, within(1e-9));
        assertThat(lowPrior.getFactors()).doesNotContain("repetitive content");
    }

    @Test
    void shouldIgnoreShortAndStopWords() {
        assertThat(KeywordConfidenceAssessor.tokenize("The API is on fire, and the DB too"))
                .containsExactlyInAnyOrder("api", "fire");
        assertThat(KeywordConfidenceAssessor.jaccard(Set.of("a", "b"), Set.of("b", "c"))).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(KeywordConfidenceAssessor.jaccard(Set.of(), Set.of())).isZero();
    }
}
