package com.oracle.thinking.core.impl;

import com.oracle.thinking.core.ConfidenceAssessor;
import com.oracle.thinking.model.ConfidenceAssessment;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores confidence from wording alone: assertive and evidential phrasing raise it, hedges,
 * questions and admitted uncertainty lower it, and restating the previous thought costs a little.
 */
public class KeywordConfidenceAssessor implements ConfidenceAssessor {

    static final double BASE_CONFIDENCE = 0.7;
    static final double REPETITION_SIMILARITY = 0.7;

    private static final Pattern ASSERTIVE = Pattern.compile(
            "\\b(should|must|need|will|definitely|certainly)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEDGE = Pattern.compile(
            "\\b(maybe|perhaps|might|could|possibly|probably)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVIDENCE = Pattern.compile(
            "\\b(because|since|evidence|shown|demonstrated|proved)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNCERTAINTY = Pattern.compile(
            "\\b(not sure|don'?t know|unclear)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "but", "for", "with", "from", "are", "was", "were", "been", "have", "has", "had",
            "does", "did", "will", "would", "could", "should", "may", "might", "must", "can", "this", "that",
            "these", "those", "you", "they", "what", "which", "who", "when", "where", "why", "how", "all",
            "not", "only", "than", "too", "very", "just", "also", "then", "into", "about", "its");

    @Override
    public ConfidenceAssessment assess(String thought, List<String> context, Double previousConfidence) {
        List<String> factors = new ArrayList<>();
        double confidence = BASE_CONFIDENCE;

        if (ASSERTIVE.matcher(thought).find()) {
            confidence += 0.1;
            factors.add("assertive language");
        }
        if (HEDGE.matcher(thought).find()) {
            confidence -= 0.15;
            factors.add("hedging language");
        }
        if (EVIDENCE.matcher(thought).find()) {
            confidence += 0.1;
            factors.add("evidence-based");
        }
        if (thought.trim().endsWith("?")) {
            confidence -= 0.1;
            factors.add("question form");
        }
        if (UNCERTAINTY.matcher(thought).find()) {
            confidence -= 0.2;
            factors.add("explicit uncertainty");
        }

        if (previousConfidence != null && !context.isEmpty()) {
            double similarity = jaccard(tokenize(thought), tokenize(context.get(context.size() - 1)));
            if (similarity > REPETITION_SIMILARITY && previousConfidence > 0.6) {
                confidence -= 0.1;
                factors.add("repetitive content");
            }
        }

        return ConfidenceAssessment.builder()
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .factors(factors)
                .build();
    }

    static Set<String> tokenize(String text) {
        return Arrays.stream(NON_WORD.split(text.toLowerCase(Locale.ROOT)))
                .filter(w -> w.length() > 2 && !STOP_WORDS.contains(w))
                .collect(Collectors.toSet());
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }
}
