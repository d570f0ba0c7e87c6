package com.oracle.thinking.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.oracle.thinking.exception.ThoughtValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * How strongly the UCB1 search favours unexplored nodes over proven ones.
 */
public enum SearchStrategy {

    EXPLORE(2.0),
    EXPLOIT(0.0),
    BALANCED(1.0);

    private final double explorationScale;

    SearchStrategy(double explorationScale) {
        this.explorationScale = explorationScale;
    }

    public double explorationConstant(double base) {
        return base * explorationScale;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SearchStrategy from(String value) {
        if (value == null || value.isBlank()) {
            return BALANCED;
        }
        return Arrays.stream(values())
                .filter(s -> s.value().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new ThoughtValidationException(
                        "Unknown strategy '" + value + "', expected explore, exploit or balanced"));
    }
}
