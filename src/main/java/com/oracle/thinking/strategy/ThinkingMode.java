package com.oracle.thinking.strategy;

import com.fasterxml.jackson.annotation.JsonValue;
import com.oracle.thinking.exception.ThoughtValidationException;

import java.util.Arrays;
import java.util.Locale;

public enum ThinkingMode {

    /** Linear, self-evaluating, concludes at a shallow target depth. */
    FAST,
    /** Balanced search with branching, backtracking and a convergence check. */
    EXPERT,
    /** Wide exploratory search with a strict convergence threshold. */
    DEEP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ThinkingMode from(String value) {
        return Arrays.stream(values())
                .filter(m -> value != null && m.value().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new ThoughtValidationException(
                        "Unknown thinking mode '" + value + "', expected fast, expert or deep"));
    }
}
