package com.oracle.thinking.strategy;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Angles offered to the caller when a line of reasoning stalls.
 */
public enum Perspective {

    OPTIMIST("What are the best possible outcomes and opportunities?"),
    PESSIMIST("What could go wrong and what are the risks?"),
    EXPERT("What would a domain expert recognize immediately?"),
    BEGINNER("What basic questions would a newcomer ask?"),
    SKEPTIC("Which assumptions might be wrong?");

    private final String description;

    Perspective(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
