package com.example.triviaroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Question difficulty with the base score a correct answer earns. */
public enum Difficulty {
    EASY(10),
    MEDIUM(20),
    HARD(30),
    CUSTOM(20);

    private final int baseScore;

    Difficulty(int baseScore) {
        this.baseScore = baseScore;
    }

    public int getBaseScore() { return baseScore; }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse; returns null for blank input and throws IllegalArgumentException for unknown values. */
    @JsonCreator
    public static Difficulty fromWire(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return Difficulty.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
