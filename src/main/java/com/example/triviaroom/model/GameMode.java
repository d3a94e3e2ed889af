package com.example.triviaroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GameMode {
    QUESTION_LIMITED("question-limited"),
    TIME_LIMITED("time-limited"),
    UNLIMITED("unlimited");

    private final String wire;

    GameMode(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() { return wire; }

    @JsonCreator
    public static GameMode fromWire(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String v = raw.trim();
        for (GameMode m : values()) {
            if (m.wire.equalsIgnoreCase(v) || m.name().equalsIgnoreCase(v)) return m;
        }
        throw new IllegalArgumentException("Unknown game mode: " + raw);
    }
}
