package com.example.triviaroom.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PlayerStatus {
    WAITING,
    READY,
    PLAYING,
    ANSWERED,
    DISCONNECTED,
    FINISHED;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
