package com.example.triviaroom.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Room lifecycle. FINISHED and CANCELLED are terminal. */
public enum RoomStatus {
    WAITING,
    PLAYING,
    FINISHED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINISHED || this == CANCELLED;
    }

    public boolean canTransitionTo(RoomStatus next) {
        if (next == null) return false;
        switch (this) {
            case WAITING: return next == PLAYING || next == CANCELLED;
            case PLAYING: return next == FINISHED || next == CANCELLED;
            default:      return false;
        }
    }

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RoomStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) return null;
        return RoomStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
