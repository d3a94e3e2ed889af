package com.example.triviaroom.event;

import java.time.Instant;
import java.util.Map;

public record GameEvent(GameEventType type, String roomId, Instant timestamp, Map<String, Object> data) {

    public GameEvent {
        data = (data == null) ? Map.of() : data;
    }
}
