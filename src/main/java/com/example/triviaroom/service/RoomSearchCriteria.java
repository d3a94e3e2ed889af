package com.example.triviaroom.service;

import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;

/** Optional room filters; a null field matches everything. */
public record RoomSearchCriteria(String topic, Difficulty difficulty, Integer maxPlayers, RoomStatus status) {

    public static RoomSearchCriteria any() {
        return new RoomSearchCriteria(null, null, null, null);
    }

    /** Caller holds the room monitor. */
    boolean matches(Room room) {
        if (topic != null && !topic.isBlank() && !room.getConfig().topic().equalsIgnoreCase(topic.trim())) return false;
        if (difficulty != null && room.getConfig().difficulty() != difficulty) return false;
        if (maxPlayers != null && room.getConfig().maxPlayers() != maxPlayers) return false;
        return status == null || room.getStatus() == status;
    }
}
