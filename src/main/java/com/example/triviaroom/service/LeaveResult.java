package com.example.triviaroom.service;

import com.example.triviaroom.model.Room;
import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome of a leave; room is null once the room was closed. */
public record LeaveResult(String roomId, Status status, int remainingPlayers, Room room) {

    public enum Status {
        PLAYER_LEFT("player-left"),
        ROOM_CLOSED("room-closed");

        private final String wire;

        Status(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }
    }
}
