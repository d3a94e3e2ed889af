package com.example.triviaroom.event;

import com.fasterxml.jackson.annotation.JsonValue;

/** Broadcast event types; the wire names are what clients switch on. */
public enum GameEventType {
    PLAYER_JOINED("player-joined"),
    PLAYER_LEFT("player-left"),
    GAME_STARTED("game-started"),
    QUESTION_STARTED("question-started"),
    ANSWER_RECEIVED("answer-received"),
    QUESTION_ENDED("question-ended"),
    GAME_ENDED("game-ended"),
    LEADERBOARD_UPDATE("leaderboard-update"),
    ROOM_UPDATED("room-updated");

    private final String wire;

    GameEventType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() { return wire; }
}
