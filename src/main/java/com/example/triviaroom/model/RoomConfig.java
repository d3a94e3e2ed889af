package com.example.triviaroom.model;

import java.util.Objects;

/** Immutable room settings chosen at creation time. timePerQuestion is in seconds. */
public record RoomConfig(
        String topic,
        Difficulty difficulty,
        int questionsPerRequest,
        int maxPlayers,
        GameMode gameMode,
        int timePerQuestion
) {
    public RoomConfig {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(difficulty, "difficulty");
        if (gameMode == null) gameMode = GameMode.QUESTION_LIMITED;
    }

    public long timePerQuestionMillis() {
        return timePerQuestion * 1000L;
    }
}
