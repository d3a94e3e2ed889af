package com.example.triviaroom.persistence;

import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.LeaderboardEntry;

import java.time.Instant;
import java.util.List;

/** Immutable record of a finished game handed to settlement. */
public record FinishedGame(
        String roomId,
        String topic,
        Difficulty difficulty,
        int totalQuestions,
        Instant startedAt,
        Instant endedAt,
        String winnerId,
        List<LeaderboardEntry> leaderboard
) {
    public FinishedGame {
        leaderboard = (leaderboard == null) ? List.of() : List.copyOf(leaderboard);
    }
}
