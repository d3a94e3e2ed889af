package com.example.triviaroom.model;

/** One ranked row; a snapshot, detached from the live player. */
public record LeaderboardEntry(
        int rank,
        String userId,
        String displayName,
        int score,
        int correctAnswers,
        PlayerStatus status
) {
}
