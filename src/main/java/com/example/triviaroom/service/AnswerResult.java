package com.example.triviaroom.service;

import com.example.triviaroom.model.LeaderboardEntry;

import java.util.List;

public record AnswerResult(
        String roomId,
        String questionId,
        boolean isCorrect,
        int scoreEarned,
        List<LeaderboardEntry> leaderboard
) {
}
