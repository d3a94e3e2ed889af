package com.example.triviaroom.view;

import com.example.triviaroom.model.LeaderboardEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Derived game state for late joiners and reconnecting clients.
 * playersAnswers maps userId to the chosen index for the current question (absent = not answered).
 */
public record GameStateView(
        String roomId,
        QuestionView currentQuestion,
        int currentQuestionIndex,
        int totalQuestions,
        long timeRemaining,
        Map<String, Integer> playersAnswers,
        Map<String, Integer> playersScores,
        List<LeaderboardEntry> leaderboard,
        Instant startedAt
) {
}
