package com.example.triviaroom.view;

import com.example.triviaroom.model.Player;
import com.example.triviaroom.model.PlayerStatus;

import java.time.Instant;
import java.util.Objects;

/** Public player view; email is never broadcast. */
public record PlayerView(
        String userId,
        String displayName,
        int score,
        PlayerStatus status,
        boolean host,
        int answersSubmitted,
        int correctAnswers,
        boolean answered,
        Instant joinedAt
) {
    public static PlayerView from(Player p) {
        Objects.requireNonNull(p, "p");
        return new PlayerView(
                p.getUserId(),
                p.getDisplayName(),
                p.getScore(),
                p.getStatus(),
                p.isHost(),
                p.getAnswersSubmitted(),
                p.getCorrectAnswers(),
                p.getAnsweredQuestionId() != null,
                p.getJoinedAt());
    }
}
