package com.example.triviaroom.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/** One player's final standing in a finished game. */
@Entity
@Table(
    name = "game_results",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_game_results_room_user", columnNames = {"roomId", "userId"})
    },
    indexes = {
        @Index(name = "idx_game_results_user", columnList = "userId"),
        @Index(name = "idx_game_results_finished_at", columnList = "finishedAt")
    }
)
public class GameResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(nullable = false, length = 8, updatable = false)
    private String roomId;

    @NotBlank
    @Size(max = 64)
    @Column(nullable = false, length = 64, updatable = false)
    private String userId;

    @Column(length = 100)
    private String displayName;

    @Column(length = 100)
    private String topic;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Difficulty difficulty;

    private int finalRank;
    private int score;
    private int correctAnswers;
    private int totalQuestions;
    private boolean winner;

    @Column(nullable = false)
    private Instant finishedAt;

    protected GameResult() {}

    public GameResult(String roomId, String userId) {
        this.roomId = roomId;
        this.userId = userId;
    }

    public Long getId() { return id; }

    public String getRoomId() { return roomId; }
    public String getUserId() { return userId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getTopic() { return topic; }
    public void setTopic(String topic) { this.topic = topic; }

    public Difficulty getDifficulty() { return difficulty; }
    public void setDifficulty(Difficulty difficulty) { this.difficulty = difficulty; }

    public int getFinalRank() { return finalRank; }
    public void setFinalRank(int finalRank) { this.finalRank = finalRank; }

    public int getScore() { return score; }
    public void setScore(int score) { this.score = score; }

    public int getCorrectAnswers() { return correctAnswers; }
    public void setCorrectAnswers(int correctAnswers) { this.correctAnswers = correctAnswers; }

    public int getTotalQuestions() { return totalQuestions; }
    public void setTotalQuestions(int totalQuestions) { this.totalQuestions = totalQuestions; }

    public boolean isWinner() { return winner; }
    public void setWinner(boolean winner) { this.winner = winner; }

    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }

    @Override
    public String toString() {
        return "GameResult{" +
                "roomId='" + roomId + '\'' +
                ", userId='" + userId + '\'' +
                ", rank=" + finalRank +
                ", score=" + score +
                ", winner=" + winner +
                '}';
    }
}
