package com.example.triviaroom.model;

import java.time.Instant;
import java.util.Objects;

/** Player state inside one room. Room owners synchronize on the Room, so no locking here. */
public class Player {

    private final String userId;
    private final String email;
    private final String displayName;
    private final Instant joinedAt;

    private int score;
    private PlayerStatus status = PlayerStatus.WAITING;
    private boolean host = false;
    private int answersSubmitted;
    private int correctAnswers;
    private int currentStreak;          // consecutive correct answers
    private Integer currentAnswer;      // null => not answered this question
    private double timeSpent;           // seconds, current question
    private String answeredQuestionId;
    private int lastScoreEarned;
    private Instant lastActivity;

    public Player(String userId, String email, String displayName, Instant joinedAt) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.email = email;
        this.displayName = (displayName == null || displayName.isBlank()) ? userId : displayName.trim();
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
        this.lastActivity = joinedAt;
    }

    public static Player of(Identity identity, Instant joinedAt) {
        return new Player(identity.userId(), identity.email(), identity.displayName(), joinedAt);
    }

    // identity
    public String getUserId() { return userId; }
    public String getEmail() { return email; }
    public String getDisplayName() { return displayName; }
    public Instant getJoinedAt() { return joinedAt; }

    // scoring
    public int getScore() { return score; }
    public int getAnswersSubmitted() { return answersSubmitted; }
    public int getCorrectAnswers() { return correctAnswers; }
    public int getCurrentStreak() { return currentStreak; }
    public int getLastScoreEarned() { return lastScoreEarned; }

    // current question
    public Integer getCurrentAnswer() { return currentAnswer; }
    public double getTimeSpent() { return timeSpent; }
    public String getAnsweredQuestionId() { return answeredQuestionId; }

    // presence / roles
    public PlayerStatus getStatus() { return status; }
    public void setStatus(PlayerStatus status) { this.status = Objects.requireNonNull(status, "status"); }
    public boolean isDisconnected() { return status == PlayerStatus.DISCONNECTED; }

    public boolean isHost() { return host; }
    public void setHost(boolean host) { this.host = host; }

    public Instant getLastActivity() { return lastActivity; }
    public void touch(Instant now) { this.lastActivity = now; }

    public boolean hasAnswered(String questionId) {
        return questionId != null && questionId.equals(answeredQuestionId);
    }

    /** Resets per-game counters when a game starts. */
    public void resetForGame() {
        score = 0;
        answersSubmitted = 0;
        correctAnswers = 0;
        currentStreak = 0;
        resetForQuestion();
    }

    /** Clears the per-question answer slot; disconnected players stay disconnected. */
    public void resetForQuestion() {
        currentAnswer = null;
        timeSpent = 0;
        answeredQuestionId = null;
        lastScoreEarned = 0;
        if (status != PlayerStatus.DISCONNECTED) status = PlayerStatus.PLAYING;
    }

    /** Applies one accepted answer. The caller has already rejected duplicates. */
    public void recordAnswer(String questionId, int answerIndex, double seconds,
                             boolean correct, int earned, Instant now) {
        answeredQuestionId = questionId;
        currentAnswer = answerIndex;
        timeSpent = seconds;
        answersSubmitted++;
        lastScoreEarned = earned;
        if (correct) {
            score += earned;
            correctAnswers++;
            currentStreak++;
        } else {
            currentStreak = 0;
        }
        if (status != PlayerStatus.DISCONNECTED) status = PlayerStatus.ANSWERED;
        lastActivity = now;
    }

    /** Called at question end for players who never answered. */
    public void breakStreak() {
        currentStreak = 0;
    }

    @Override
    public String toString() {
        return "Player{" +
                "userId='" + userId + '\'' +
                ", score=" + score +
                ", status=" + status +
                ", host=" + host +
                ", answersSubmitted=" + answersSubmitted +
                ", correctAnswers=" + correctAnswers +
                '}';
    }
}
