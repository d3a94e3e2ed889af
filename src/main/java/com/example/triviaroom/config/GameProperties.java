package com.example.triviaroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties("app.game")
public class GameProperties {

  /** Seconds per question when the creator does not choose one. */
  private int defaultTimePerQuestion = 30;
  private int maxTimePerQuestion = 300;

  /** Cadence of the per-room question tick. */
  private long checkIntervalMs = 1000;

  /** Pause between QUESTION_ENDED and the next QUESTION_STARTED. */
  private long interQuestionDelayMs = 2000;

  /** How long a disconnected player keeps their seat. */
  private long reconnectGraceMs = 30_000;

  /** Allowed range for RoomConfig.maxPlayers. */
  private int minRoomSize = 2;
  private int maxRoomSize = 4;

  private int maxQuestionsPerRequest = 50;
  private int minPlayersToStart = 1;

  /** Threads of the question timer pool. */
  private int timerThreads = 2;

  private int settlementMaxAttempts = 3;

  /** Classpath location of the bundled question bank. */
  private String questionBank = "questions/question-bank.json";

  // --- getters/setters ---

  public int getDefaultTimePerQuestion() { return defaultTimePerQuestion; }
  public void setDefaultTimePerQuestion(int v) { this.defaultTimePerQuestion = v; }

  public int getMaxTimePerQuestion() { return maxTimePerQuestion; }
  public void setMaxTimePerQuestion(int v) { this.maxTimePerQuestion = v; }

  public long getCheckIntervalMs() { return checkIntervalMs; }
  public void setCheckIntervalMs(long v) { this.checkIntervalMs = v; }

  public long getInterQuestionDelayMs() { return interQuestionDelayMs; }
  public void setInterQuestionDelayMs(long v) { this.interQuestionDelayMs = v; }

  public long getReconnectGraceMs() { return reconnectGraceMs; }
  public void setReconnectGraceMs(long v) { this.reconnectGraceMs = v; }

  public int getMinRoomSize() { return minRoomSize; }
  public void setMinRoomSize(int v) { this.minRoomSize = v; }

  public int getMaxRoomSize() { return maxRoomSize; }
  public void setMaxRoomSize(int v) { this.maxRoomSize = v; }

  public int getMaxQuestionsPerRequest() { return maxQuestionsPerRequest; }
  public void setMaxQuestionsPerRequest(int v) { this.maxQuestionsPerRequest = v; }

  public int getMinPlayersToStart() { return minPlayersToStart; }
  public void setMinPlayersToStart(int v) { this.minPlayersToStart = v; }

  public int getTimerThreads() { return timerThreads; }
  public void setTimerThreads(int v) { this.timerThreads = v; }

  public int getSettlementMaxAttempts() { return settlementMaxAttempts; }
  public void setSettlementMaxAttempts(int v) { this.settlementMaxAttempts = v; }

  public String getQuestionBank() { return questionBank; }
  public void setQuestionBank(String questionBank) { this.questionBank = questionBank; }
}
