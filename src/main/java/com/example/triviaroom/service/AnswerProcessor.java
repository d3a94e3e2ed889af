package com.example.triviaroom.service;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.event.GameEventType;
import com.example.triviaroom.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates and scores answers. The first submission per (player, question) wins;
 * replays are rejected with DUPLICATE_ANSWER and never change the player.
 */
@Service
public class AnswerProcessor {

    private static final Logger log = LoggerFactory.getLogger(AnswerProcessor.class);

    private final RoomRegistry registry;
    private final QuestionTimerScheduler timers;
    private final EventBroadcaster broadcaster;
    private final LeaderboardCalculator leaderboard;
    private final ScoreCalculator scoreCalculator;
    private final Clock clock;

    public AnswerProcessor(RoomRegistry registry,
                           QuestionTimerScheduler timers,
                           EventBroadcaster broadcaster,
                           LeaderboardCalculator leaderboard,
                           ScoreCalculator scoreCalculator,
                           Clock clock) {
        this.registry = registry;
        this.timers = timers;
        this.broadcaster = broadcaster;
        this.leaderboard = leaderboard;
        this.scoreCalculator = scoreCalculator;
        this.clock = clock;
    }

    /**
     * @param timeSpent client-reported seconds; the server-measured elapsed time wins if larger
     */
    public AnswerResult submitAnswer(String roomId, String userId, String questionId, int answerIndex, double timeSpent) {
        Room room = registry.find(roomId);
        AnswerResult result;

        synchronized (room) {
            Player player = room.getPlayer(userId);
            if (player == null) throw GameException.notInRoom(roomId, userId);
            if (room.getStatus() != RoomStatus.PLAYING) {
                throw GameException.invalidState("Room " + roomId + " is not playing (" + room.getStatus().wire() + ")");
            }

            TriviaQuestion q = room.currentQuestion();
            if (!room.isQuestionOpen() || q == null || !q.id().equals(questionId)) {
                throw new GameException(ErrorCode.QUESTION_MISMATCH,
                        "Question " + questionId + " is not the open question of room " + roomId);
            }
            if (player.hasAnswered(questionId)) {
                throw new GameException(ErrorCode.DUPLICATE_ANSWER,
                        "User " + userId + " already answered question " + questionId);
            }

            Instant now = clock.instant();
            boolean correct = q.isCorrect(answerIndex);
            double seconds = effectiveSeconds(room, timeSpent, now);
            Difficulty difficulty = (q.difficulty() != null) ? q.difficulty() : room.getConfig().difficulty();
            int earned = scoreCalculator.score(correct, difficulty, seconds, player.getCurrentStreak());

            player.recordAnswer(questionId, answerIndex, seconds, correct, earned, now);
            room.touch(now);

            List<LeaderboardEntry> board = leaderboard.rank(room.getPlayers());
            int answeredCount = 0;
            for (Player p : room.getPlayers()) {
                if (p.hasAnswered(questionId)) answeredCount++;
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", userId);
            data.put("questionId", questionId);
            data.put("isCorrect", correct);
            data.put("scoreEarned", earned);
            data.put("totalScore", player.getScore());
            data.put("answeredCount", answeredCount);
            data.put("activePlayers", room.getActivePlayers().size());
            broadcaster.broadcast(room, GameEventType.ANSWER_RECEIVED, data);

            Map<String, Object> update = new LinkedHashMap<>();
            update.put("leaderboard", board);
            broadcaster.broadcast(room, GameEventType.LEADERBOARD_UPDATE, update);

            log.info("ANSWER room={} user={} question={} correct={} earned={} seconds={}",
                    roomId, userId, questionId, correct, earned, seconds);
            result = new AnswerResult(roomId, questionId, correct, earned, board);
        }

        timers.checkNow(roomId);
        return result;
    }

    /** max(reported, measured), clamped to [0, timePerQuestion]. */
    double effectiveSeconds(Room room, double reported, Instant now) {
        double measured = 0;
        if (room.getCurrentQuestionStartTime() != null) {
            measured = Duration.between(room.getCurrentQuestionStartTime(), now).toMillis() / 1000.0;
        }
        double r = (Double.isNaN(reported) || reported < 0) ? 0 : reported;
        double limit = room.getConfig().timePerQuestion();
        return Math.min(limit, Math.max(0, Math.max(r, measured)));
    }
}
