package com.example.triviaroom.service;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.event.GameEventType;
import com.example.triviaroom.model.*;
import com.example.triviaroom.persistence.FinishedGame;
import com.example.triviaroom.persistence.GameSettlementService;
import com.example.triviaroom.provider.QuestionProvider;
import com.example.triviaroom.service.QuestionTimerScheduler.EndReason;
import com.example.triviaroom.view.GameStateView;
import com.example.triviaroom.view.PlayerView;
import com.example.triviaroom.view.QuestionView;
import com.example.triviaroom.view.RoomView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Room lifecycle: WAITING → PLAYING → {FINISHED, CANCELLED}, plus WAITING → CANCELLED.
 * Drives the question loop (open, end, pause, next) and the end of the game.
 *
 * All mutation happens under the room monitor. The question fetch at start and the settlement
 * call at the end run outside it, and the room is re-checked once the lock is taken again.
 */
@Service
public class RoomStateMachine {

    private static final Logger log = LoggerFactory.getLogger(RoomStateMachine.class);

    private final RoomRegistry registry;
    private final RoomConnections connections;
    private final QuestionTimerScheduler timers;
    private final EventBroadcaster broadcaster;
    private final LeaderboardCalculator leaderboard;
    private final QuestionProvider questionProvider;
    private final GameSettlementService settlement;
    private final GameProperties props;
    private final Clock clock;

    public RoomStateMachine(RoomRegistry registry,
                            RoomConnections connections,
                            QuestionTimerScheduler timers,
                            EventBroadcaster broadcaster,
                            LeaderboardCalculator leaderboard,
                            QuestionProvider questionProvider,
                            GameSettlementService settlement,
                            GameProperties props,
                            Clock clock) {
        this.registry = registry;
        this.connections = connections;
        this.timers = timers;
        this.broadcaster = broadcaster;
        this.leaderboard = leaderboard;
        this.questionProvider = questionProvider;
        this.settlement = settlement;
        this.props = props;
        this.clock = clock;
    }

    // ========================================================================
    //  START
    // ========================================================================

    /** Host-only. Fetches the question batch, then moves the room to PLAYING and opens question 0. */
    public Room start(String roomId, String userId) {
        Room room = registry.find(roomId);
        RoomConfig config;

        synchronized (room) {
            requireHost(room, userId);
            if (room.getStatus() != RoomStatus.WAITING || room.isStartInFlight()) {
                throw GameException.invalidState("Room " + roomId + " cannot be started while " + room.getStatus().wire());
            }
            int present = room.getActivePlayers().size();
            if (present < props.getMinPlayersToStart()) {
                throw GameException.invalidState("Need at least " + props.getMinPlayersToStart() + " players to start");
            }
            room.setStartInFlight(true);
            config = room.getConfig();
        }

        List<TriviaQuestion> questions;
        try {
            questions = questionProvider.fetchQuestions(config.topic(), config.difficulty(), config.questionsPerRequest());
        } catch (GameException e) {
            clearStartInFlight(room);
            throw e;
        } catch (RuntimeException e) {
            clearStartInFlight(room);
            throw new GameException(ErrorCode.PROVIDER_UNAVAILABLE, "Question provider failed: " + e.getMessage(), e);
        }
        if (questions == null || questions.isEmpty()) {
            clearStartInFlight(room);
            throw new GameException(ErrorCode.PROVIDER_UNAVAILABLE, "Question provider returned no questions");
        }

        synchronized (room) {
            room.setStartInFlight(false);
            // the room may have been emptied or cancelled while we waited for the provider
            if (!registry.isRegistered(room) || room.getStatus() != RoomStatus.WAITING) {
                throw GameException.invalidState("Room " + roomId + " changed while loading questions");
            }

            Instant now = clock.instant();
            room.setQuestions(questions);
            room.setCurrentQuestionIndex(0);
            room.transitionTo(RoomStatus.PLAYING, now);
            room.setStartTime(now);
            for (Player p : room.getPlayers()) p.resetForGame();

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("room", RoomView.from(room));
            data.put("totalQuestions", questions.size());
            data.put("timePerQuestion", config.timePerQuestion());
            broadcaster.broadcast(room, GameEventType.GAME_STARTED, data);
            log.info("GAME started room={} host={} questions={}", roomId, userId, questions.size());

            openQuestion(room);
        }
        return room;
    }

    private void clearStartInFlight(Room room) {
        synchronized (room) {
            room.setStartInFlight(false);
        }
    }

    // ========================================================================
    //  QUESTION LOOP
    // ========================================================================

    /** Opens the question at the current index. Caller holds the room monitor. */
    private void openQuestion(Room room) {
        int index = room.getCurrentQuestionIndex();
        TriviaQuestion q = room.currentQuestion();
        Instant now = clock.instant();

        room.setCurrentQuestionStartTime(now);
        room.setQuestionOpen(true);
        room.touch(now);
        for (Player p : room.getPlayers()) p.resetForQuestion();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("question", QuestionView.hidden(q));
        data.put("questionIndex", index);
        data.put("totalQuestions", room.getQuestions().size());
        data.put("timeLimit", room.getConfig().timePerQuestion());
        broadcaster.broadcast(room, GameEventType.QUESTION_STARTED, data);

        timers.startQuestion(room, index, room.getConfig().timePerQuestionMillis(), this::endQuestion);
    }

    /**
     * Question end handler; the timer arena guarantees one call per question.
     * Publishes results, advances the index, then pauses before the next question or finishes the game.
     */
    void endQuestion(Room room, int questionIndex, EndReason reason) {
        FinishedGame finished = null;

        synchronized (room) {
            if (room.getStatus() != RoomStatus.PLAYING || !room.isQuestionOpen()
                    || room.getCurrentQuestionIndex() != questionIndex) {
                log.debug("QUESTION END ignored room={} question={} status={}",
                        room.getRoomId(), questionIndex, room.getStatus().wire());
                return;
            }
            room.setQuestionOpen(false);
            try {
                TriviaQuestion q = room.currentQuestion();

                List<Map<String, Object>> results = new ArrayList<>();
                for (Player p : room.getPlayers()) {
                    boolean answered = p.hasAnswered(q.id());
                    if (!answered) p.breakStreak();
                    Map<String, Object> r = new LinkedHashMap<>();
                    r.put("userId", p.getUserId());
                    r.put("answered", answered);
                    r.put("answer", answered ? p.getCurrentAnswer() : null);
                    r.put("isCorrect", answered && q.isCorrect(p.getCurrentAnswer()));
                    r.put("scoreEarned", answered ? p.getLastScoreEarned() : 0);
                    results.add(r);
                }

                Map<String, Object> data = new LinkedHashMap<>();
                data.put("questionId", q.id());
                data.put("questionIndex", questionIndex);
                data.put("correctAnswer", q.correctAnswerIndex());
                data.put("question", QuestionView.revealed(q));
                data.put("reason", reason.wire());
                data.put("results", results);
                data.put("leaderboard", leaderboard.rank(room.getPlayers()));
                broadcaster.broadcast(room, GameEventType.QUESTION_ENDED, data);

                int next = questionIndex + 1;
                room.setCurrentQuestionIndex(next);
                room.touch(clock.instant());

                if (next < room.getQuestions().size()) {
                    timers.scheduleNext(room, props.getInterQuestionDelayMs(), () -> beginNextQuestion(room, next));
                } else {
                    finished = finishUnderLock(room);
                }
            } catch (RuntimeException e) {
                log.error("QUESTION END failed room={} question={}; cancelling game", room.getRoomId(), questionIndex, e);
                abortUnderLock(room);
                return;
            }
        }

        if (finished != null) settle(room, finished);
    }

    private void beginNextQuestion(Room room, int index) {
        synchronized (room) {
            if (room.getStatus() != RoomStatus.PLAYING || room.isQuestionOpen()
                    || room.getCurrentQuestionIndex() != index) {
                return;
            }
            try {
                openQuestion(room);
            } catch (RuntimeException e) {
                log.error("QUESTION open failed room={} question={}; cancelling game", room.getRoomId(), index, e);
                abortUnderLock(room);
            }
        }
    }

    // ========================================================================
    //  FINISH
    // ========================================================================

    /** PLAYING → FINISHED. Caller holds the room monitor. */
    private FinishedGame finishUnderLock(Room room) {
        Instant now = clock.instant();
        room.transitionTo(RoomStatus.FINISHED, now);
        room.setEndTime(now);
        timers.cancel(room.getRoomId());

        for (Player p : room.getPlayers()) {
            if (!p.isDisconnected()) p.setStatus(PlayerStatus.FINISHED);
        }

        List<LeaderboardEntry> finalBoard = leaderboard.rank(room.getPlayers());
        Player winner = leaderboard.winner(room.getPlayers()).orElse(null);
        long durationMs = (room.getStartTime() == null) ? 0 : Duration.between(room.getStartTime(), now).toMillis();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("finalLeaderboard", finalBoard);
        data.put("winner", winner == null ? null : PlayerView.from(winner));
        data.put("gameDuration", durationMs);
        broadcaster.broadcast(room, GameEventType.GAME_ENDED, data);
        log.info("GAME finished room={} winner={} durationMs={}",
                room.getRoomId(), winner == null ? null : winner.getUserId(), durationMs);

        return new FinishedGame(room.getRoomId(), room.getConfig().topic(), room.getConfig().difficulty(),
                room.getQuestions().size(), room.getStartTime(), now,
                winner == null ? null : winner.getUserId(), finalBoard);
    }

    /** Runs settlement outside the lock, publishes the outcome and reaps the room. */
    private void settle(Room room, FinishedGame game) {
        boolean confirmed;
        try {
            settlement.settle(game);
            confirmed = true;
        } catch (RuntimeException e) {
            log.warn("SETTLE failed room={}; settlement left unconfirmed", room.getRoomId(), e);
            confirmed = false;
        }

        synchronized (room) {
            room.setSettlementConfirmed(confirmed);
            room.touch(clock.instant());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("status", room.getStatus());
            data.put("settlementConfirmed", confirmed);
            data.put("room", RoomView.from(room));
            broadcaster.broadcast(room, GameEventType.ROOM_UPDATED, data);
            reap(room);
        }
    }

    // ========================================================================
    //  CANCEL
    // ========================================================================

    /** Host-only cancel from WAITING or PLAYING. */
    public Room cancel(String roomId, String userId) {
        Room room = registry.find(roomId);
        synchronized (room) {
            requireHost(room, userId);
            cancelUnderLock(room, "host-cancelled");
            reap(room);
        }
        log.info("GAME cancelled room={} by={}", roomId, userId);
        return room;
    }

    /**
     * Called by ConnectionManager (under the room monitor) once the last player is gone.
     * Unfinished rooms are cancelled; every room is reaped.
     */
    void closeEmptyRoom(Room room) {
        if (room.getStatus().canTransitionTo(RoomStatus.CANCELLED)) {
            cancelUnderLock(room, "room-empty");
        } else {
            timers.cancel(room.getRoomId());
        }
        reap(room);
    }

    private void cancelUnderLock(Room room, String reason) {
        Instant now = clock.instant();
        room.transitionTo(RoomStatus.CANCELLED, now);
        room.setQuestionOpen(false);
        room.setEndTime(now);
        timers.cancel(room.getRoomId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", room.getStatus());
        data.put("reason", reason);
        data.put("room", RoomView.from(room));
        broadcaster.broadcast(room, GameEventType.ROOM_UPDATED, data);
    }

    /** Internal failure in the question loop: cancel if still possible and always reap. Caller holds the monitor. */
    private void abortUnderLock(Room room) {
        try {
            if (room.getStatus().canTransitionTo(RoomStatus.CANCELLED)) cancelUnderLock(room, "internal-error");
        } finally {
            room.setQuestionOpen(false);
            timers.cancel(room.getRoomId());
            reap(room);
        }
    }

    private void reap(Room room) {
        registry.remove(room.getRoomId());
        connections.releaseRoom(room.getRoomId());
    }

    // ========================================================================
    //  QUERIES
    // ========================================================================

    /** Derived state; the correct answer of the open question is never included. */
    public GameStateView gameState(Room room) {
        synchronized (room) {
            TriviaQuestion q = room.isQuestionOpen() ? room.currentQuestion() : null;

            Map<String, Integer> answers = new LinkedHashMap<>();
            Map<String, Integer> scores = new LinkedHashMap<>();
            for (Player p : room.getPlayers()) {
                if (q != null && p.hasAnswered(q.id())) answers.put(p.getUserId(), p.getCurrentAnswer());
                scores.put(p.getUserId(), p.getScore());
            }

            return new GameStateView(
                    room.getRoomId(),
                    QuestionView.hidden(q),
                    room.getCurrentQuestionIndex(),
                    room.getQuestions().size(),
                    timeRemaining(room),
                    answers,
                    scores,
                    leaderboard.rank(room.getPlayers()),
                    room.getStartTime());
        }
    }

    /** Whole seconds left on the open question. */
    long timeRemaining(Room room) {
        if (!room.isQuestionOpen() || room.getCurrentQuestionStartTime() == null) return 0;
        double elapsed = Duration.between(room.getCurrentQuestionStartTime(), clock.instant()).toMillis() / 1000.0;
        return Math.max(0, (long) Math.floor(room.getConfig().timePerQuestion() - elapsed));
    }

    private static void requireHost(Room room, String userId) {
        Player p = room.getPlayer(userId);
        if (p == null) throw GameException.notInRoom(room.getRoomId(), userId);
        if (!p.isHost()) {
            throw new GameException(ErrorCode.UNAUTHORIZED, "Only the host can do this in room " + room.getRoomId());
        }
    }
}
