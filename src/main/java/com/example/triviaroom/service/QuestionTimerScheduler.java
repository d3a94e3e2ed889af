package com.example.triviaroom.service;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.model.Player;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-room question timer. Each room owns at most one slot in the timer arena:
 * either the ticking task of the open question or the pending start of the next one.
 *
 * The tick runs every check interval (never past the deadline) and ends the question
 * when every connected player has answered or the time limit is reached. Ending is a
 * compare-and-set on the slot, so timeout, all-answered and forced ends run the handler once.
 */
@Component
public class QuestionTimerScheduler {

    private static final Logger log = LoggerFactory.getLogger(QuestionTimerScheduler.class);

    /** Why a question ended. */
    public enum EndReason {
        ALL_ANSWERED("all-answered"),
        TIMEOUT("timeout"),
        ERROR("error");

        private final String wire;

        EndReason(String wire) { this.wire = wire; }

        @JsonValue
        public String wire() { return wire; }
    }

    @FunctionalInterface
    public interface QuestionEndHandler {
        void onQuestionEnd(Room room, int questionIndex, EndReason reason);
    }

    /** One arena slot. questionIndex is -1 for the pause between questions. */
    static final class RoomTimer {
        final Room room;
        final int questionIndex;
        final long deadlineMillis;
        final QuestionEndHandler handler;
        final AtomicBoolean ending = new AtomicBoolean(false);
        volatile ScheduledFuture<?> future;

        RoomTimer(Room room, int questionIndex, long deadlineMillis, QuestionEndHandler handler) {
            this.room = room;
            this.questionIndex = questionIndex;
            this.deadlineMillis = deadlineMillis;
            this.handler = handler;
        }

        boolean isIntermission() { return questionIndex < 0; }

        void cancelFuture() {
            ScheduledFuture<?> f = future;
            if (f != null) f.cancel(false);
        }
    }

    private final ScheduledExecutorService executor;
    private final Map<String, RoomTimer> timers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long checkIntervalMs;

    public QuestionTimerScheduler(GameProperties props, Clock clock) {
        this.clock = clock;
        this.checkIntervalMs = Math.max(10, props.getCheckIntervalMs());
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(Math.max(1, props.getTimerThreads()), r -> {
            Thread t = new Thread(r, "question-timer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ========================================================================
    //  QUESTION TIMER
    // ========================================================================

    /** Starts the countdown of a question, replacing whatever the room's slot held. */
    public void startQuestion(Room room, int questionIndex, long timeLimitMs, QuestionEndHandler handler) {
        String roomId = room.getRoomId();
        RoomTimer timer = new RoomTimer(room, questionIndex, clock.millis() + timeLimitMs, handler);
        replace(roomId, timer);
        scheduleTick(timer, Math.min(checkIntervalMs, Math.max(0, timeLimitMs)));
        log.debug("TIMER start room={} question={} limitMs={}", roomId, questionIndex, timeLimitMs);
    }

    /** Re-runs the all-answered check off the caller's thread. */
    public void checkNow(String roomId) {
        RoomTimer timer = timers.get(roomId);
        if (timer == null || timer.isIntermission() || timer.ending.get()) return;
        try {
            executor.execute(() -> checkAllAnswered(timer));
        } catch (RejectedExecutionException e) {
            log.warn("TIMER check rejected room={} (shutting down)", roomId);
        }
    }

    /**
     * Ends the given question now if it is still open in the arena.
     * Returns true only for the caller that actually ran the end handler.
     */
    public boolean endNow(String roomId, int questionIndex, EndReason reason) {
        RoomTimer timer = timers.get(roomId);
        if (timer == null || timer.isIntermission() || timer.questionIndex != questionIndex) return false;
        return tryEnd(timer, reason);
    }

    private void scheduleTick(RoomTimer timer, long delayMs) {
        try {
            timer.future = executor.schedule(() -> tick(timer), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("TIMER tick rejected room={} (shutting down)", timer.room.getRoomId());
        }
    }

    private void tick(RoomTimer timer) {
        if (timer.ending.get() || timers.get(timer.room.getRoomId()) != timer) return;
        try {
            long remaining = timer.deadlineMillis - clock.millis();
            if (remaining <= 0) {
                tryEnd(timer, EndReason.TIMEOUT);
                return;
            }
            if (allAnswered(timer)) {
                tryEnd(timer, EndReason.ALL_ANSWERED);
                return;
            }
            scheduleTick(timer, Math.min(checkIntervalMs, remaining));
        } catch (RuntimeException e) {
            log.error("TIMER tick failed room={} question={}; forcing question end",
                    timer.room.getRoomId(), timer.questionIndex, e);
            tryEnd(timer, EndReason.ERROR);
        }
    }

    private void checkAllAnswered(RoomTimer timer) {
        try {
            if (allAnswered(timer)) tryEnd(timer, EndReason.ALL_ANSWERED);
        } catch (RuntimeException e) {
            log.error("TIMER check failed room={} question={}; forcing question end",
                    timer.room.getRoomId(), timer.questionIndex, e);
            tryEnd(timer, EndReason.ERROR);
        }
    }

    /** True when at least one connected player remains and all of them answered the open question. */
    private boolean allAnswered(RoomTimer timer) {
        Room room = timer.room;
        synchronized (room) {
            if (room.getStatus() != RoomStatus.PLAYING || !room.isQuestionOpen()) return false;
            if (room.getCurrentQuestionIndex() != timer.questionIndex) return false;
            String questionId = room.currentQuestion() == null ? null : room.currentQuestion().id();

            List<Player> active = room.getActivePlayers();
            if (active.isEmpty()) return false;
            for (Player p : active) {
                if (!p.hasAnswered(questionId)) return false;
            }
            return true;
        }
    }

    private boolean tryEnd(RoomTimer timer, EndReason reason) {
        if (!timer.ending.compareAndSet(false, true)) return false;
        timer.cancelFuture();
        timers.remove(timer.room.getRoomId(), timer);

        log.info("QUESTION END room={} question={} reason={}", timer.room.getRoomId(), timer.questionIndex, reason.wire());
        try {
            timer.handler.onQuestionEnd(timer.room, timer.questionIndex, reason);
        } catch (RuntimeException e) {
            log.error("QUESTION END handler failed room={} question={}", timer.room.getRoomId(), timer.questionIndex, e);
        }
        return true;
    }

    // ========================================================================
    //  BETWEEN QUESTIONS
    // ========================================================================

    /** Holds the room's slot with a delayed task (the next question's start). */
    public void scheduleNext(Room room, long delayMs, Runnable task) {
        String roomId = room.getRoomId();
        RoomTimer pause = new RoomTimer(room, -1, clock.millis() + delayMs, null);
        replace(roomId, pause);
        try {
            pause.future = executor.schedule(() -> {
                if (!timers.remove(roomId, pause)) return;
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("TIMER next-question task failed room={}", roomId, e);
                }
            }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            timers.remove(roomId, pause);
            log.warn("TIMER next-question rejected room={} (shutting down)", roomId);
        }
    }

    // ========================================================================
    //  CANCELLATION
    // ========================================================================

    public void cancel(String roomId) {
        if (roomId == null) return;
        RoomTimer t = timers.remove(roomId);
        if (t != null) {
            t.ending.set(true);
            t.cancelFuture();
            log.debug("TIMER cancel room={}", roomId);
        }
    }

    public void cancelAll() {
        for (String roomId : List.copyOf(timers.keySet())) cancel(roomId);
    }

    public boolean hasTimer(String roomId) {
        return timers.containsKey(roomId);
    }

    public boolean hasQuestionTimer(String roomId) {
        RoomTimer t = timers.get(roomId);
        return t != null && !t.isIntermission();
    }

    /** Milliseconds until the open question's deadline, or 0. */
    public long remainingMillis(String roomId) {
        RoomTimer t = timers.get(roomId);
        if (t == null || t.isIntermission()) return 0;
        return Math.max(0, t.deadlineMillis - clock.millis());
    }

    @PreDestroy
    public void shutdown() {
        cancelAll();
        executor.shutdownNow();
    }

    private void replace(String roomId, RoomTimer next) {
        RoomTimer previous = timers.put(roomId, next);
        if (previous != null && previous != next) {
            previous.ending.set(true);
            previous.cancelFuture();
        }
    }
}
