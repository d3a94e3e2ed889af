package com.example.triviaroom.service;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.model.Player;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;
import com.example.triviaroom.service.QuestionTimerScheduler.EndReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class QuestionTimerSchedulerTest {

    private MutableClock clock;
    private QuestionTimerScheduler timers;
    private Room room;

    private final AtomicInteger endCalls = new AtomicInteger();
    private final AtomicReference<EndReason> lastReason = new AtomicReference<>();
    private final CountDownLatch ended = new CountDownLatch(1);

    private final QuestionTimerScheduler.QuestionEndHandler handler = (r, idx, reason) -> {
        endCalls.incrementAndGet();
        lastReason.set(reason);
        ended.countDown();
    };

    @BeforeEach
    void setUp() {
        GameProperties props = new GameProperties();
        props.setCheckIntervalMs(20);
        clock = new MutableClock(TestEngine.T0);
        timers = new QuestionTimerScheduler(props, clock);

        room = new Room("ROOM0001", TestEngine.config(4, 10, 2), TestEngine.T0);
        room.addPlayer(new Player("alice", "alice@example.com", "alice", TestEngine.T0));
        room.addPlayer(new Player("bob", "bob@example.com", "bob", TestEngine.T0.plusSeconds(1)));
        room.setQuestions(TestEngine.questions(2));
        room.transitionTo(RoomStatus.PLAYING, TestEngine.T0);
        room.setQuestionOpen(true);
        for (Player p : room.getPlayers()) p.resetForGame();
    }

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    @Test
    @DisplayName("deadline reached: handler runs once with TIMEOUT")
    void timeout() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);
        Thread.sleep(100);
        assertEquals(0, endCalls.get(), "clock has not moved");

        clock.advanceSeconds(11);
        assertTrue(ended.await(2, TimeUnit.SECONDS));
        Thread.sleep(100);

        assertEquals(1, endCalls.get());
        assertEquals(EndReason.TIMEOUT, lastReason.get());
        assertFalse(timers.hasTimer(room.getRoomId()));
    }

    @Test
    @DisplayName("every connected player answered: checkNow ends with ALL_ANSWERED")
    void allAnswered() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);
        Instant now = clock.instant();
        synchronized (room) {
            room.getPlayer("alice").recordAnswer("q1", 1, 1, true, 20, now);
        }
        timers.checkNow(room.getRoomId());
        Thread.sleep(100);
        assertEquals(0, endCalls.get(), "bob is still thinking");

        synchronized (room) {
            room.getPlayer("bob").recordAnswer("q1", 0, 1, false, 0, now);
        }
        timers.checkNow(room.getRoomId());

        assertTrue(ended.await(2, TimeUnit.SECONDS));
        assertEquals(EndReason.ALL_ANSWERED, lastReason.get());
    }

    @Test
    @DisplayName("a disconnected player does not block the all-answered check")
    void disconnectedPlayerIgnored() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);
        synchronized (room) {
            room.getPlayer("bob").setStatus(com.example.triviaroom.model.PlayerStatus.DISCONNECTED);
            room.getPlayer("alice").recordAnswer("q1", 1, 1, true, 20, clock.instant());
        }
        timers.checkNow(room.getRoomId());

        assertTrue(ended.await(2, TimeUnit.SECONDS));
        assertEquals(EndReason.ALL_ANSWERED, lastReason.get());
    }

    @Test
    @DisplayName("racing endNow calls: exactly one wins and the handler runs once")
    void racingEnds() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                EndReason reason = (i % 2 == 0) ? EndReason.TIMEOUT : EndReason.ALL_ANSWERED;
                futures.add(pool.submit(() -> {
                    go.await();
                    if (timers.endNow(room.getRoomId(), 0, reason)) winners.incrementAndGet();
                    return null;
                }));
            }
            clock.advanceSeconds(11);   // let the tick race too
            go.countDown();
            for (Future<?> f : futures) f.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        Thread.sleep(100);

        assertTrue(winners.get() <= 1);
        assertEquals(1, endCalls.get());
    }

    @Test
    @DisplayName("deadline reached while the last answer triggers a check: handler runs once")
    void timeoutRacesLastAnswer() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);
        synchronized (room) {
            room.getPlayer("alice").recordAnswer("q1", 1, 1, true, 20, clock.instant());
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<?> deadline = pool.submit(() -> {
                go.await();
                clock.advanceSeconds(10);
                return null;
            });
            Future<?> lastAnswer = pool.submit(() -> {
                go.await();
                synchronized (room) {
                    room.getPlayer("bob").recordAnswer("q1", 1, 10, true, 10, clock.instant());
                }
                timers.checkNow(room.getRoomId());
                return null;
            });
            go.countDown();
            deadline.get(5, TimeUnit.SECONDS);
            lastAnswer.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertTrue(ended.await(2, TimeUnit.SECONDS));
        Thread.sleep(150);
        assertEquals(1, endCalls.get());
        assertFalse(timers.hasTimer(room.getRoomId()));
    }

    @Test
    @DisplayName("endNow for another question index is a no-op")
    void wrongIndex() {
        timers.startQuestion(room, 0, 10_000, handler);
        assertFalse(timers.endNow(room.getRoomId(), 1, EndReason.TIMEOUT));
        assertTrue(timers.hasQuestionTimer(room.getRoomId()));
    }

    @Test
    @DisplayName("cancel stops the question and no handler runs")
    void cancel() throws Exception {
        timers.startQuestion(room, 0, 10_000, handler);
        timers.cancel(room.getRoomId());
        clock.advanceSeconds(30);
        Thread.sleep(150);

        assertEquals(0, endCalls.get());
        assertFalse(timers.hasTimer(room.getRoomId()));
        assertFalse(timers.endNow(room.getRoomId(), 0, EndReason.TIMEOUT));
    }

    @Test
    @DisplayName("scheduleNext holds the slot until the task runs; cancel drops it")
    void scheduleNext() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        timers.scheduleNext(room, 50, ran::countDown);
        assertTrue(timers.hasTimer(room.getRoomId()));
        assertFalse(timers.hasQuestionTimer(room.getRoomId()));
        assertTrue(ran.await(2, TimeUnit.SECONDS));

        CountDownLatch never = new CountDownLatch(1);
        timers.scheduleNext(room, 100, never::countDown);
        timers.cancel(room.getRoomId());
        assertFalse(never.await(300, TimeUnit.MILLISECONDS));
    }

    @Test
    @DisplayName("remaining time follows the clock")
    void remaining() {
        timers.startQuestion(room, 0, 10_000, handler);
        clock.advanceSeconds(4);
        assertEquals(6_000, timers.remainingMillis(room.getRoomId()));
    }
}
