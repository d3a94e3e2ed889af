package com.example.triviaroom.service;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;
import com.example.triviaroom.service.QuestionTimerScheduler.EndReason;
import com.example.triviaroom.view.GameStateView;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoomStateMachineTest {

    private TestEngine engine;
    private RecordingConnection alice;
    private RecordingConnection bob;
    private Room room;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
        alice = engine.connect("alice");
        bob = engine.connect("bob");
        room = engine.createRoom("alice", alice, TestEngine.config(4, 30, 2));
        engine.join("bob", bob, room.getRoomId());
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void awaitReaped(String roomId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 3000;
        while (engine.registry.lookup(roomId).isPresent() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(engine.registry.lookup(roomId).isEmpty(), "room should be reaped");
    }

    @Nested
    @DisplayName("start")
    class Start {

        @Test
        @DisplayName("only the host may start")
        void nonHostIsRejected() {
            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.start(room.getRoomId(), "bob"));
            assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());
            assertEquals(RoomStatus.WAITING, room.getStatus());
            assertEquals(0, engine.providerCalls.get());
        }

        @Test
        @DisplayName("outsiders get PLAYER_NOT_IN_ROOM")
        void outsiderIsRejected() {
            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.start(room.getRoomId(), "mallory"));
            assertEquals(ErrorCode.PLAYER_NOT_IN_ROOM, e.getCode());
        }

        @Test
        @DisplayName("moves to PLAYING, announces the game and opens question 0")
        void startsGame() throws Exception {
            engine.stateMachine.start(room.getRoomId(), "alice");

            assertEquals(RoomStatus.PLAYING, room.getStatus());
            assertTrue(room.isQuestionOpen());
            assertEquals(0, room.getCurrentQuestionIndex());
            assertTrue(engine.timers.hasQuestionTimer(room.getRoomId()));

            JsonNode started = bob.await("game-started");
            assertEquals(2, started.path("data").path("totalQuestions").asInt());
            JsonNode question = bob.await("question-started");
            assertEquals("q1", question.path("data").path("question").path("id").asText());
            assertTrue(question.path("data").path("question").path("correctAnswerIndex").isMissingNode(),
                    "correct index must not be sent with the question");
            assertEquals(List.of("game-started", "question-started"),
                    bob.types().subList(bob.types().size() - 2, bob.types().size()));
        }

        @Test
        @DisplayName("a second start while the first is loading questions is rejected")
        void concurrentStartIsRejected() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            engine.provider = (topic, difficulty, count) -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return TestEngine.questions(count);
            };

            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Future<Room> first = pool.submit(() -> engine.stateMachine.start(room.getRoomId(), "alice"));
                assertTrue(entered.await(2, TimeUnit.SECONDS));

                GameException e = assertThrows(GameException.class,
                        () -> engine.stateMachine.start(room.getRoomId(), "alice"));
                assertEquals(ErrorCode.INVALID_ROOM_STATE, e.getCode());

                release.countDown();
                first.get(2, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            assertEquals(RoomStatus.PLAYING, room.getStatus());
            assertEquals(1, engine.providerCalls.get());
            assertEquals(1, bob.count("game-started"));
        }

        @Test
        @DisplayName("starting a running game is INVALID_ROOM_STATE")
        void doubleStart() {
            engine.stateMachine.start(room.getRoomId(), "alice");
            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.start(room.getRoomId(), "alice"));
            assertEquals(ErrorCode.INVALID_ROOM_STATE, e.getCode());
        }

        @Test
        @DisplayName("provider failure keeps the room WAITING and allows a retry")
        void providerFailure() {
            engine.provider = (topic, difficulty, count) -> { throw new IllegalStateException("upstream 502"); };

            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.start(room.getRoomId(), "alice"));
            assertEquals(ErrorCode.PROVIDER_UNAVAILABLE, e.getCode());
            assertTrue(e.isRetryable());
            assertEquals(RoomStatus.WAITING, room.getStatus());
            assertFalse(room.isStartInFlight());
            assertEquals(0, bob.count("game-started"));

            engine.provider = (topic, difficulty, count) -> TestEngine.questions(count);
            engine.stateMachine.start(room.getRoomId(), "alice");
            assertEquals(RoomStatus.PLAYING, room.getStatus());
        }

        @Test
        @DisplayName("an empty batch is PROVIDER_UNAVAILABLE")
        void emptyBatch() {
            engine.provider = (topic, difficulty, count) -> List.of();
            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.start(room.getRoomId(), "alice"));
            assertEquals(ErrorCode.PROVIDER_UNAVAILABLE, e.getCode());
            assertEquals(RoomStatus.WAITING, room.getStatus());
        }
    }

    @Nested
    @DisplayName("question loop and game end")
    class Loop {

        @Test
        @DisplayName("plays both questions and ends with the leader as winner")
        void fullGame() throws Exception {
            String id = room.getRoomId();
            engine.stateMachine.start(id, "alice");

            engine.answer(id, "alice", "q1", 1);
            engine.answer(id, "bob", "q1", 0);
            JsonNode ended = bob.await("question-ended");
            assertEquals("all-answered", ended.path("data").path("reason").asText());
            assertEquals(1, ended.path("data").path("correctAnswer").asInt());

            bob.await("question-started", 2, 3000);
            engine.answer(id, "alice", "q2", 1);
            engine.answer(id, "bob", "q2", 1);

            JsonNode gameEnded = bob.await("game-ended");
            JsonNode board = gameEnded.path("data").path("finalLeaderboard");
            assertEquals("alice", board.get(0).path("userId").asText());
            assertEquals(42, board.get(0).path("score").asInt());   // 20 + (20 + streak 2)
            assertEquals("bob", board.get(1).path("userId").asText());
            assertEquals(20, board.get(1).path("score").asInt());
            assertEquals("alice", gameEnded.path("data").path("winner").path("userId").asText());

            awaitReaped(id);
            assertEquals(RoomStatus.FINISHED, room.getStatus());
            assertEquals(1, engine.settleCalls.size());
            assertEquals("alice", engine.settleCalls.get(0).winnerId());
            assertEquals(Boolean.TRUE, room.getSettlementConfirmed());
            assertFalse(engine.timers.hasTimer(id));
            assertEquals(2, bob.count("question-ended"));
        }

        @Test
        @DisplayName("equal score and correct count: earlier joiner wins")
        void tieBreakByJoinOrder() throws Exception {
            engine.shutdown();
            engine = new TestEngine();
            RecordingConnection zed = engine.connect("zed");
            RecordingConnection amy = engine.connect("amy");
            Room r = engine.createRoom("zed", zed, TestEngine.config(2, 30, 1));
            engine.clock.advanceSeconds(1);
            engine.join("amy", amy, r.getRoomId());

            engine.stateMachine.start(r.getRoomId(), "zed");
            engine.answer(r.getRoomId(), "amy", "q1", 1);
            engine.answer(r.getRoomId(), "zed", "q1", 1);

            JsonNode gameEnded = amy.await("game-ended");
            assertEquals("zed", gameEnded.path("data").path("winner").path("userId").asText());
            JsonNode board = gameEnded.path("data").path("finalLeaderboard");
            assertEquals(board.get(0).path("score").asInt(), board.get(1).path("score").asInt());
            assertEquals("zed", board.get(0).path("userId").asText());
        }

        @Test
        @DisplayName("settlement failure is reported as unconfirmed and the room is still reaped")
        void settlementFailure() throws Exception {
            engine.settlement = game -> { throw new IllegalStateException("results store down"); };
            String id = room.getRoomId();
            engine.stateMachine.start(id, "alice");
            for (String q : List.of("q1", "q2")) {
                if (q.equals("q2")) bob.await("question-started", 2, 3000);
                engine.answer(id, "alice", q, 1);
                engine.answer(id, "bob", q, 1);
            }

            bob.await("game-ended");
            awaitReaped(id);
            JsonNode update = bob.events("room-updated").stream()
                    .filter(n -> n.path("data").has("settlementConfirmed"))
                    .findFirst().orElseThrow();
            assertFalse(update.path("data").path("settlementConfirmed").asBoolean());
            assertEquals(Boolean.FALSE, room.getSettlementConfirmed());
        }

        @Test
        @DisplayName("a failure while ending a question cancels and reaps the room")
        void failedQuestionEndCancelsRoom() throws Exception {
            String id = room.getRoomId();
            engine.stateMachine.start(id, "alice");
            engine.failRanking = true;

            assertTrue(engine.timers.endNow(id, 0, EndReason.TIMEOUT));

            assertEquals(RoomStatus.CANCELLED, room.getStatus());
            assertFalse(room.isQuestionOpen());
            assertFalse(engine.timers.hasTimer(id));
            assertTrue(engine.registry.lookup(id).isEmpty());
            JsonNode update = bob.await("room-updated");
            assertEquals("internal-error", update.path("data").path("reason").asText());
        }

        @Test
        @DisplayName("a stale question index is ignored")
        void staleEndIgnored() {
            engine.stateMachine.start(room.getRoomId(), "alice");
            engine.stateMachine.endQuestion(room, 1, EndReason.TIMEOUT);

            assertTrue(room.isQuestionOpen());
            assertEquals(0, room.getCurrentQuestionIndex());
            assertEquals(0, bob.count("question-ended"));
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("host cancels a running game; timers stop and the room is gone")
        void hostCancels() throws Exception {
            String id = room.getRoomId();
            engine.stateMachine.start(id, "alice");
            engine.stateMachine.cancel(id, "alice");

            assertEquals(RoomStatus.CANCELLED, room.getStatus());
            assertFalse(engine.timers.hasTimer(id));
            assertTrue(engine.registry.lookup(id).isEmpty());
            JsonNode update = bob.await("room-updated", bob.events("room-updated").size(), 1000);
            assertEquals("cancelled", update.path("data").path("status").asText());

            GameException e = assertThrows(GameException.class, () -> engine.answer(id, "bob", "q1", 1));
            assertEquals(ErrorCode.ROOM_NOT_FOUND, e.getCode());
        }

        @Test
        @DisplayName("non-host cannot cancel")
        void nonHost() {
            GameException e = assertThrows(GameException.class,
                    () -> engine.stateMachine.cancel(room.getRoomId(), "bob"));
            assertEquals(ErrorCode.UNAUTHORIZED, e.getCode());
            assertEquals(RoomStatus.WAITING, room.getStatus());
        }
    }

    @Test
    @DisplayName("game state hides the correct answer and counts down whole seconds")
    void gameState() {
        engine.stateMachine.start(room.getRoomId(), "alice");
        engine.clock.advance(java.time.Duration.ofMillis(12_500));

        GameStateView state = engine.stateMachine.gameState(room);
        assertEquals("q1", state.currentQuestion().id());
        assertNull(state.currentQuestion().correctAnswerIndex());
        assertEquals(17, state.timeRemaining());
        assertEquals(2, state.totalQuestions());
        assertTrue(state.playersAnswers().isEmpty());
    }
}
