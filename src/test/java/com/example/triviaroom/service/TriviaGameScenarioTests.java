package com.example.triviaroom.service;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end games through the engine with recording connections.
 * Deadlines follow the test clock; everything else runs on real threads.
 */
class TriviaGameScenarioTests {

    private TestEngine engine;

    @BeforeEach
    void setUp() {
        engine = new TestEngine();
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    @Test
    @DisplayName("two players answer correctly: question ends early, then the game ends with a sorted leaderboard")
    void bothAnswerCorrectly() throws Exception {
        RecordingConnection host = engine.connect("host");
        RecordingConnection guest = engine.connect("guest");
        Room room = engine.createRoom("host", host, TestEngine.config(2, 10, 1));
        engine.join("guest", guest, room.getRoomId());
        engine.stateMachine.start(room.getRoomId(), "host");

        engine.clock.advanceSeconds(1);
        engine.answers.submitAnswer(room.getRoomId(), "guest", "q1", 1, 1.0);
        engine.clock.advanceSeconds(1);
        engine.answers.submitAnswer(room.getRoomId(), "host", "q1", 1, 2.0);

        JsonNode ended = host.await("question-ended");
        assertEquals("all-answered", ended.path("data").path("reason").asText());
        for (JsonNode r : ended.path("data").path("results")) {
            assertTrue(r.path("answered").asBoolean());
            assertTrue(r.path("isCorrect").asBoolean());
        }

        JsonNode gameEnded = host.await("game-ended");
        JsonNode board = gameEnded.path("data").path("finalLeaderboard");
        assertEquals(2, board.size());
        assertEquals("guest", board.get(0).path("userId").asText());   // 10 + 9
        assertEquals(19, board.get(0).path("score").asInt());
        assertEquals("host", board.get(1).path("userId").asText());    // 10 + 8
        assertEquals(18, board.get(1).path("score").asInt());
        assertEquals(1, board.get(0).path("rank").asInt());

        List<String> types = guest.types();
        assertTrue(types.indexOf("question-ended") < types.indexOf("game-ended"));
        assertEquals(RoomStatus.FINISHED, room.getStatus());
    }

    @Test
    @DisplayName("single silent player: question times out with no answer and no score")
    void silentPlayerTimesOut() throws Exception {
        RecordingConnection solo = engine.connect("solo");
        Room room = engine.createRoom("solo", solo, TestEngine.config(2, 5, 1));
        engine.stateMachine.start(room.getRoomId(), "solo");

        engine.clock.advanceSeconds(4);
        Thread.sleep(100);
        assertEquals(0, solo.count("question-ended"));

        engine.clock.advanceSeconds(1);
        JsonNode ended = solo.await("question-ended");
        assertEquals("timeout", ended.path("data").path("reason").asText());
        JsonNode result = ended.path("data").path("results").get(0);
        assertEquals("solo", result.path("userId").asText());
        assertFalse(result.path("answered").asBoolean());
        assertEquals(0, result.path("scoreEarned").asInt());

        solo.await("game-ended");
        assertEquals(1, solo.count("question-ended"));
    }

    @Test
    @DisplayName("deadline and last answer land together: exactly one question-ended, then the game ends")
    void deadlineRacesLastAnswer() throws Exception {
        RecordingConnection host = engine.connect("host");
        RecordingConnection guest = engine.connect("guest");
        Room room = engine.createRoom("host", host, TestEngine.config(2, 10, 1));
        String id = room.getRoomId();
        engine.join("guest", guest, id);
        engine.stateMachine.start(id, "host");
        engine.answer(id, "host", "q1", 1);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<?> deadline = pool.submit(() -> {
                go.await();
                engine.clock.advanceSeconds(10);
                return null;
            });
            Future<?> lastAnswer = pool.submit(() -> {
                go.await();
                try {
                    engine.answer(id, "guest", "q1", 1);
                } catch (GameException e) {
                    assertTrue(e.getCode() == ErrorCode.QUESTION_MISMATCH
                            || e.getCode() == ErrorCode.INVALID_ROOM_STATE
                            || e.getCode() == ErrorCode.ROOM_NOT_FOUND, e.getCode().name());
                }
                return null;
            });
            go.countDown();
            deadline.get(5, TimeUnit.SECONDS);
            lastAnswer.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        JsonNode ended = host.await("question-ended");
        String reason = ended.path("data").path("reason").asText();
        assertTrue(reason.equals("timeout") || reason.equals("all-answered"), reason);
        host.await("game-ended");
        Thread.sleep(150);

        assertEquals(1, host.count("question-ended"));
        assertEquals(1, guest.count("question-ended"));
        assertEquals(1, host.count("game-ended"));
        assertEquals(1, engine.settleCalls.size());
        assertFalse(engine.timers.hasTimer(id));
    }
}
