package com.example.triviaroom.service;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.*;
import com.example.triviaroom.view.GameStateView;
import com.example.triviaroom.view.RoomView;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point shared by the REST controller and the WebSocket handler.
 * Validates boundary input and delegates to the engine components.
 */
@Service
public class TriviaGameService {

    private final RoomRegistry registry;
    private final ConnectionManager connectionManager;
    private final RoomStateMachine stateMachine;
    private final AnswerProcessor answerProcessor;
    private final GameProperties props;

    public TriviaGameService(RoomRegistry registry,
                             ConnectionManager connectionManager,
                             RoomStateMachine stateMachine,
                             AnswerProcessor answerProcessor,
                             GameProperties props) {
        this.registry = registry;
        this.connectionManager = connectionManager;
        this.stateMachine = stateMachine;
        this.answerProcessor = answerProcessor;
        this.props = props;
    }

    // --- connections ---
    public ConnectResult connect(Connection conn, Map<String, String> claims) { return connectionManager.onConnect(conn, claims); }
    public void disconnect(Connection conn) { connectionManager.onDisconnect(conn); }

    // --- room lifecycle ---

    public Room createRoom(Identity identity, CreateRoomCommand cmd, Connection conn) {
        return connectionManager.createRoom(identity, toConfig(cmd), conn);
    }

    public Room joinRoom(Identity identity, String roomId, Connection conn) {
        return connectionManager.join(identity, requireRoomId(roomId), conn);
    }

    public LeaveResult leaveRoom(Identity identity, String roomId) {
        return connectionManager.leave(identity.userId(), requireRoomId(roomId));
    }

    public LeaveResult leaveRoom(Connection conn) {
        return connectionManager.leaveRoom(conn);
    }

    public Room startGame(Identity identity, String roomId) {
        return stateMachine.start(requireRoomId(roomId), identity.userId());
    }

    public Room cancelGame(Identity identity, String roomId) {
        return stateMachine.cancel(requireRoomId(roomId), identity.userId());
    }

    public AnswerResult submitAnswer(Identity identity, String roomId, String questionId, Integer answer, Double timeSpent) {
        if (questionId == null || questionId.isBlank()) {
            throw new GameException(ErrorCode.INVALID_REQUEST, "questionId is required");
        }
        if (answer == null || answer < 0) {
            throw new GameException(ErrorCode.INVALID_REQUEST, "answer must be a non-negative index");
        }
        double seconds = (timeSpent == null) ? 0 : timeSpent;
        return answerProcessor.submitAnswer(requireRoomId(roomId), identity.userId(), questionId, answer, seconds);
    }

    // --- queries (participants only) ---

    public RoomView roomDetails(Identity identity, String roomId) {
        Room room = registry.find(requireRoomId(roomId));
        synchronized (room) {
            requireParticipant(room, identity);
            return RoomView.from(room);
        }
    }

    public GameStateView gameState(Identity identity, String roomId) {
        Room room = registry.find(requireRoomId(roomId));
        synchronized (room) {
            requireParticipant(room, identity);
            return stateMachine.gameState(room);
        }
    }

    public GameStateView gameState(Room room) {
        return stateMachine.gameState(room);
    }

    public List<RoomView> search(RoomSearchCriteria criteria) {
        List<RoomView> out = new ArrayList<>();
        for (Room room : registry.search(criteria)) {
            synchronized (room) {
                out.add(RoomView.from(room));
            }
        }
        return out;
    }

    /** Snapshot of a room under its monitor. */
    public RoomView view(Room room) {
        if (room == null) return null;
        synchronized (room) {
            return RoomView.from(room);
        }
    }

    // --- validation ---

    RoomConfig toConfig(CreateRoomCommand cmd) {
        if (cmd == null) throw invalid("Room settings are required");

        String topic = (cmd.topic() == null) ? "" : cmd.topic().trim();
        if (topic.isEmpty() || topic.length() > 100) throw invalid("topic must be 1-100 characters");

        Difficulty difficulty;
        try {
            difficulty = Difficulty.fromWire(cmd.difficulty());
        } catch (IllegalArgumentException e) {
            throw invalid("Unknown difficulty: " + cmd.difficulty());
        }
        if (difficulty == null) throw invalid("difficulty is required");

        int questions = (cmd.questionsPerRequest() == null) ? 10 : cmd.questionsPerRequest();
        if (questions < 1 || questions > props.getMaxQuestionsPerRequest()) {
            throw invalid("questionsPerRequest must be between 1 and " + props.getMaxQuestionsPerRequest());
        }

        int maxPlayers = (cmd.maxPlayers() == null) ? props.getMaxRoomSize() : cmd.maxPlayers();
        if (maxPlayers < props.getMinRoomSize() || maxPlayers > props.getMaxRoomSize()) {
            throw invalid("maxPlayers must be between " + props.getMinRoomSize() + " and " + props.getMaxRoomSize());
        }

        int time = (cmd.timePerQuestion() == null) ? props.getDefaultTimePerQuestion() : cmd.timePerQuestion();
        if (time < 1 || time > props.getMaxTimePerQuestion()) {
            throw invalid("timePerQuestion must be between 1 and " + props.getMaxTimePerQuestion() + " seconds");
        }

        GameMode mode;
        try {
            mode = GameMode.fromWire(cmd.gameMode());
        } catch (IllegalArgumentException e) {
            throw invalid("Unknown gameMode: " + cmd.gameMode());
        }

        return new RoomConfig(topic, difficulty, questions, maxPlayers, mode, time);
    }

    private static String requireRoomId(String roomId) {
        if (roomId == null || roomId.isBlank()) throw invalid("roomId is required");
        return roomId.trim();
    }

    private static void requireParticipant(Room room, Identity identity) {
        if (room.getPlayer(identity.userId()) == null) {
            throw GameException.notInRoom(room.getRoomId(), identity.userId());
        }
    }

    private static GameException invalid(String message) {
        return new GameException(ErrorCode.INVALID_REQUEST, message);
    }
}
