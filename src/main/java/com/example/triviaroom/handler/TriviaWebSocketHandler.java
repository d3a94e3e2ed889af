package com.example.triviaroom.handler;

import com.example.triviaroom.config.WebSocketProperties;
import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Identity;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.service.*;
import com.example.triviaroom.view.RoomView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket handler for the multiplayer socket.
 * - Identity comes from the handshake query (userId, email, role, displayName) set by the auth gateway
 * - Inbound JSON: {"type": create-room | join-room | leave-room | start-game | cancel-game
 *   | submit-answer | request-state | ping, ...fields}
 * - Acks and errors go to the sending session only; room events are broadcast by the engine
 * - On close: the player is marked disconnected and keeps the seat for the grace period
 */
@Component
public class TriviaWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(TriviaWebSocketHandler.class);

    private final TriviaGameService game;
    private final ObjectMapper objectMapper;
    private final WebSocketProperties props;

    /** Per WebSocket session → (connection, identity) */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    private static final class Conn {
        final WebSocketConnection connection;
        final Identity identity;

        Conn(WebSocketConnection connection, Identity identity) {
            this.connection = connection;
            this.identity = identity;
        }
    }

    public TriviaWebSocketHandler(TriviaGameService game, ObjectMapper objectMapper, WebSocketProperties props) {
        this.game = game;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) throws Exception {
        WebSocketConnection conn = new WebSocketConnection(session, props.getSendTimeLimitMs(), props.getSendBufferSizeLimit());
        Map<String, String> claims = parseQuery(session.getUri());

        ConnectResult result;
        try {
            result = game.connect(conn, claims);
        } catch (GameException e) {
            log.warn("WS REJECT sid={} code={} reason={}", session.getId(), e.getCode(), e.getMessage());
            sendError(conn, e.getCode(), e.getMessage());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("Unauthenticated"));
            return;
        }

        bySession.put(session.getId(), new Conn(conn, result.identity()));
        log.info("WS OPEN sid={} user={}", session.getId(), result.identity().userId());

        Map<String, Object> hello = reply("connected");
        hello.put("userId", result.identity().userId());
        send(conn, hello);

        Room rejoined = result.rejoinedRoom();
        if (rejoined != null) {
            Map<String, Object> ack = reply("room-joined");
            ack.put("room", game.view(rejoined));
            ack.put("gameState", game.gameState(rejoined));
            ack.put("reconnected", true);
            send(conn, ack);
        }
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }

        final String payload = message.getPayload();
        String type = null;
        try {
            JsonNode msg = objectMapper.readTree(payload);
            type = text(msg, "type");
            if (type == null) throw new GameException(ErrorCode.INVALID_REQUEST, "Message type is required");
            dispatch(c, type, msg);
        } catch (GameException e) {
            log.debug("WS rejected user={} type={} code={}", c.identity.userId(), type, e.getCode());
            sendError(c.connection, e.getCode(), e.getMessage());
        } catch (JsonProcessingException e) {
            sendError(c.connection, ErrorCode.INVALID_REQUEST, "Malformed JSON");
        } catch (RuntimeException e) {
            log.error("WS handleTextMessage failed (user={}, type={})", c.identity.userId(), type, e);
            sendError(c.connection, ErrorCode.INTERNAL_ERROR, "Internal error");
        }
    }

    private void dispatch(Conn c, String type, JsonNode msg) throws IOException {
        Identity me = c.identity;
        WebSocketConnection conn = c.connection;

        switch (type) {
            case "ping" -> send(conn, reply("pong"));

            case "create-room" -> {
                CreateRoomCommand cmd = new CreateRoomCommand(
                        text(msg, "topic"), text(msg, "difficulty"),
                        integer(msg, "questionsPerRequest"), integer(msg, "maxPlayers"),
                        integer(msg, "timePerQuestion"), text(msg, "gameMode"));
                Room room = game.createRoom(me, cmd, conn);
                RoomView view = game.view(room);
                Map<String, Object> ack = reply("room-created");
                ack.put("room", view);
                ack.put("code", view.roomId());
                send(conn, ack);
            }

            case "join-room" -> {
                Room room = game.joinRoom(me, text(msg, "roomId"), conn);
                Map<String, Object> ack = reply("room-joined");
                ack.put("room", game.view(room));
                ack.put("gameState", game.gameState(room));
                send(conn, ack);
            }

            case "leave-room" -> {
                String roomId = text(msg, "roomId");
                LeaveResult r = (roomId == null) ? game.leaveRoom(conn) : game.leaveRoom(me, roomId);
                Map<String, Object> ack = reply("room-left");
                ack.put("roomId", r.roomId());
                ack.put("status", r.status().wire());
                ack.put("remainingPlayers", r.remainingPlayers());
                send(conn, ack);
            }

            case "start-game" -> {
                Room room = game.startGame(me, text(msg, "roomId"));
                Map<String, Object> ack = reply("game-starting");
                ack.put("roomId", room.getRoomId());
                send(conn, ack);
            }

            case "cancel-game" -> {
                Room room = game.cancelGame(me, text(msg, "roomId"));
                Map<String, Object> ack = reply("game-cancelled");
                ack.put("roomId", room.getRoomId());
                send(conn, ack);
            }

            case "submit-answer" -> {
                JsonNode spent = msg.get("timeSpent");
                AnswerResult r = game.submitAnswer(me, text(msg, "roomId"), text(msg, "questionId"),
                        integer(msg, "answer"), (spent == null || !spent.isNumber()) ? null : spent.asDouble());
                Map<String, Object> ack = reply("answer-accepted");
                ack.put("roomId", r.roomId());
                ack.put("questionId", r.questionId());
                ack.put("isCorrect", r.isCorrect());
                ack.put("scoreEarned", r.scoreEarned());
                ack.put("leaderboard", r.leaderboard());
                send(conn, ack);
            }

            case "request-state" -> {
                String roomId = text(msg, "roomId");
                Map<String, Object> ack = reply("room-state");
                ack.put("room", game.roomDetails(me, roomId));
                ack.put("gameState", game.gameState(me, roomId));
                send(conn, ack);
            }

            default -> throw new GameException(ErrorCode.INVALID_REQUEST, "Unknown message type: " + type);
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} uri={} : transport error", session.getId(), safeUri(session), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Conn c = bySession.remove(session.getId());
        if (c == null) {
            log.info("WS CLOSE sid={} code={} reason={}", session.getId(), status.getCode(), status.getReason());
            return;
        }
        log.info("WS CLOSE sid={} user={} code={} reason={}",
                session.getId(), c.identity.userId(), status.getCode(), status.getReason());

        try {
            game.disconnect(c.connection);
        } catch (RuntimeException e) {
            log.error("WS afterConnectionClosed handling failed (user={})", c.identity.userId(), e);
        }
    }

    /* ---------------- helpers ---------------- */

    private static Map<String, Object> reply(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }

    private void sendError(WebSocketConnection conn, ErrorCode code, String message) {
        Map<String, Object> err = reply("error");
        err.put("code", code.name());
        err.put("message", message);
        err.put("retryable", code.isRetryable());
        try {
            send(conn, err);
        } catch (IOException e) {
            log.warn("WS error reply failed sid={}: {}", conn.id(), e.toString());
        }
    }

    private void send(WebSocketConnection conn, Map<String, Object> payload) throws IOException {
        if (conn.isOpen()) conn.send(objectMapper.writeValueAsString(payload));
    }

    private static String text(JsonNode msg, String field) {
        JsonNode n = msg.get(field);
        if (n == null || n.isNull()) return null;
        String s = n.asText();
        return s.isBlank() ? null : s.trim();
    }

    private static Integer integer(JsonNode msg, String field) {
        JsonNode n = msg.get(field);
        if (n == null || n.isNull()) return null;
        if (!n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new GameException(ErrorCode.INVALID_REQUEST, field + " must be an integer");
        }
        return n.asInt();
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> map = new ConcurrentHashMap<>();
        if (uri == null || uri.getRawQuery() == null) return map;
        for (String kv : uri.getRawQuery().split("&")) {
            int i = kv.indexOf('=');
            if (i > 0) {
                String k = URLDecoder.decode(kv.substring(0, i), StandardCharsets.UTF_8);
                String v = URLDecoder.decode(kv.substring(i + 1), StandardCharsets.UTF_8);
                map.put(k, v);
            }
        }
        return map;
    }

    private String safeUri(WebSocketSession session) {
        try { return String.valueOf(session.getUri()); } catch (RuntimeException e) { return "n/a"; }
    }
}
