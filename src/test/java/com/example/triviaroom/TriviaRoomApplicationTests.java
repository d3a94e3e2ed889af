package com.example.triviaroom;

import com.example.triviaroom.persistence.GameSettlementService;
import com.example.triviaroom.persistence.JpaGameSettlementService;
import com.example.triviaroom.repository.GameResultRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.test.context.TestPropertySource;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the whole service on a random port and talks to it over HTTP and WebSocket.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@TestPropertySource(properties = {
        "features.game-results.enabled=true",
        "app.websocket.debug-open=true"
})
class TriviaRoomApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate rest;

    @Autowired
    private ObjectMapper mapper;

    @Autowired
    private GameSettlementService settlement;

    @Autowired
    private GameResultRepository results;

    @Test
    void jpaSettlementIsWiredWhenEnabled() {
        assertInstanceOf(JpaGameSettlementService.class, settlement);
        assertEquals(0, results.count());
    }

    @Test
    void createRoomOverHttp() throws Exception {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-User-Id", "http-user");
        headers.set("X-User-Email", "http-user@example.com");

        ResponseEntity<String> created = rest.exchange("/api/multiplayer/rooms", HttpMethod.POST,
                new HttpEntity<>("{\"topic\":\"science\",\"difficulty\":\"easy\",\"maxPlayers\":2}", headers), String.class);

        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        JsonNode body = mapper.readTree(created.getBody());
        String code = body.path("code").asText();
        assertEquals(8, code.length());

        ResponseEntity<String> details = rest.exchange("/api/multiplayer/rooms/" + code, HttpMethod.GET,
                new HttpEntity<>(headers), String.class);
        assertEquals(HttpStatus.OK, details.getStatusCode());
        assertEquals("http-user", mapper.readTree(details.getBody()).path("room").path("hostId").asText());
    }

    @Test
    void webSocketRoundTrip() throws Exception {
        BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        TextWebSocketHandler client = new TextWebSocketHandler() {
            @Override
            protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
                inbox.add(mapper.readTree(message.getPayload()));
            }
        };

        WebSocketSession ws = new StandardWebSocketClient()
                .execute(client, new WebSocketHttpHeaders(),
                        URI.create("ws://localhost:" + port + "/multiplayer?userId=ws-user&email=ws-user%40example.com"))
                .get(5, TimeUnit.SECONDS);
        try {
            assertEquals("connected", next(inbox).path("type").asText());

            ws.sendMessage(new TextMessage("{\"type\":\"ping\"}"));
            assertEquals("pong", next(inbox).path("type").asText());

            ws.sendMessage(new TextMessage("{\"type\":\"create-room\",\"topic\":\"history\",\"difficulty\":\"medium\"}"));
            JsonNode created = next(inbox);
            assertEquals("room-created", created.path("type").asText());
            assertEquals("ws-user", created.path("room").path("hostId").asText());

            ws.sendMessage(new TextMessage("{\"type\":\"join-room\",\"roomId\":\"NOPE0000\"}"));
            JsonNode err = next(inbox);
            assertEquals("error", err.path("type").asText());
            assertEquals("ROOM_NOT_FOUND", err.path("code").asText());
        } finally {
            ws.close();
        }
    }

    private static JsonNode next(BlockingQueue<JsonNode> inbox) throws InterruptedException {
        JsonNode n = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(n, "no frame received");
        return n;
    }
}
