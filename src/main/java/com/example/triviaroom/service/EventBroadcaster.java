package com.example.triviaroom.service;

import com.example.triviaroom.event.GameEvent;
import com.example.triviaroom.event.GameEventType;
import com.example.triviaroom.model.Room;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Fans typed game events out to every connection attached to a room.
 * Callers hold the room monitor, so events of one room go out in state-change order.
 * Closed or failing connections are pruned from the room set.
 */
@Component
public class EventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(EventBroadcaster.class);

    private final RoomConnections connections;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventBroadcaster(RoomConnections connections, ObjectMapper objectMapper, Clock clock) {
        this.connections = connections;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public GameEvent broadcast(Room room, GameEventType type, Map<String, Object> data) {
        GameEvent event = new GameEvent(type, room.getRoomId(), clock.instant(), data);
        String json = toJson(event);

        int delivered = 0;
        for (String connId : connections.connectionIdsIn(room.getRoomId())) {
            Connection c = connections.connection(connId);
            if (c == null || !c.isOpen()) {
                connections.prune(connId);
                continue;
            }
            try {
                c.send(json);
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("EVENT send failed room={} type={} conn={}: {}",
                        room.getRoomId(), type.wire(), connId, e.toString());
                connections.prune(connId);
            }
        }
        log.debug("EVENT room={} type={} delivered={}", room.getRoomId(), type.wire(), delivered);
        return event;
    }

    /** Direct reply to one connection (acks and errors); never broadcast. */
    public boolean sendTo(Connection connection, Map<String, Object> payload) {
        if (connection == null || !connection.isOpen()) return false;
        try {
            connection.send(toJson(payload));
            return true;
        } catch (IOException e) {
            log.warn("SEND failed conn={}: {}", connection.id(), e.toString());
            return false;
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
