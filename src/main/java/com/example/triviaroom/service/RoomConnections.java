package com.example.triviaroom.service;

import com.example.triviaroom.model.Identity;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection index kept by {@link ConnectionManager}: connection id → (connection, identity, room)
 * and room id → connection ids. {@link EventBroadcaster} iterates the per-room sets.
 */
@Component
public class RoomConnections {

    /** What we know about one registered connection. */
    public static final class Attachment {
        private final Connection connection;
        private final Identity identity;
        private volatile String roomId;

        Attachment(Connection connection, Identity identity) {
            this.connection = connection;
            this.identity = identity;
        }

        public Connection connection() { return connection; }
        public Identity identity() { return identity; }
        public String roomId() { return roomId; }
    }

    private final Map<String, Attachment> byConnection = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> byRoom = new ConcurrentHashMap<>();

    public Attachment register(Connection connection, Identity identity) {
        Attachment a = new Attachment(connection, identity);
        byConnection.put(connection.id(), a);
        return a;
    }

    /** Forgets the connection entirely; returns its last attachment (room id still set) or null. */
    public Attachment unregister(String connectionId) {
        Attachment a = byConnection.remove(connectionId);
        if (a != null && a.roomId != null) removeFromRoomSet(a.roomId, connectionId);
        return a;
    }

    public Optional<Attachment> attachment(String connectionId) {
        if (connectionId == null) return Optional.empty();
        return Optional.ofNullable(byConnection.get(connectionId));
    }

    public Connection connection(String connectionId) {
        Attachment a = byConnection.get(connectionId);
        return (a == null) ? null : a.connection;
    }

    /** Attaches the connection to a room, moving it out of any previous room. */
    public void attach(String connectionId, String roomId) {
        Attachment a = byConnection.get(connectionId);
        if (a == null) return;
        String previous = a.roomId;
        if (previous != null && !previous.equals(roomId)) removeFromRoomSet(previous, connectionId);
        a.roomId = roomId;
        byRoom.compute(roomId, (k, set) -> {
            Set<String> ids = (set == null) ? ConcurrentHashMap.newKeySet() : set;
            ids.add(connectionId);
            return ids;
        });
    }

    public void detach(String connectionId) {
        Attachment a = byConnection.get(connectionId);
        if (a == null || a.roomId == null) return;
        removeFromRoomSet(a.roomId, connectionId);
        a.roomId = null;
    }

    /**
     * Stops delivering room events to a dead connection. The attachment keeps its room id so the
     * close callback can still mark the player disconnected.
     */
    public void prune(String connectionId) {
        Attachment a = byConnection.get(connectionId);
        if (a == null || a.roomId == null) return;
        removeFromRoomSet(a.roomId, connectionId);
    }

    /** Detaches every connection of this user from the room. */
    public void detachUser(String roomId, String userId) {
        for (String connId : connectionIdsIn(roomId)) {
            Attachment a = byConnection.get(connId);
            if (a != null && a.identity != null && Objects.equals(a.identity.userId(), userId)) detach(connId);
        }
    }

    public boolean hasConnection(String roomId, String userId) {
        for (String connId : connectionIdsIn(roomId)) {
            Attachment a = byConnection.get(connId);
            if (a != null && a.identity != null && Objects.equals(a.identity.userId(), userId)) return true;
        }
        return false;
    }

    /** Snapshot of the connection ids attached to a room. */
    public Set<String> connectionIdsIn(String roomId) {
        Set<String> ids = byRoom.get(roomId);
        return (ids == null) ? Set.of() : new HashSet<>(ids);
    }

    /** Drops the room's connection set when the room is reaped. */
    public void releaseRoom(String roomId) {
        Set<String> ids = byRoom.remove(roomId);
        if (ids == null) return;
        for (String connId : ids) {
            Attachment a = byConnection.get(connId);
            if (a != null && roomId.equals(a.roomId)) a.roomId = null;
        }
    }

    private void removeFromRoomSet(String roomId, String connectionId) {
        byRoom.computeIfPresent(roomId, (k, set) -> {
            set.remove(connectionId);
            return set.isEmpty() ? null : set;
        });
    }
}
