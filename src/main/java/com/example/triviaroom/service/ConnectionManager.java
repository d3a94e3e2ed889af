package com.example.triviaroom.service;

import com.example.triviaroom.config.GameProperties;
import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.event.GameEventType;
import com.example.triviaroom.model.*;
import com.example.triviaroom.security.IdentityVerifier;
import com.example.triviaroom.view.PlayerView;
import com.example.triviaroom.view.RoomView;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Maps live connections to verified users and rooms; handles create/join/leave and presence.
 *
 * A dropped connection marks its player disconnected at once (host passes on in join order)
 * and starts a reconnect grace timer. Coming back in time re-attaches the same player record
 * with score and answers intact; otherwise the disconnect is finalized as a leave.
 */
@Service
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final RoomRegistry registry;
    private final RoomConnections connections;
    private final RoomStateMachine stateMachine;
    private final QuestionTimerScheduler timers;
    private final EventBroadcaster broadcaster;
    private final IdentityVerifier identityVerifier;
    private final Clock clock;
    private final long reconnectGraceMs;

    private final ScheduledExecutorService presence =
            Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "presence-grace");
                t.setDaemon(true);
                return t;
            });

    /** userId → pending finalize of a disconnect. */
    private final Map<String, GraceTimer> graceTimers = new ConcurrentHashMap<>();

    private static final class GraceTimer {
        final String roomId;
        final ScheduledFuture<?> future;

        GraceTimer(String roomId, ScheduledFuture<?> future) {
            this.roomId = roomId;
            this.future = future;
        }
    }

    public ConnectionManager(RoomRegistry registry,
                             RoomConnections connections,
                             RoomStateMachine stateMachine,
                             QuestionTimerScheduler timers,
                             EventBroadcaster broadcaster,
                             IdentityVerifier identityVerifier,
                             GameProperties props,
                             Clock clock) {
        this.registry = registry;
        this.connections = connections;
        this.stateMachine = stateMachine;
        this.timers = timers;
        this.broadcaster = broadcaster;
        this.identityVerifier = identityVerifier;
        this.clock = clock;
        this.reconnectGraceMs = Math.max(0, props.getReconnectGraceMs());
    }

    // ========================================================================
    //  CONNECT
    // ========================================================================

    /**
     * Verifies the claims and registers the connection. If the user is inside a reconnect
     * grace window the connection is put straight back into that room.
     */
    public ConnectResult onConnect(Connection conn, Map<String, String> claims) {
        Identity identity = identityVerifier.verify(claims);
        connections.register(conn, identity);
        log.info("CONNECT conn={} user={}", conn.id(), identity.userId());

        GraceTimer pending = graceTimers.get(identity.userId());
        Room rejoined = null;
        if (pending != null) {
            try {
                rejoined = join(identity, pending.roomId, conn);
            } catch (GameException e) {
                log.info("REJOIN skipped user={} room={}: {}", identity.userId(), pending.roomId, e.getMessage());
            }
        }
        return new ConnectResult(identity, rejoined);
    }

    // ========================================================================
    //  CREATE / JOIN
    // ========================================================================

    /** Creates a room with the caller as host. conn may be null (HTTP). */
    public Room createRoom(Identity identity, RoomConfig config, Connection conn) {
        leavePreviousRoom(identity, conn, null);
        Room room = registry.create(config, Player.of(identity, clock.instant()));
        if (conn != null) connections.attach(conn.id(), room.getRoomId());
        return room;
    }

    /**
     * Adds the caller to the room, or re-attaches their existing player record.
     * New players may only enter WAITING rooms with a free seat. conn may be null (HTTP).
     */
    public Room join(Identity identity, String roomId, Connection conn) {
        Room room = registry.find(roomId);
        String userId = identity.userId();

        // the previous room is only given up once the target would accept us
        synchronized (room) {
            requireJoinable(room, userId);
        }
        leavePreviousRoom(identity, conn, roomId);

        synchronized (room) {
            requireJoinable(room, userId);

            Instant now = clock.instant();
            Player player = room.getPlayer(userId);
            boolean reconnected = (player != null);
            if (reconnected) {
                cancelGrace(userId, roomId);
                if (player.isDisconnected()) player.setStatus(statusOnReturn(room, player));
                player.touch(now);
            } else {
                player = Player.of(identity, now);
                room.addPlayer(player);
            }
            room.touch(now);
            if (conn != null) connections.attach(conn.id(), roomId);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("player", PlayerView.from(player));
            data.put("reconnected", reconnected);
            data.put("playerCount", room.getPlayerCount());
            data.put("room", RoomView.from(room));
            broadcaster.broadcast(room, GameEventType.PLAYER_JOINED, data);

            log.info("JOIN room={} user={} reconnected={} players={}",
                    roomId, userId, reconnected, room.getPlayerCount());
            return room;
        }
    }

    /** Rejects the join without touching anything. Caller holds the room monitor. */
    private void requireJoinable(Room room, String userId) {
        String roomId = room.getRoomId();
        if (!registry.isRegistered(room)) throw GameException.roomNotFound(roomId);
        if (room.getStatus().isTerminal()) {
            throw GameException.invalidState("Room " + roomId + " is " + room.getStatus().wire());
        }
        if (room.getPlayer(userId) != null) return;
        if (room.getStatus() != RoomStatus.WAITING) {
            throw GameException.invalidState("Game in room " + roomId + " already started");
        }
        if (room.isFull()) {
            throw new GameException(ErrorCode.ROOM_FULL, "Room " + roomId + " is full");
        }
    }

    private static PlayerStatus statusOnReturn(Room room, Player p) {
        switch (room.getStatus()) {
            case PLAYING:
                TriviaQuestion q = room.isQuestionOpen() ? room.currentQuestion() : null;
                return (q != null && p.hasAnswered(q.id())) ? PlayerStatus.ANSWERED : PlayerStatus.PLAYING;
            case FINISHED:
                return PlayerStatus.FINISHED;
            default:
                return PlayerStatus.WAITING;
        }
    }

    private void leavePreviousRoom(Identity identity, Connection conn, String nextRoomId) {
        if (conn == null) return;
        String previous = connections.attachment(conn.id()).map(RoomConnections.Attachment::roomId).orElse(null);
        if (previous == null || previous.equals(nextRoomId)) return;
        try {
            leave(identity.userId(), previous);
        } catch (GameException e) {
            log.debug("LEAVE previous room={} user={} skipped: {}", previous, identity.userId(), e.getMessage());
            connections.detach(conn.id());
        }
    }

    // ========================================================================
    //  LEAVE
    // ========================================================================

    public LeaveResult leaveRoom(Connection conn) {
        RoomConnections.Attachment a = connections.attachment(conn.id()).orElse(null);
        if (a == null || a.roomId() == null) {
            throw new GameException(ErrorCode.PLAYER_NOT_IN_ROOM, "Connection is not in a room");
        }
        return leave(a.identity().userId(), a.roomId());
    }

    /**
     * Removes the player. A departing host hands over to the next player in join order;
     * the last player out closes the room.
     */
    public LeaveResult leave(String userId, String roomId) {
        Room room = registry.find(roomId);
        cancelGrace(userId, roomId);

        LeaveResult result;
        synchronized (room) {
            if (!registry.isRegistered(room)) throw GameException.roomNotFound(roomId);
            Player player = room.getPlayer(userId);
            if (player == null) throw GameException.notInRoom(roomId, userId);

            boolean wasHost = player.isHost();
            room.removePlayer(userId);
            room.touch(clock.instant());
            String newHost = wasHost ? room.assignNewHostIfNecessary(userId, false) : null;
            int remaining = room.getPlayerCount();

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("userId", userId);
            data.put("displayName", player.getDisplayName());
            data.put("remainingPlayers", remaining);
            data.put("hostId", room.getHostId());

            if (remaining == 0) {
                data.put("status", LeaveResult.Status.ROOM_CLOSED);
                broadcaster.broadcast(room, GameEventType.PLAYER_LEFT, data);
                connections.detachUser(roomId, userId);
                stateMachine.closeEmptyRoom(room);
                log.info("LEAVE room={} user={} -> room closed", roomId, userId);
                return new LeaveResult(roomId, LeaveResult.Status.ROOM_CLOSED, 0, null);
            }

            connections.detachUser(roomId, userId);
            data.put("status", LeaveResult.Status.PLAYER_LEFT);
            broadcaster.broadcast(room, GameEventType.PLAYER_LEFT, data);
            if (newHost != null) broadcastHostChange(room, userId, newHost, "host-left");

            log.info("LEAVE room={} user={} remaining={} newHost={}", roomId, userId, remaining, newHost);
            result = new LeaveResult(roomId, LeaveResult.Status.PLAYER_LEFT, remaining, room);
        }

        // the leaver no longer blocks the all-answered check
        timers.checkNow(roomId);
        return result;
    }

    // ========================================================================
    //  DISCONNECT / GRACE
    // ========================================================================

    public void onDisconnect(Connection conn) {
        RoomConnections.Attachment a = connections.unregister(conn.id());
        if (a == null || a.roomId() == null || a.identity() == null) return;

        String roomId = a.roomId();
        String userId = a.identity().userId();
        Room room = registry.lookup(roomId).orElse(null);
        if (room == null) return;
        if (connections.hasConnection(roomId, userId)) {
            log.debug("DISCONNECT conn={} user={} still has another connection in room={}", conn.id(), userId, roomId);
            return;
        }

        synchronized (room) {
            Player p = room.getPlayer(userId);
            if (p == null || room.getStatus().isTerminal()) return;

            Instant now = clock.instant();
            p.setStatus(PlayerStatus.DISCONNECTED);
            p.touch(now);
            room.touch(now);

            String newHost = null;
            if (p.isHost()) {
                p.setHost(false);
                newHost = room.assignNewHostIfNecessary(userId, true);
                if (newHost == null) p.setHost(true); // nobody connected to hand over to
            }

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reason", "player-disconnected");
            data.put("userId", userId);
            data.put("hostId", room.getHostId());
            data.put("room", RoomView.from(room));
            broadcaster.broadcast(room, GameEventType.ROOM_UPDATED, data);
            if (newHost != null) broadcastHostChange(room, userId, newHost, "host-disconnected");

            log.info("DISCONNECT room={} user={} graceMs={} newHost={}", roomId, userId, reconnectGraceMs, newHost);
        }

        scheduleGrace(roomId, userId);
        timers.checkNow(roomId);
    }

    private void scheduleGrace(String roomId, String userId) {
        graceTimers.compute(userId, (k, previous) -> {
            if (previous != null) previous.future.cancel(false);
            ScheduledFuture<?> f = presence.schedule(
                    () -> finalizeDisconnect(roomId, userId), reconnectGraceMs, TimeUnit.MILLISECONDS);
            return new GraceTimer(roomId, f);
        });
    }

    private void cancelGrace(String userId, String roomId) {
        graceTimers.computeIfPresent(userId, (k, g) -> {
            if (!g.roomId.equals(roomId)) return g;
            g.future.cancel(false);
            return null;
        });
    }

    /** Grace expired: the player is still away, so the disconnect becomes a leave. */
    void finalizeDisconnect(String roomId, String userId) {
        graceTimers.computeIfPresent(userId, (k, g) -> g.roomId.equals(roomId) ? null : g);

        Room room = registry.lookup(roomId).orElse(null);
        if (room == null) return;
        synchronized (room) {
            Player p = room.getPlayer(userId);
            if (p == null || !p.isDisconnected() || connections.hasConnection(roomId, userId)) return;
        }
        try {
            leave(userId, roomId);
            log.info("GRACE expired room={} user={} -> left", roomId, userId);
        } catch (GameException e) {
            log.info("GRACE expired room={} user={} but leave was not possible: {}", roomId, userId, e.getMessage());
        }
    }

    public boolean isInGrace(String userId) {
        return graceTimers.containsKey(userId);
    }

    private void broadcastHostChange(Room room, String from, String to, String reason) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        data.put("previousHostId", from);
        data.put("hostId", to);
        broadcaster.broadcast(room, GameEventType.ROOM_UPDATED, data);
    }

    @PreDestroy
    public void shutdown() {
        for (GraceTimer g : graceTimers.values()) g.future.cancel(false);
        graceTimers.clear();
        presence.shutdownNow();
    }
}
