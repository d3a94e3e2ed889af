package com.example.triviaroom.service;

import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Player;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of active rooms keyed by room id.
 * The only process-wide mutable state; the rooms themselves are guarded by their own monitors.
 */
@Component
public class RoomRegistry {

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    static final int ROOM_ID_LENGTH = 8;
    private static final int MAX_ID_ATTEMPTS = 20;
    private static final char[] ALPHANUM = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789".toCharArray();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final QuestionTimerScheduler timers;
    private final Clock clock;

    public RoomRegistry(QuestionTimerScheduler timers, Clock clock) {
        this.timers = timers;
        this.clock = clock;
    }

    /** Creates a WAITING room with the given host as its first player. */
    public Room create(RoomConfig config, Player host) {
        Objects.requireNonNull(host, "host");
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String roomId = generateId(ROOM_ID_LENGTH);
            if (rooms.containsKey(roomId)) continue;

            Room room = new Room(roomId, config, clock.instant());
            room.addPlayer(host);
            if (rooms.putIfAbsent(roomId, room) == null) {
                log.info("ROOM created room={} host={} topic={} difficulty={} maxPlayers={}",
                        roomId, host.getUserId(), config.topic(), config.difficulty().wire(), config.maxPlayers());
                return room;
            }
        }
        throw new IllegalStateException("Could not allocate a unique room id");
    }

    /** Throws ROOM_NOT_FOUND for unknown ids. */
    public Room find(String roomId) {
        Room room = (roomId == null) ? null : rooms.get(roomId);
        if (room == null) throw GameException.roomNotFound(roomId);
        return room;
    }

    public Optional<Room> lookup(String roomId) {
        return (roomId == null) ? Optional.empty() : Optional.ofNullable(rooms.get(roomId));
    }

    /** True while this exact instance is still registered. */
    public boolean isRegistered(Room room) {
        return room != null && rooms.get(room.getRoomId()) == room;
    }

    /** Removes the room and cancels its timer. Returns false if it was already gone. */
    public boolean remove(String roomId) {
        if (roomId == null) return false;
        timers.cancel(roomId);
        Room removed = rooms.remove(roomId);
        if (removed != null) log.info("ROOM removed room={} status={}", roomId, removed.getStatus().wire());
        return removed != null;
    }

    public List<Room> search(RoomSearchCriteria criteria) {
        RoomSearchCriteria c = (criteria == null) ? RoomSearchCriteria.any() : criteria;
        List<Room> out = new ArrayList<>();
        for (Room room : rooms.values()) {
            synchronized (room) {
                if (c.matches(room)) out.add(room);
            }
        }
        out.sort(Comparator.comparing(Room::getCreatedAt).thenComparing(Room::getRoomId));
        return out;
    }

    public int size() {
        return rooms.size();
    }

    @PreDestroy
    public void shutdown() {
        timers.cancelAll();
        int n = rooms.size();
        rooms.clear();
        log.info("ROOM registry shut down, dropped {} rooms", n);
    }

    static String generateId(int length) {
        char[] out = new char[length];
        for (int i = 0; i < length; i++) out[i] = ALPHANUM[RANDOM.nextInt(ALPHANUM.length)];
        return new String(out);
    }
}
