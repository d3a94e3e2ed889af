package com.example.triviaroom.view;

import com.example.triviaroom.model.Player;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomConfig;
import com.example.triviaroom.model.RoomStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Redacted room snapshot; build it while holding the room monitor. */
public record RoomView(
        String roomId,
        String hostId,
        RoomStatus status,
        RoomConfig config,
        List<PlayerView> players,
        int currentQuestionIndex,
        int totalQuestions,
        Instant createdAt,
        Instant updatedAt,
        Instant startTime,
        Instant endTime,
        Boolean settlementConfirmed
) {
    public static RoomView from(Room r) {
        Objects.requireNonNull(r, "r");
        List<PlayerView> players = new ArrayList<>();
        for (Player p : r.getPlayers()) players.add(PlayerView.from(p));
        return new RoomView(
                r.getRoomId(),
                r.getHostId(),
                r.getStatus(),
                r.getConfig(),
                players,
                r.getCurrentQuestionIndex(),
                r.getQuestions().size(),
                r.getCreatedAt(),
                r.getUpdatedAt(),
                r.getStartTime(),
                r.getEndTime(),
                r.getSettlementConfirmed());
    }
}
