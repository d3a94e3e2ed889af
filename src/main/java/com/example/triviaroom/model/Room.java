package com.example.triviaroom.model;

import com.example.triviaroom.error.GameException;

import java.time.Instant;
import java.util.*;

/**
 * Room model: players in join order, config, question batch and lifecycle state.
 * Services synchronize on Room instances, so this class itself does not add extra locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String roomId;
    private final RoomConfig config;
    private final Instant createdAt;

    /** Players in join order; the list order drives host reassignment. */
    private final List<Player> players = new ArrayList<>();

    // ---------------------------------------------------------------------
    // Game state
    // ---------------------------------------------------------------------

    private RoomStatus status = RoomStatus.WAITING;
    private List<TriviaQuestion> questions = List.of();
    private int currentQuestionIndex = 0;
    private Instant currentQuestionStartTime;
    private boolean questionOpen = false;
    private Instant startTime;
    private Instant endTime;
    private Instant updatedAt;

    /** Set while the question batch is being fetched for a start request. */
    private boolean startInFlight = false;

    /** Null until the game finished and settlement was attempted. */
    private Boolean settlementConfirmed;

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String roomId, RoomConfig config, Instant createdAt) {
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.config = Objects.requireNonNull(config, "config");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = createdAt;
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getRoomId() { return roomId; }
    public RoomConfig getConfig() { return config; }
    public Instant getCreatedAt() { return createdAt; }

    public RoomStatus getStatus() { return status; }

    public List<TriviaQuestion> getQuestions() { return questions; }
    public void setQuestions(List<TriviaQuestion> questions) {
        this.questions = (questions == null) ? List.of() : List.copyOf(questions);
    }

    public int getCurrentQuestionIndex() { return currentQuestionIndex; }
    public void setCurrentQuestionIndex(int index) {
        if (index < 0 || index > questions.size()) {
            throw new IllegalArgumentException("question index out of range: " + index);
        }
        this.currentQuestionIndex = index;
    }

    public Instant getCurrentQuestionStartTime() { return currentQuestionStartTime; }
    public void setCurrentQuestionStartTime(Instant t) { this.currentQuestionStartTime = t; }

    public boolean isQuestionOpen() { return questionOpen; }
    public void setQuestionOpen(boolean questionOpen) { this.questionOpen = questionOpen; }

    public Instant getStartTime() { return startTime; }
    public void setStartTime(Instant startTime) { this.startTime = startTime; }

    public Instant getEndTime() { return endTime; }
    public void setEndTime(Instant endTime) { this.endTime = endTime; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void touch(Instant now) { this.updatedAt = now; }

    public boolean isStartInFlight() { return startInFlight; }
    public void setStartInFlight(boolean startInFlight) { this.startInFlight = startInFlight; }

    public Boolean getSettlementConfirmed() { return settlementConfirmed; }
    public void setSettlementConfirmed(Boolean settlementConfirmed) { this.settlementConfirmed = settlementConfirmed; }

    /** The question at the current index, or null once the batch is exhausted. */
    public TriviaQuestion currentQuestion() {
        return (currentQuestionIndex < questions.size()) ? questions.get(currentQuestionIndex) : null;
    }

    public boolean isLastQuestion() {
        return currentQuestionIndex >= questions.size() - 1;
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Moves to the next status. Invalid transitions throw INVALID_ROOM_STATE and leave the room untouched.
     */
    public void transitionTo(RoomStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw GameException.invalidState("Room " + roomId + " cannot move from " + status.wire() + " to "
                    + (next == null ? "null" : next.wire()));
        }
        this.status = next;
        this.updatedAt = now;
    }

    // ---------------------------------------------------------------------
    // Players API
    // ---------------------------------------------------------------------

    /** Snapshot in join order. */
    public List<Player> getPlayers() {
        return new ArrayList<>(players);
    }

    public int getPlayerCount() { return players.size(); }

    public boolean isFull() {
        return players.size() >= config.maxPlayers();
    }

    public Player getPlayer(String userId) {
        if (userId == null) return null;
        for (Player p : players) {
            if (userId.equals(p.getUserId())) return p;
        }
        return null;
    }

    /** Players that still count for the all-answered check. */
    public List<Player> getActivePlayers() {
        List<Player> out = new ArrayList<>();
        for (Player p : players) {
            if (!p.isDisconnected()) out.add(p);
        }
        return out;
    }

    public void addPlayer(Player p) {
        Objects.requireNonNull(p, "player");
        if (getPlayer(p.getUserId()) != null) {
            throw new IllegalStateException("player already in room: " + p.getUserId());
        }
        if (isFull()) {
            throw new IllegalStateException("room is full: " + roomId);
        }
        players.add(p);
        if (players.size() == 1) p.setHost(true);
    }

    public Player removePlayer(String userId) {
        Iterator<Player> it = players.iterator();
        while (it.hasNext()) {
            Player p = it.next();
            if (p.getUserId().equals(userId)) {
                it.remove();
                return p;
            }
        }
        return null;
    }

    public Player getHost() {
        for (Player p : players) {
            if (p.isHost()) return p;
        }
        return null;
    }

    public String getHostId() {
        Player host = getHost();
        return (host == null) ? null : host.getUserId();
    }

    /**
     * Assigns a new host if none exists. Candidates are taken in join order:
     * connected players first, then (unless connectedOnly) anyone else.
     * Returns the new host id or null if none could be assigned.
     */
    public String assignNewHostIfNecessary(String previousHostId, boolean connectedOnly) {
        if (getHost() != null) return null;

        Player candidate = null;
        for (Player p : players) {
            if (!p.isDisconnected() && !Objects.equals(p.getUserId(), previousHostId)) {
                candidate = p;
                break;
            }
        }
        if (candidate == null && !connectedOnly) {
            for (Player p : players) {
                if (!Objects.equals(p.getUserId(), previousHostId)) {
                    candidate = p;
                    break;
                }
            }
        }

        if (candidate != null) {
            candidate.setHost(true);
            return candidate.getUserId();
        }
        return null;
    }

    @Override
    public String toString() {
        return "Room{" +
                "roomId='" + roomId + '\'' +
                ", status=" + status +
                ", players=" + players.size() +
                ", question=" + currentQuestionIndex + "/" + questions.size() +
                '}';
    }
}
