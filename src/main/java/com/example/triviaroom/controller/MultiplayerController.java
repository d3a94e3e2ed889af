package com.example.triviaroom.controller;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import com.example.triviaroom.model.Difficulty;
import com.example.triviaroom.model.Identity;
import com.example.triviaroom.model.LeaderboardEntry;
import com.example.triviaroom.model.Room;
import com.example.triviaroom.model.RoomStatus;
import com.example.triviaroom.security.IdentityVerifier;
import com.example.triviaroom.service.*;
import com.example.triviaroom.view.GameStateView;
import com.example.triviaroom.view.RoomView;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP fallback for clients without a socket. Same semantics as the WebSocket messages;
 * the caller identity comes from the X-User-* headers set by the auth gateway.
 */
@RestController
@RequestMapping("/api/multiplayer")
public class MultiplayerController {

  static final String H_USER_ID = "X-User-Id";
  static final String H_EMAIL = "X-User-Email";
  static final String H_ROLE = "X-User-Role";
  static final String H_NAME = "X-User-Name";

  private final TriviaGameService game;
  private final IdentityVerifier identityVerifier;

  public MultiplayerController(TriviaGameService game, IdentityVerifier identityVerifier) {
    this.game = game;
    this.identityVerifier = identityVerifier;
  }

  // --- Create / Join / Leave ----------------------------------------------

  @PostMapping("/rooms")
  public ResponseEntity<CreatedView> create(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody CreateRoomRequest body
  ) {
    Identity me = identity(headers);
    Room room = game.createRoom(me, body.toCommand(), null);
    RoomView view = game.view(room);
    return ResponseEntity.status(HttpStatus.CREATED).body(new CreatedView(view, view.roomId()));
  }

  @PostMapping("/rooms/join")
  public ResponseEntity<RoomEnvelope> join(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody RoomRequest body
  ) {
    Room room = game.joinRoom(identity(headers), body.roomId, null);
    return ResponseEntity.ok(new RoomEnvelope(game.view(room)));
  }

  @PostMapping("/rooms/leave")
  public ResponseEntity<LeaveView> leave(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody RoomRequest body
  ) {
    LeaveResult r = game.leaveRoom(identity(headers), body.roomId);
    return ResponseEntity.ok(new LeaveView(r.roomId(), r.status().wire(), r.remainingPlayers(), game.view(r.room())));
  }

  // --- Host actions --------------------------------------------------------

  @PostMapping("/rooms/start")
  public ResponseEntity<RoomEnvelope> start(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody RoomRequest body
  ) {
    Room room = game.startGame(identity(headers), body.roomId);
    return ResponseEntity.ok(new RoomEnvelope(game.view(room)));
  }

  @PostMapping("/rooms/cancel")
  public ResponseEntity<RoomEnvelope> cancel(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody RoomRequest body
  ) {
    Room room = game.cancelGame(identity(headers), body.roomId);
    return ResponseEntity.ok(new RoomEnvelope(game.view(room)));
  }

  // --- Answers -------------------------------------------------------------

  @PostMapping("/rooms/answer")
  public ResponseEntity<AnswerView> answer(
      @RequestHeader HttpHeaders headers,
      @Valid @RequestBody AnswerRequest body
  ) {
    AnswerResult r = game.submitAnswer(identity(headers), body.roomId, body.questionId, body.answer, body.timeSpent);
    return ResponseEntity.ok(new AnswerView(r.roomId(), r.questionId(), r.isCorrect(), r.scoreEarned(), r.leaderboard()));
  }

  // --- Queries -------------------------------------------------------------

  @GetMapping("/rooms/{roomId}")
  public ResponseEntity<RoomEnvelope> details(
      @RequestHeader HttpHeaders headers,
      @PathVariable String roomId
  ) {
    return ResponseEntity.ok(new RoomEnvelope(game.roomDetails(identity(headers), roomId)));
  }

  @GetMapping("/rooms/{roomId}/state")
  public ResponseEntity<StateView> state(
      @RequestHeader HttpHeaders headers,
      @PathVariable String roomId
  ) {
    Identity me = identity(headers);
    RoomView room = game.roomDetails(me, roomId);
    GameStateView state = game.gameState(me, roomId);
    return ResponseEntity.ok(new StateView(room, state));
  }

  @GetMapping("/rooms")
  public ResponseEntity<RoomsView> search(
      @RequestHeader HttpHeaders headers,
      @RequestParam(required = false) String topic,
      @RequestParam(required = false) String difficulty,
      @RequestParam(required = false) Integer maxPlayers,
      @RequestParam(required = false) String status
  ) {
    identity(headers);
    RoomSearchCriteria criteria;
    try {
      criteria = new RoomSearchCriteria(topic, Difficulty.fromWire(difficulty), maxPlayers, RoomStatus.fromWire(status));
    } catch (IllegalArgumentException e) {
      throw new GameException(ErrorCode.INVALID_REQUEST, "Unknown difficulty or status filter");
    }
    return ResponseEntity.ok(new RoomsView(game.search(criteria)));
  }

  // --- helpers -------------------------------------------------------------

  private Identity identity(HttpHeaders headers) {
    Map<String, String> claims = new HashMap<>();
    putIfPresent(claims, IdentityVerifier.USER_ID, headers.getFirst(H_USER_ID));
    putIfPresent(claims, IdentityVerifier.EMAIL, headers.getFirst(H_EMAIL));
    putIfPresent(claims, IdentityVerifier.ROLE, headers.getFirst(H_ROLE));
    putIfPresent(claims, IdentityVerifier.DISPLAY_NAME, headers.getFirst(H_NAME));
    return identityVerifier.verify(claims);
  }

  private static void putIfPresent(Map<String, String> m, String k, String v) {
    if (v != null) m.put(k, v);
  }

  // ===== DTOs (Views/Requests) ============================================

  /** POST /rooms body */
  public static final class CreateRoomRequest {
    @NotBlank @Size(max = 100)
    public String topic;
    @NotBlank
    public String difficulty;
    @Min(1) @Max(50)
    public Integer questionsPerRequest;
    @Min(1)
    public Integer maxPlayers;
    @Min(1) @Max(300)
    public Integer timePerQuestion;
    public String gameMode;

    CreateRoomCommand toCommand() {
      return new CreateRoomCommand(topic, difficulty, questionsPerRequest, maxPlayers, timePerQuestion, gameMode);
    }
  }

  /** join / leave / start / cancel body */
  public static final class RoomRequest {
    @NotBlank
    public String roomId;
  }

  /** POST /rooms/answer body */
  public static final class AnswerRequest {
    @NotBlank
    public String roomId;
    @NotBlank
    public String questionId;
    @NotNull @Min(0)
    public Integer answer;
    @PositiveOrZero
    public Double timeSpent;
  }

  public static final class CreatedView {
    public RoomView room;
    public String code;
    public CreatedView(RoomView room, String code) { this.room = room; this.code = code; }
  }

  public static final class RoomEnvelope {
    public RoomView room;
    public RoomEnvelope(RoomView room) { this.room = room; }
  }

  public static final class LeaveView {
    public String roomId;
    public String status;
    public int remainingPlayers;
    public RoomView room;
    public LeaveView(String roomId, String status, int remainingPlayers, RoomView room) {
      this.roomId = roomId;
      this.status = status;
      this.remainingPlayers = remainingPlayers;
      this.room = room;
    }
  }

  public static final class AnswerView {
    public String roomId;
    public String questionId;
    public boolean isCorrect;
    public int scoreEarned;
    public List<LeaderboardEntry> leaderboard;
    public AnswerView(String roomId, String questionId, boolean isCorrect, int scoreEarned, List<LeaderboardEntry> leaderboard) {
      this.roomId = roomId;
      this.questionId = questionId;
      this.isCorrect = isCorrect;
      this.scoreEarned = scoreEarned;
      this.leaderboard = leaderboard;
    }
  }

  public static final class StateView {
    public RoomView room;
    public GameStateView gameState;
    public StateView(RoomView room, GameStateView gameState) { this.room = room; this.gameState = gameState; }
  }

  public static final class RoomsView {
    public List<RoomView> rooms;
    public RoomsView(List<RoomView> rooms) { this.rooms = rooms; }
  }
}
