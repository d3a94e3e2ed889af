package com.example.triviaroom.error;

import java.util.Objects;

/** Rejected game operation. Thrown before any room state is mutated. */
public class GameException extends RuntimeException {

    private final ErrorCode code;

    public GameException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public GameException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() { return code; }

    public boolean isRetryable() { return code.isRetryable(); }

    public static GameException roomNotFound(String roomId) {
        return new GameException(ErrorCode.ROOM_NOT_FOUND, "Room " + roomId + " not found");
    }

    public static GameException notInRoom(String roomId, String userId) {
        return new GameException(ErrorCode.PLAYER_NOT_IN_ROOM, "User " + userId + " is not in room " + roomId);
    }

    public static GameException invalidState(String message) {
        return new GameException(ErrorCode.INVALID_ROOM_STATE, message);
    }
}
