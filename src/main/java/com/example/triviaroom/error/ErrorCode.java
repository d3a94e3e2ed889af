package com.example.triviaroom.error;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by the HTTP and WebSocket transports.
 * Each code knows its HTTP status and whether a client may retry the same request.
 */
public enum ErrorCode {

    ROOM_NOT_FOUND(HttpStatus.NOT_FOUND, false),
    ROOM_FULL(HttpStatus.CONFLICT, false),
    INVALID_ROOM_STATE(HttpStatus.CONFLICT, false),
    PLAYER_NOT_IN_ROOM(HttpStatus.FORBIDDEN, false),
    QUESTION_MISMATCH(HttpStatus.CONFLICT, false),
    DUPLICATE_ANSWER(HttpStatus.CONFLICT, false),
    UNAUTHORIZED(HttpStatus.FORBIDDEN, false),
    PROVIDER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, true),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, false),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, false),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, true);

    private final HttpStatus status;
    private final boolean retryable;

    ErrorCode(HttpStatus status, boolean retryable) {
        this.status = status;
        this.retryable = retryable;
    }

    public HttpStatus getStatus() { return status; }

    public boolean isRetryable() { return retryable; }
}
