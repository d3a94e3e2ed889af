package com.example.triviaroom.web;

import com.example.triviaroom.error.ErrorCode;
import com.example.triviaroom.error.GameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Maps failures to {ok=false, code, message, retryable} with the code's HTTP status. */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(GameException.class)
    public ResponseEntity<ErrorView> handleGame(GameException e) {
        log.debug("REST rejected code={} message={}", e.getCode(), e.getMessage());
        return respond(e.getCode(), e.getMessage());
    }

    // bean validation on request bodies (400)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorView> handleInvalid(MethodArgumentNotValidException e) {
        FieldError first = e.getBindingResult().getFieldError();
        String message = (first == null) ? "Invalid request"
                : first.getField() + ": " + first.getDefaultMessage();
        return respond(ErrorCode.INVALID_REQUEST, message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorView> handleUnreadable(Exception e) {
        return respond(ErrorCode.INVALID_REQUEST, "Malformed request");
    }

    // anything else (500)
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorView> handleException(Exception e) {
        log.error("REST unexpected failure", e);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal error");
    }

    private static ResponseEntity<ErrorView> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getStatus()).body(new ErrorView(code, message));
    }

    /** Fehler-View (kompakt) */
    public static final class ErrorView {
        public boolean ok = false;
        public String code;
        public String message;
        public boolean retryable;

        public ErrorView(ErrorCode code, String message) {
            this.code = code.name();
            this.message = (message == null ? "Internal error" : message);
            this.retryable = code.isRetryable();
        }
    }
}
