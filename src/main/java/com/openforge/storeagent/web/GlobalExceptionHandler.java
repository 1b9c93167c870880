package com.openforge.storeagent.web;

import com.openforge.storeagent.action.ActionExpiredException;
import com.openforge.storeagent.action.ActionNotFoundException;
import com.openforge.storeagent.action.InvalidTransitionException;
import com.openforge.storeagent.agent.SessionNotFoundException;
import com.openforge.storeagent.common.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions onto HTTP statuses:
 *
 *   ActionNotFound / SessionNotFound  404
 *   InvalidTransition                 409
 *   ActionExpired                     410
 *   bean validation                   400
 *   StorageException                  503
 *   anything else                     500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({ActionNotFoundException.class, SessionNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(RuntimeException e) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> invalidTransition(InvalidTransitionException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_id", e.getActionId());
        details.put("current_status", e.getCurrent());
        details.put("attempted_status", e.getAttempted());
        return respond(HttpStatus.CONFLICT, "INVALID_TRANSITION", e.getMessage(), details);
    }

    @ExceptionHandler(ActionExpiredException.class)
    public ResponseEntity<ErrorResponse> expired(ActionExpiredException e) {
        return respond(HttpStatus.GONE, "EXPIRED", "This request is no longer valid: " + e.getMessage(),
                Map.of("action_id", e.getActionId(), "expired_at", e.getExpiresAt()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException e) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError error : e.getBindingResult().getFieldErrors()) {
            fields.put(error.getField(), error.getDefaultMessage());
        }
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Request body is invalid", fields);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException e) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        return respond(status == null ? HttpStatus.INTERNAL_SERVER_ERROR : status,
                status == null ? "ERROR" : status.name(), e.getReason(), null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> storage(StorageException e) {
        log.error("[Web] Storage failure: {}", e.getMessage(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_UNAVAILABLE", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("[Web] Unhandled error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", null);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message,
                                                         Map<String, Object> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .details(details)
                .build());
    }
}
