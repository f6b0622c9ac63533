package com.yoursp.vkyc.exception;

import com.yoursp.vkyc.config.CorrelationIdFilter;
import com.yoursp.vkyc.modules.link.exception.LinkException;
import com.yoursp.vkyc.modules.session.exception.AgentConflictException;
import com.yoursp.vkyc.modules.session.exception.InvalidTransitionException;
import com.yoursp.vkyc.modules.session.exception.SessionNotFoundException;
import com.yoursp.vkyc.modules.signaling.exception.SessionNotActiveException;
import com.yoursp.vkyc.modules.verification.exception.VerificationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Validation Failed", "Request is invalid");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, MissingRequestHeaderException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        String message = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request";
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
    }

    /**
     * NOT_FOUND → 404, EXPIRED → 410, CONSUMED → 409.
     */
    @ExceptionHandler(LinkException.class)
    public ResponseEntity<Map<String, Object>> handleLinkException(LinkException ex) {
        HttpStatus status = switch (ex.getReason()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case EXPIRED -> HttpStatus.GONE;
            case CONSUMED -> HttpStatus.CONFLICT;
        };
        return respond(status, "LINK_" + ex.getReason().name(), ex.getMessage());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException ex) {
        log.info("Rejected transition: sessionId={}, from={}, to={}", ex.getSessionId(), ex.getFrom(), ex.getTo());
        return respond(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage());
    }

    @ExceptionHandler(AgentConflictException.class)
    public ResponseEntity<Map<String, Object>> handleAgentConflict(AgentConflictException ex) {
        return respond(HttpStatus.CONFLICT, "AGENT_CONFLICT", ex.getMessage());
    }

    @ExceptionHandler(VerificationBusyException.class)
    public ResponseEntity<Map<String, Object>> handleVerificationBusy(VerificationBusyException ex) {
        return respond(HttpStatus.CONFLICT, "VERIFICATION_BUSY", ex.getMessage());
    }

    @ExceptionHandler(SessionNotActiveException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotActive(SessionNotActiveException ex) {
        return respond(HttpStatus.CONFLICT, "SESSION_NOT_ACTIVE", ex.getMessage());
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with correlation ID — never exposes stack traces.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please reference correlationId for support.");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(body(status, error, message));
    }

    private Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("correlationId", MDC.get(CorrelationIdFilter.MDC_KEY));
        return body;
    }
}
