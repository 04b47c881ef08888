package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.agent.AgentNotFoundException;
import com.aistudio.orchestrator.agent.InputValidationException;
import com.aistudio.orchestrator.service.InvalidTransitionException;
import com.aistudio.orchestrator.service.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders failures as {@code {error, message, status}}.
 *
 * NotFound → 404, InvalidTransition → 409, validation → 400, anything else → 500
 * with a generic message.
 */
@RestControllerAdvice(basePackages = "com.aistudio.orchestrator.api")
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({JobNotFoundException.class, AgentNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, "NotFound", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException ex) {
        return respond(HttpStatus.CONFLICT, "InvalidTransition", ex.getMessage());
    }

    @ExceptionHandler({InputValidationException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleValidation(RuntimeException ex) {
        return respond(HttpStatus.BAD_REQUEST, "ValidationError", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "ValidationError", message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "ValidationError", "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}
