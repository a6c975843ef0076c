package com.vidsum.chatbot.controller;

import com.vidsum.chatbot.service.ChatServiceUnavailableException;
import com.vidsum.chatbot.service.generation.GenerationFailedException;
import com.vidsum.chatbot.service.guardrail.GuardrailUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures raised before any stream event was written to {@code {"detail": ...}} bodies.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception) {
        String detail = exception.getFieldErrors().stream()
                .map(this::describe)
                .collect(Collectors.joining("; "));
        return detail(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Invalid request" : detail);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(ServerWebInputException exception) {
        return detail(HttpStatus.BAD_REQUEST, exception.getReason() == null ? "Invalid request body" : exception.getReason());
    }

    @ExceptionHandler(ChatServiceUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(ChatServiceUnavailableException exception) {
        return detail(HttpStatus.SERVICE_UNAVAILABLE, exception.getMessage());
    }

    @ExceptionHandler(GuardrailUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleGuardrailUnavailable(GuardrailUnavailableException exception) {
        log.warn("Rejecting chat request, {} guardrail unavailable: {}", exception.direction(), exception.getMessage());
        return detail(HttpStatus.SERVICE_UNAVAILABLE, "Moderation service unavailable");
    }

    @ExceptionHandler(GenerationFailedException.class)
    public ResponseEntity<Map<String, Object>> handleGenerationFailed(GenerationFailedException exception) {
        return detail(HttpStatus.BAD_GATEWAY, exception.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException exception) {
        HttpStatus status = HttpStatus.resolve(exception.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return detail(status, exception.getReason());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception exception) {
        log.error("Chat request failed before streaming", exception);
        return detail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    private ResponseEntity<Map<String, Object>> detail(HttpStatus status, String detail) {
        // Always JSON, also for requests that accept the event stream.
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("detail", detail == null ? status.getReasonPhrase() : detail));
    }
}
