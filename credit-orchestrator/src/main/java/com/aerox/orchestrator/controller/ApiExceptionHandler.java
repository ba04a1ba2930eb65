package com.aerox.orchestrator.controller;

import com.aerox.common.exception.CreditEngineException;
import com.aerox.common.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.Map;

/**
 * Maps input errors to 400 and unknown sessions to 404. Messages are returned verbatim.
 * Policy outcomes (blocks, escalations) are normal responses and never reach this class.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return buildError(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        // a constructor rejection inside the JSON body arrives wrapped in decoding exceptions
        Throwable root = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = root instanceof IllegalArgumentException ? root.getMessage() : ex.getReason();
        return buildError(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleSessionNotFound(SessionNotFoundException ex) {
        return buildError(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(CreditEngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngine(CreditEngineException ex) {
        log.error("[ApiExceptionHandler] Engine error. component={} reason={}", ex.getComponent(), ex.getMessage(), ex);
        return buildError(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> buildError(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "timestamp", Instant.now().toString(),
            "status", status.value(),
            "error", status.getReasonPhrase(),
            "message", message != null ? message : status.getReasonPhrase()
        ));
    }
}
