package com.bank.lease.api.exception;

import com.bank.lease.domain.exception.CandidateValidationException;
import com.bank.lease.domain.exception.ConfigurationException;
import com.bank.lease.domain.exception.ConflictNotFoundException;
import com.bank.lease.domain.exception.InvalidTransitionException;
import com.bank.lease.domain.exception.UnknownLeaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized exception handler for REST API
 * Provides consistent error response format and proper HTTP status codes
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CandidateValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(CandidateValidationException ex) {
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage());
        body.put("errors", ex.getErrors());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(UnknownLeaseException.class)
    public ResponseEntity<Map<String, Object>> handleUnknownLease(UnknownLeaseException ex) {
        Map<String, Object> body = body(HttpStatus.NOT_FOUND, "Unknown Lease", ex.getMessage());
        body.put("leaseId", ex.getLeaseId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(ConflictNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleConflictNotFound(ConflictNotFoundException ex) {
        Map<String, Object> body = body(HttpStatus.NOT_FOUND, "Conflict Not Found", ex.getMessage());
        body.put("conflictId", ex.getConflictId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidTransition(InvalidTransitionException ex) {
        Map<String, Object> body = body(HttpStatus.CONFLICT, "Invalid Transition", ex.getMessage());
        body.put("conflictId", ex.getConflictId());
        body.put("currentStatus", ex.getCurrentStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(ConfigurationException ex) {
        log.error("Configuration error: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError()
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Configuration Error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage()));
    }

    private static Map<String, Object> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
