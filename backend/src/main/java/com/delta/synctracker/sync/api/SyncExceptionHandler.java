package com.delta.synctracker.sync.api;

import com.delta.synctracker.sync.service.IntegrationNotFoundException;
import com.delta.synctracker.sync.service.InvalidJobTransitionException;
import com.delta.synctracker.sync.service.JobNotFoundException;
import com.delta.synctracker.sync.service.QuotaExhaustedException;
import com.delta.synctracker.sync.service.SyncAlreadyRunningException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SyncExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleJobNotFound(JobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(IntegrationNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleIntegrationNotFound(IntegrationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "integration_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidJobTransitionException.class)
  public ResponseEntity<Map<String, String>> handleInvalidTransition(InvalidJobTransitionException ex) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("error", "invalid_transition");
    body.put("message", ex.getMessage());
    body.put("currentStatus", String.valueOf(ex.getCurrentStatus()));
    body.put("action", ex.getAction());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(SyncAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleSyncRunning(SyncAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "sync_already_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(QuotaExhaustedException.class)
  public ResponseEntity<Map<String, String>> handleQuotaExhausted(QuotaExhaustedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "quota_exhausted", "message", ex.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
    String message = ex.getMessage() == null ? "Invalid request" : ex.getMessage();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "bad_request", "message", message));
  }
}
