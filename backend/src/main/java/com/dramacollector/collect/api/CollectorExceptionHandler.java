package com.dramacollector.collect.api;

import com.dramacollector.collect.persistence.StoreUnavailableException;
import com.dramacollector.collect.service.JobAlreadyRunningException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CollectorExceptionHandler {

  @ExceptionHandler(JobAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleAlreadyRunning(JobAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "job_already_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(StoreUnavailableException.class)
  public ResponseEntity<Map<String, String>> handleStoreUnavailable(StoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "store_unavailable", "message", ex.getMessage()));
  }
}
