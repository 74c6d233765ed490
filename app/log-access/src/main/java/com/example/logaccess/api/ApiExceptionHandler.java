package com.example.logaccess.api;

import com.example.logaccess.service.AuditWriteException;
import com.example.logaccess.service.InvalidApiKeyException;
import com.example.logaccess.service.InvalidLogFileNameException;
import com.example.logaccess.service.KeyStoreUnavailableException;
import com.example.logaccess.service.LogNotFoundException;
import com.example.logaccess.service.LogStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(LogNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotFound(LogNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("LOG_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(InvalidLogFileNameException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidFileName(InvalidLogFileNameException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("LOG_INVALID_FILENAME", ex.getMessage()));
  }

  @ExceptionHandler(InvalidApiKeyException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidApiKey(InvalidApiKeyException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("UNAUTHORIZED", InvalidApiKeyException.MESSAGE));
  }

  @ExceptionHandler(KeyStoreUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleKeyStoreUnavailable(
      KeyStoreUnavailableException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("KEY_STORE_UNAVAILABLE", "api key store is unavailable"));
  }

  @ExceptionHandler(AuditWriteException.class)
  public ResponseEntity<ApiErrorResponse> handleAuditWrite(AuditWriteException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("AUDIT_WRITE_FAILED", "failed to record api call"));
  }

  @ExceptionHandler(LogStorageException.class)
  public ResponseEntity<ApiErrorResponse> handleStorage(LogStorageException ex) {
    logger.error("log storage failure", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("LOG_STORAGE_ERROR", "log storage is unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unexpected failure while serving request", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("LOG_ACCESS_INTERNAL_ERROR", "internal server error"));
  }
}
