package com.example.logaccess.service;

public class LogStorageException extends RuntimeException {
  public LogStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
