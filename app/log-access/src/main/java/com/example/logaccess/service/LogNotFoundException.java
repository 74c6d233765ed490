package com.example.logaccess.service;

public class LogNotFoundException extends RuntimeException {
  public LogNotFoundException(String message) {
    super(message);
  }
}
