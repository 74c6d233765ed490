package com.example.logaccess.service;

public class KeyStoreUnavailableException extends RuntimeException {
  public KeyStoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
