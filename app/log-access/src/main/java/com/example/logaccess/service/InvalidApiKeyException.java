/*
 * Where: Key validation
 * What: The presented key is missing or unknown
 * Why: Callers get one undifferentiated 401 whatever the reason
 */
package com.example.logaccess.service;

public class InvalidApiKeyException extends RuntimeException {

  public static final String MESSAGE = "Invalid API Key";

  public InvalidApiKeyException() {
    super(MESSAGE);
  }
}
