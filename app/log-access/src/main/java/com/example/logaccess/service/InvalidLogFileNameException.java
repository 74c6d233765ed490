/*
 * Where: Log file resolution
 * What: A requested name would leave the storage directory or is malformed
 * Why: Reject traversal before touching the filesystem
 */
package com.example.logaccess.service;

public class InvalidLogFileNameException extends RuntimeException {
  public InvalidLogFileNameException(String message) {
    super(message);
  }
}
