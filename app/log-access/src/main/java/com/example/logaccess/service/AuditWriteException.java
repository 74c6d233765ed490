/*
 * Where: Audit log writer
 * What: Rotation or append of the audit log failed
 * Why: A call that cannot be audited is not served
 */
package com.example.logaccess.service;

public class AuditWriteException extends RuntimeException {
  public AuditWriteException(String message, Throwable cause) {
    super(message, cause);
  }
}
