/*
 * Where: app/log-access security filter chain
 * What: Writes the audit line for one call to a log route
 * Why: Both the audit filter and the firewall rejection path must record the call the same way
 */
package com.example.logaccess.config;

import com.example.logaccess.api.ApiErrorResponseWriter;
import com.example.logaccess.config.LogEndpointMatcher.LogCall;
import com.example.logaccess.service.ApiCallAuditor;
import com.example.logaccess.service.AuditWriteException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;

public class LogCallRecorder {

  private static final Logger logger = LoggerFactory.getLogger(LogCallRecorder.class);
  static final String ANONYMOUS = "anonymous";
  private static final int VISIBLE_KEY_CHARS = 4;

  private final ApiCallAuditor auditor;
  private final ApiErrorResponseWriter errorWriter;
  private final String keyHeaderName;
  private final boolean trustForwardedFor;

  public LogCallRecorder(
      ApiCallAuditor auditor,
      ApiErrorResponseWriter errorWriter,
      String keyHeaderName,
      boolean trustForwardedFor) {
    this.auditor = auditor;
    this.errorWriter = errorWriter;
    this.keyHeaderName = keyHeaderName;
    this.trustForwardedFor = trustForwardedFor;
  }

  /**
   * Records {@code call}. When the audit line cannot be written a 500 body is sent and {@code
   * false} is returned; the caller must not serve the request.
   */
  public boolean record(HttpServletRequest request, HttpServletResponse response, LogCall call)
      throws IOException {
    try {
      auditor.record(
          callerOf(request.getHeader(keyHeaderName)),
          ClientAddresses.resolve(request, trustForwardedFor),
          call.endpoint().label(),
          call.filename());
      return true;
    } catch (AuditWriteException ex) {
      logger.error(
          "request rejected because the audit log is not writable endpoint={}",
          call.endpoint().label());
      errorWriter.write(
          response,
          HttpStatus.INTERNAL_SERVER_ERROR,
          "AUDIT_WRITE_FAILED",
          "failed to record api call");
      return false;
    }
  }

  /** Keys are credentials, so only a short prefix reaches the audit file. */
  static String callerOf(String presentedKey) {
    if (presentedKey == null || presentedKey.isBlank()) {
      return ANONYMOUS;
    }
    final String key = presentedKey.trim();
    if (key.length() <= VISIBLE_KEY_CHARS) {
      return "****";
    }
    return key.substring(0, VISIBLE_KEY_CHARS) + "****";
  }
}
