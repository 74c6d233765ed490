package com.example.logaccess.config;

import com.example.logaccess.api.ApiErrorResponseWriter;
import com.example.logaccess.config.LogEndpointMatcher.LogCall;
import com.example.logaccess.model.LogEndpoint;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.web.firewall.RequestRejectedException;
import org.springframework.security.web.firewall.RequestRejectedHandler;

/**
 * Answers requests refused by the security firewall (encoded slashes, dot segments, semicolons).
 * The firewall runs before the filter chain, so log routes are audited here instead.
 */
public class AuditingRequestRejectedHandler implements RequestRejectedHandler {

  private static final Logger logger =
      LoggerFactory.getLogger(AuditingRequestRejectedHandler.class);

  private final LogEndpointMatcher endpointMatcher;
  private final LogCallRecorder recorder;
  private final ApiErrorResponseWriter errorWriter;

  public AuditingRequestRejectedHandler(
      LogEndpointMatcher endpointMatcher,
      LogCallRecorder recorder,
      ApiErrorResponseWriter errorWriter) {
    this.endpointMatcher = endpointMatcher;
    this.recorder = recorder;
    this.errorWriter = errorWriter;
  }

  @Override
  public void handle(
      HttpServletRequest request,
      HttpServletResponse response,
      RequestRejectedException requestRejectedException)
      throws IOException {
    logger.warn("request rejected by firewall reason={}", requestRejectedException.getMessage());
    final Optional<LogCall> call = endpointMatcher.matchAttempt(request);
    if (call.isPresent() && !recorder.record(request, response, call.get())) {
      return;
    }
    if (call.isPresent() && call.get().endpoint() != LogEndpoint.LIST_LOGS) {
      errorWriter.write(
          response, HttpStatus.BAD_REQUEST, "LOG_INVALID_FILENAME", "invalid log filename");
      return;
    }
    errorWriter.write(response, HttpStatus.BAD_REQUEST, "REQUEST_REJECTED", "request rejected");
  }
}
