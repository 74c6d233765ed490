/*
 * Where: app/log-access security filter chain
 * What: Writes the audit line for a log route before the key is checked
 * Why: Rejected calls must be audited exactly like served ones
 */
package com.example.logaccess.config;

import com.example.logaccess.config.LogEndpointMatcher.LogCall;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.springframework.web.filter.OncePerRequestFilter;

public class CallAuditFilter extends OncePerRequestFilter {

  private final LogEndpointMatcher endpointMatcher;
  private final LogCallRecorder recorder;

  public CallAuditFilter(LogEndpointMatcher endpointMatcher, LogCallRecorder recorder) {
    this.endpointMatcher = endpointMatcher;
    this.recorder = recorder;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return endpointMatcher.match(request).isEmpty();
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final Optional<LogCall> call = endpointMatcher.match(request);
    if (call.isPresent() && !recorder.record(request, response, call.get())) {
      return;
    }
    filterChain.doFilter(request, response);
  }
}
