package com.example.logaccess.config;

import com.example.logaccess.model.LogEndpoint;
import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.util.UriUtils;

/** Maps a raw request to the audited log operation it targets, before any handler runs. */
public class LogEndpointMatcher {

  private static final String LIST_PATH = "/logs";
  private static final String DOWNLOAD_PATTERN = "/logs/download/{filename}";
  private static final String READ_PATTERN = "/logs/{filename}";
  private static final String DOWNLOAD_PREFIX = "/logs/download/";
  private static final String READ_PREFIX = "/logs/";
  // HEAD is served by the same GET handlers.
  private static final Set<String> AUDITED_METHODS = Set.of("GET", "HEAD");

  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public record LogCall(LogEndpoint endpoint, String filename) {}

  public Optional<LogCall> match(HttpServletRequest request) {
    if (!AUDITED_METHODS.contains(request.getMethod())) {
      return Optional.empty();
    }
    final String path = pathWithinApplication(request);
    if (LIST_PATH.equals(path)) {
      return Optional.of(new LogCall(LogEndpoint.LIST_LOGS, ""));
    }
    if (pathMatcher.match(DOWNLOAD_PATTERN, path)) {
      return Optional.of(new LogCall(LogEndpoint.DOWNLOAD_LOG, filename(DOWNLOAD_PATTERN, path)));
    }
    if (pathMatcher.match(READ_PATTERN, path)) {
      return Optional.of(new LogCall(LogEndpoint.READ_LOG, filename(READ_PATTERN, path)));
    }
    return Optional.empty();
  }

  /**
   * Like {@link #match} but also attributes paths that no route pattern accepts, such as
   * {@code /logs/../x}, to the route their prefix names. Used for requests the firewall rejects.
   */
  public Optional<LogCall> matchAttempt(HttpServletRequest request) {
    final Optional<LogCall> exact = match(request);
    if (exact.isPresent() || !AUDITED_METHODS.contains(request.getMethod())) {
      return exact;
    }
    final String path = pathWithinApplication(request);
    if (path.startsWith(DOWNLOAD_PREFIX)) {
      return Optional.of(
          new LogCall(LogEndpoint.DOWNLOAD_LOG, decode(path.substring(DOWNLOAD_PREFIX.length()))));
    }
    if (path.startsWith(READ_PREFIX)) {
      return Optional.of(
          new LogCall(LogEndpoint.READ_LOG, decode(path.substring(READ_PREFIX.length()))));
    }
    if (path.startsWith(LIST_PATH + ";")) {
      return Optional.of(new LogCall(LogEndpoint.LIST_LOGS, ""));
    }
    return Optional.empty();
  }

  private String filename(String pattern, String path) {
    final Map<String, String> variables = pathMatcher.extractUriTemplateVariables(pattern, path);
    return decode(variables.get("filename"));
  }

  private static String decode(String raw) {
    try {
      return UriUtils.decode(raw, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      // malformed percent escapes are audited as sent
      return raw;
    }
  }

  static String pathWithinApplication(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    final String contextPath = request.getContextPath();
    if (uri == null) {
      return "";
    }
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
