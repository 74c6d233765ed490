package com.example.logaccess.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.logaccess.config.LogEndpointMatcher.LogCall;
import com.example.logaccess.model.LogEndpoint;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class LogEndpointMatcherTest {

  private final LogEndpointMatcher matcher = new LogEndpointMatcher();

  @Test
  void matchesListRoute() {
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs")))
        .contains(new LogCall(LogEndpoint.LIST_LOGS, ""));
  }

  @Test
  void matchesReadAndDownloadRoutes() {
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs/app.log")))
        .contains(new LogCall(LogEndpoint.READ_LOG, "app.log"));
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs/download/app.log")))
        .contains(new LogCall(LogEndpoint.DOWNLOAD_LOG, "app.log"));
  }

  @Test
  void decodesPercentEncodedFilename() {
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs/my%20app.log")))
        .contains(new LogCall(LogEndpoint.READ_LOG, "my app.log"));
  }

  @Test
  void stripsContextPath() {
    final MockHttpServletRequest request = new MockHttpServletRequest("GET", "/svc/logs/a.log");
    request.setContextPath("/svc");

    assertThat(matcher.match(request)).contains(new LogCall(LogEndpoint.READ_LOG, "a.log"));
  }

  @Test
  void matchesHeadRequests() {
    assertThat(matcher.match(new MockHttpServletRequest("HEAD", "/logs/download/app.log")))
        .contains(new LogCall(LogEndpoint.DOWNLOAD_LOG, "app.log"));
    assertThat(matcher.match(new MockHttpServletRequest("HEAD", "/logs")))
        .contains(new LogCall(LogEndpoint.LIST_LOGS, ""));
  }

  @Test
  void keepsMalformedEscapesAsSent() {
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs/bad%zz.log")))
        .contains(new LogCall(LogEndpoint.READ_LOG, "bad%zz.log"));
  }

  @Test
  void attemptAttributesUnroutablePathsByPrefix() {
    assertThat(matcher.matchAttempt(new MockHttpServletRequest("GET", "/logs/../secret.txt")))
        .contains(new LogCall(LogEndpoint.READ_LOG, "../secret.txt"));
    assertThat(
            matcher.matchAttempt(
                new MockHttpServletRequest("GET", "/logs/download/%2e%2e/secret.txt")))
        .contains(new LogCall(LogEndpoint.DOWNLOAD_LOG, "../secret.txt"));
    assertThat(matcher.matchAttempt(new MockHttpServletRequest("GET", "/logs;jsessionid=1")))
        .contains(new LogCall(LogEndpoint.LIST_LOGS, ""));
    assertThat(matcher.matchAttempt(new MockHttpServletRequest("GET", "/logsx"))).isEmpty();
    assertThat(matcher.matchAttempt(new MockHttpServletRequest("DELETE", "/logs/../x"))).isEmpty();
  }

  @Test
  void ignoresOtherMethodsAndPaths() {
    assertThat(matcher.match(new MockHttpServletRequest("POST", "/logs"))).isEmpty();
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/actuator/health"))).isEmpty();
    assertThat(matcher.match(new MockHttpServletRequest("GET", "/logs/a/b/c.log"))).isEmpty();
  }
}
