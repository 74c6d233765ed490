package com.example.logaccess.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "logaccess.auth")
public record LogAccessAuthProperties(
    Boolean enabled, String headerName, List<String> protectedPaths) {

  public LogAccessAuthProperties {
    enabled = enabled == null || enabled;
    headerName = headerName == null || headerName.isBlank() ? "userKey" : headerName;
    protectedPaths =
        protectedPaths == null || protectedPaths.isEmpty()
            ? List.of("/logs", "/logs/**")
            : List.copyOf(protectedPaths);
  }

  public boolean isEnabled() {
    return Boolean.TRUE.equals(enabled);
  }
}
