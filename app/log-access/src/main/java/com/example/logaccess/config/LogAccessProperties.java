/*
 * Where: app/log-access configuration binding
 * What: Storage directory, audit log location and rotation threshold
 * Why: Paths differ per host and must be checked before the first request arrives
 */
package com.example.logaccess.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "logaccess")
public record LogAccessProperties(
    @NotBlank String storageDir,
    @NotBlank String auditLogPath,
    @Positive long rotationThresholdBytes,
    boolean trustForwardedFor) {

  public Path storagePath() {
    return Path.of(storageDir).toAbsolutePath().normalize();
  }

  public Path auditLogFile() {
    return Path.of(auditLogPath).toAbsolutePath().normalize();
  }
}
