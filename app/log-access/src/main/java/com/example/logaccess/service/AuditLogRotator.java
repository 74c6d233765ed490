/*
 * Where: Audit log writer
 * What: Archives the active audit log once it reaches the size threshold
 * Why: Keeps the active file bounded while preserving every past entry
 */
package com.example.logaccess.service;

import com.example.logaccess.config.LogAccessProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class AuditLogRotator {

  private static final Logger logger = LoggerFactory.getLogger(AuditLogRotator.class);
  private static final DateTimeFormatter ARCHIVE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
  private static final String DEFAULT_EXTENSION = ".log";

  private final LogAccessProperties properties;
  private final Clock clock;
  private final LogAccessMetrics metrics;

  /**
   * Renames {@code activeLog} to its archive name when its size is at or above the threshold.
   * Callers must hold the writer lock; the next append recreates {@code activeLog}.
   *
   * @return the archive path when a rotation happened
   */
  public Optional<Path> rotateIfNeeded(Path activeLog) throws IOException {
    if (!Files.isRegularFile(activeLog)) {
      return Optional.empty();
    }
    final long size;
    try {
      size = Files.size(activeLog);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
    if (size < properties.rotationThresholdBytes()) {
      return Optional.empty();
    }
    final Path archive = archivePathFor(activeLog);
    Files.move(activeLog, archive, StandardCopyOption.ATOMIC_MOVE);
    metrics.recordRotation();
    logger.info(
        "audit log rotated sizeBytes={} thresholdBytes={} archive={}",
        size,
        properties.rotationThresholdBytes(),
        archive.getFileName());
    return Optional.of(archive);
  }

  Path archivePathFor(Path activeLog) {
    final String fileName = activeLog.getFileName().toString();
    final int dot = fileName.lastIndexOf('.');
    final String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
    final String extension = dot > 0 ? fileName.substring(dot) : DEFAULT_EXTENSION;
    final String base = stem + "_" + ARCHIVE_TIMESTAMP.format(LocalDateTime.now(clock));

    Path candidate = activeLog.resolveSibling(base + extension);
    // Same-second rotations keep the earlier archive.
    for (int attempt = 1; Files.exists(candidate); attempt++) {
      candidate = activeLog.resolveSibling(base + "_" + attempt + extension);
    }
    return candidate;
  }
}
