package com.example.logaccess.service;

import com.example.logaccess.config.LogAccessProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Single writer for the audit log file.
 *
 * <p>Size check, rotation and append run as one critical section so that concurrent requests in
 * this process never rotate the same file twice or interleave partial lines. Other processes
 * writing the same path are not coordinated.
 */
@Component
public class AuditLogWriter {

  private static final Logger logger = LoggerFactory.getLogger(AuditLogWriter.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Path activeLog;
  private final AuditLogRotator rotator;
  private final LogAccessMetrics metrics;

  public AuditLogWriter(
      LogAccessProperties properties, AuditLogRotator rotator, LogAccessMetrics metrics) {
    this.activeLog = properties.auditLogFile();
    this.rotator = rotator;
    this.metrics = metrics;
  }

  public void append(String line) {
    lock.lock();
    try {
      rotator.rotateIfNeeded(activeLog);
      final Path parent = activeLog.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(
          activeLog,
          line + "\n",
          StandardCharsets.UTF_8,
          StandardOpenOption.CREATE,
          StandardOpenOption.WRITE,
          StandardOpenOption.APPEND);
    } catch (IOException ex) {
      metrics.recordAuditWriteError();
      logger.error("audit log write failed file={}", activeLog.getFileName(), ex);
      throw new AuditWriteException("failed to write audit log", ex);
    } finally {
      lock.unlock();
    }
  }
}
