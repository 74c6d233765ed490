package com.example.logaccess.service;

import com.example.logaccess.config.LogAccessProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Confines every served file to the direct children of the storage directory. */
@Component
@RequiredArgsConstructor
public class StoragePathGuard {

  private static final Logger logger = LoggerFactory.getLogger(StoragePathGuard.class);

  private final LogAccessProperties properties;

  public Path storageDir() {
    return properties.storagePath();
  }

  /**
   * Resolves {@code filename} against the storage directory without touching the filesystem.
   *
   * @throws InvalidLogFileNameException when the name is not a single plain path segment
   */
  public Path resolve(String filename) {
    if (filename == null || filename.isBlank()) {
      throw new InvalidLogFileNameException("filename is required");
    }
    if (".".equals(filename) || "..".equals(filename) || !isPlainSegment(filename)) {
      logger.warn("rejected log filename outside storage directory");
      throw new InvalidLogFileNameException("invalid log filename");
    }
    final Path storageDir = storageDir();
    final Path candidate;
    try {
      candidate = storageDir.resolve(filename).normalize();
    } catch (InvalidPathException ex) {
      throw new InvalidLogFileNameException("invalid log filename");
    }
    if (!storageDir.equals(candidate.getParent())) {
      logger.warn("rejected log filename outside storage directory");
      throw new InvalidLogFileNameException("invalid log filename");
    }
    return candidate;
  }

  /** Checks, with symbolic links resolved, that an existing entry still lives in the directory. */
  public boolean isContained(Path existing) {
    try {
      final Path realDir = storageDir().toRealPath();
      final Path realFile = existing.toRealPath();
      return realDir.equals(realFile.getParent());
    } catch (IOException ex) {
      throw new LogStorageException("failed to resolve log file location", ex);
    }
  }

  private boolean isPlainSegment(String filename) {
    for (int i = 0; i < filename.length(); i++) {
      final char c = filename.charAt(i);
      if (c == '/' || c == '\\' || c == ':' || Character.isISOControl(c)) {
        return false;
      }
    }
    return true;
  }
}
