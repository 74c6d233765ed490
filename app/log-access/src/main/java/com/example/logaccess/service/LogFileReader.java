/*
 * Where: app/log-access service layer
 * What: Resolves a requested log name and reads or streams its bytes
 * Why: Both the read and the download route share one containment check
 */
package com.example.logaccess.service;

import com.example.logaccess.model.LogFile;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LogFileReader {

  private static final String NOT_FOUND_MESSAGE = "log not found";

  private final StoragePathGuard pathGuard;

  /**
   * @throws InvalidLogFileNameException when the name would escape the storage directory
   * @throws LogNotFoundException when no regular file has that name
   */
  public LogFile resolve(String filename) {
    final Path path = pathGuard.resolve(filename);
    if (!Files.isRegularFile(path)) {
      throw new LogNotFoundException(NOT_FOUND_MESSAGE);
    }
    if (!pathGuard.isContained(path)) {
      throw new InvalidLogFileNameException("invalid log filename");
    }
    try {
      return new LogFile(filename, path, Files.size(path));
    } catch (NoSuchFileException ex) {
      throw new LogNotFoundException(NOT_FOUND_MESSAGE);
    } catch (IOException ex) {
      throw new LogStorageException("failed to stat log file", ex);
    }
  }

  /** Loads the whole file as UTF-8 text; malformed bytes are replaced. */
  public String read(String filename) {
    final LogFile logFile = resolve(filename);
    try {
      return new String(Files.readAllBytes(logFile.path()), StandardCharsets.UTF_8);
    } catch (NoSuchFileException ex) {
      throw new LogNotFoundException(NOT_FOUND_MESSAGE);
    } catch (IOException ex) {
      throw new LogStorageException("failed to read log file", ex);
    }
  }

  /** Opens the file for streaming; the caller closes the stream. */
  public InputStream openStream(LogFile logFile) {
    try {
      return Files.newInputStream(logFile.path());
    } catch (NoSuchFileException ex) {
      throw new LogNotFoundException(NOT_FOUND_MESSAGE);
    } catch (IOException ex) {
      throw new LogStorageException("failed to open log file", ex);
    }
  }
}
