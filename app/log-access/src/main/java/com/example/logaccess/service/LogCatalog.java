package com.example.logaccess.service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LogCatalog {

  private static final Logger logger = LoggerFactory.getLogger(LogCatalog.class);
  private static final String LOG_SUFFIX = ".log";

  private final StoragePathGuard pathGuard;

  /**
   * Lists the {@code .log} regular files directly inside the storage directory, sorted by name.
   * A missing directory lists as empty.
   */
  public List<String> list() {
    final Path storageDir = pathGuard.storageDir();
    if (!Files.isDirectory(storageDir)) {
      logger.warn("log storage directory is missing");
      return List.of();
    }
    final List<String> names = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(storageDir)) {
      for (Path entry : entries) {
        final String name = entry.getFileName().toString();
        if (name.endsWith(LOG_SUFFIX)
            && Files.isRegularFile(entry)
            && pathGuard.isContained(entry)) {
          names.add(name);
        }
      }
    } catch (IOException ex) {
      throw new LogStorageException("failed to list log directory", ex);
    }
    Collections.sort(names);
    return names;
  }
}
