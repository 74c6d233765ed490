package com.example.logaccess.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.logaccess.config.LogAccessProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AuditLogWriterTest {

  private static final Instant FIXED_NOW = Instant.parse("2024-01-01T12:00:00Z");
  private static final String LINE = "0123456789";

  @TempDir Path tempDir;

  private SimpleMeterRegistry registry;
  private Path auditLog;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    auditLog = tempDir.resolve("audit").resolve("api_calls.log");
  }

  @Test
  void firstAppendCreatesFileAndParentDirectories() throws IOException {
    final AuditLogWriter writer = writer(1024);

    writer.append("first");

    assertThat(Files.readAllLines(auditLog, StandardCharsets.UTF_8)).containsExactly("first");
    assertThat(rotations()).isZero();
  }

  @Test
  void rotatesExactlyOnceBeforeTheAppendThatFollowsTheThreshold() throws IOException {
    // each line is 13 bytes; the file reaches 39 bytes after the third append
    final AuditLogWriter writer = writer(30);

    writer.append(LINE + "-1");
    writer.append(LINE + "-2");
    writer.append(LINE + "-3");
    assertThat(archives()).isEmpty();

    writer.append(LINE + "-4");

    assertThat(archives()).containsExactly("api_calls_20240101120000.log");
    assertThat(Files.readAllLines(auditLog)).containsExactly(LINE + "-4");
    assertThat(Files.readAllLines(auditLog.resolveSibling("api_calls_20240101120000.log")))
        .containsExactly(LINE + "-1", LINE + "-2", LINE + "-3");
    assertThat(rotations()).isEqualTo(1.0d);
  }

  @Test
  void thresholdIsInclusive() throws IOException {
    final AuditLogWriter writer = writer(22);

    writer.append("0123456789");
    writer.append("0123456789");
    assertThat(Files.size(auditLog)).isEqualTo(22L);

    writer.append("after");

    assertThat(archives()).hasSize(1);
    assertThat(Files.readAllLines(auditLog)).containsExactly("after");
  }

  @Test
  void rotationsWithinOneSecondDoNotOverwriteArchives() throws IOException {
    final AuditLogWriter writer = writer(4);

    writer.append("one");
    writer.append("two");
    writer.append("three");

    assertThat(archives())
        .containsExactly("api_calls_20240101120000.log", "api_calls_20240101120000_1.log");
    assertThat(Files.readAllLines(auditLog.resolveSibling("api_calls_20240101120000.log")))
        .containsExactly("one");
    assertThat(Files.readAllLines(auditLog.resolveSibling("api_calls_20240101120000_1.log")))
        .containsExactly("two");
    assertThat(Files.readAllLines(auditLog)).containsExactly("three");
  }

  @Test
  void concurrentAppendsKeepWholeLines() throws Exception {
    final AuditLogWriter writer = writer(10L * 1024 * 1024);
    final int threads = 8;
    final int linesPerThread = 100;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < linesPerThread; i++) {
                    writer.append("thread-" + thread + "-line-" + i);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    final List<String> lines = Files.readAllLines(auditLog);
    assertThat(lines).hasSize(threads * linesPerThread);
    assertThat(lines).allMatch(line -> line.matches("thread-\\d+-line-\\d+"));
    assertThat(lines).doesNotHaveDuplicates();
  }

  @Test
  void appendFailureSurfacesAsAuditWriteException() throws IOException {
    Files.createDirectories(auditLog);
    final AuditLogWriter writer = writer(1024);

    assertThatThrownBy(() -> writer.append("lost"))
        .isInstanceOf(AuditWriteException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(registry.get("logaccess.audit.write.error.total").counter().count())
        .isEqualTo(1.0d);
  }

  private AuditLogWriter writer(long thresholdBytes) {
    final LogAccessProperties properties =
        new LogAccessProperties(
            tempDir.resolve("storage").toString(), auditLog.toString(), thresholdBytes, false);
    final LogAccessMetrics metrics = new LogAccessMetrics(registry);
    final AuditLogRotator rotator =
        new AuditLogRotator(properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC), metrics);
    return new AuditLogWriter(properties, rotator, metrics);
  }

  private List<String> archives() throws IOException {
    try (Stream<Path> files = Files.list(auditLog.getParent())) {
      return files
          .map(path -> path.getFileName().toString())
          .filter(name -> name.startsWith("api_calls_"))
          .sorted()
          .toList();
    }
  }

  private double rotations() {
    return registry.get("logaccess.audit.rotation.total").counter().count();
  }
}
