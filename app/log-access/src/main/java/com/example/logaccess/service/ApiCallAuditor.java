/*
 * Where: app/log-access service layer
 * What: Records one audit line per call to a log route
 * Why: Every access attempt, including rejected ones, must be traceable afterwards
 */
package com.example.logaccess.service;

import com.example.logaccess.model.AuditLogEntry;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ApiCallAuditor {

  private static final Logger logger = LoggerFactory.getLogger(ApiCallAuditor.class);
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

  private final AuditLogWriter writer;
  private final Clock clock;
  private final DateTimeFormatter timestampFormatter;

  public ApiCallAuditor(AuditLogWriter writer, Clock clock) {
    this.writer = writer;
    this.clock = clock;
    this.timestampFormatter = TIMESTAMP.withZone(clock.getZone());
  }

  public void record(String identity, String clientIp, String endpoint) {
    record(identity, clientIp, endpoint, "");
  }

  /**
   * Appends the call to the audit log.
   *
   * @throws AuditWriteException when the line cannot be written; the call must not be served
   */
  public void record(String identity, String clientIp, String endpoint, String filename) {
    final AuditLogEntry entry =
        new AuditLogEntry(Instant.now(clock), identity, clientIp, endpoint, filename);
    writer.append(entry.toLine(timestampFormatter));
    logger.debug("api call audited endpoint={} clientIp={}", endpoint, clientIp);
  }
}
