/*
 * Where: app/log-access model
 * What: A single audited API call
 * Why: Keeps the line layout in one place so the writer only deals with files
 */
package com.example.logaccess.model;

import java.time.Instant;
import java.time.format.DateTimeFormatter;

public record AuditLogEntry(
    Instant timestamp, String identity, String clientIp, String endpoint, String filename) {

  public AuditLogEntry {
    identity = singleLine(identity);
    clientIp = singleLine(clientIp);
    endpoint = singleLine(endpoint);
    filename = filename == null ? "" : singleLine(filename);
  }

  /**
   * Renders {@code <timestamp> - User: <identity> - IP: <ip> - Endpoint: <label>} and appends
   * {@code - Filename: <filename>} only when a filename was given.
   */
  public String toLine(DateTimeFormatter timestampFormatter) {
    final StringBuilder line =
        new StringBuilder()
            .append(timestampFormatter.format(timestamp))
            .append(" - User: ")
            .append(identity)
            .append(" - IP: ")
            .append(clientIp)
            .append(" - Endpoint: ")
            .append(endpoint);
    if (!filename.isEmpty()) {
      line.append(" - Filename: ").append(filename);
    }
    return line.toString();
  }

  // Caller supplied values must not be able to forge extra audit lines.
  private static String singleLine(String value) {
    if (value == null) {
      return "";
    }
    final StringBuilder cleaned = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      cleaned.append(Character.isISOControl(c) ? '?' : c);
    }
    return cleaned.toString();
  }
}
