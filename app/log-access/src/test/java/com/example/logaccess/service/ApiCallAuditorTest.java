package com.example.logaccess.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApiCallAuditorTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-01-01T12:00:00.123456Z"), ZoneOffset.UTC);

  @Mock private AuditLogWriter writer;

  private ApiCallAuditor auditor;

  @BeforeEach
  void setUp() {
    auditor = new ApiCallAuditor(writer, CLOCK);
  }

  @Test
  void recordOmitsFilenameSegmentWhenEmpty() {
    auditor.record("alice", "10.0.0.1", "List Logs");

    assertThat(writtenLine())
        .isEqualTo("2024-01-01 12:00:00.123456 - User: alice - IP: 10.0.0.1 - Endpoint: List Logs");
  }

  @Test
  void recordAppendsFilenameSegment() {
    auditor.record("alice", "10.0.0.1", "Read Log", "app.log");

    assertThat(writtenLine())
        .isEqualTo(
            "2024-01-01 12:00:00.123456 - User: alice - IP: 10.0.0.1 - Endpoint: Read Log"
                + " - Filename: app.log");
  }

  @Test
  void recordNeutralisesLineBreaksFromCallerInput() {
    auditor.record("alice\nforged", "10.0.0.1", "Read Log", "a.log\r\nUser: admin");

    assertThat(writtenLine())
        .doesNotContain("\n")
        .doesNotContain("\r")
        .endsWith(
            "User: alice?forged - IP: 10.0.0.1 - Endpoint: Read Log"
                + " - Filename: a.log??User: admin");
  }

  @Test
  void recordPropagatesWriteFailure() {
    doThrow(new AuditWriteException("failed", new IOException("disk full")))
        .when(writer)
        .append(anyString());

    assertThatThrownBy(() -> auditor.record("alice", "10.0.0.1", "List Logs"))
        .isInstanceOf(AuditWriteException.class);
  }

  private String writtenLine() {
    final ArgumentCaptor<String> line = ArgumentCaptor.forClass(String.class);
    verify(writer).append(line.capture());
    return line.getValue();
  }
}
