/*
 * Where: app/log-access service layer
 * What: Counters for audit rotation, audit failures, key checks and served files
 * Why: Rotation frequency and rejected keys are watched from Prometheus
 */
package com.example.logaccess.service;

import com.example.logaccess.model.LogEndpoint;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class LogAccessMetrics {

  private static final String METRIC_AUDIT_ROTATION_TOTAL = "logaccess.audit.rotation.total";
  private static final String METRIC_AUDIT_WRITE_ERROR_TOTAL = "logaccess.audit.write.error.total";
  private static final String METRIC_AUTH_TOTAL = "logaccess.auth.total";
  private static final String METRIC_FILES_SERVED_TOTAL = "logaccess.files.served.total";

  private final MeterRegistry meterRegistry;
  private final Counter rotationCounter;
  private final Counter auditWriteErrorCounter;
  private final ConcurrentMap<String, Counter> authCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<LogEndpoint, Counter> servedCounters = new ConcurrentHashMap<>();

  public LogAccessMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.rotationCounter =
        Counter.builder(METRIC_AUDIT_ROTATION_TOTAL)
            .description("Audit log files archived after reaching the size threshold")
            .register(meterRegistry);
    this.auditWriteErrorCounter =
        Counter.builder(METRIC_AUDIT_WRITE_ERROR_TOTAL)
            .description("Audit log rotations or appends that failed")
            .register(meterRegistry);
  }

  public void recordRotation() {
    rotationCounter.increment();
  }

  public void recordAuditWriteError() {
    auditWriteErrorCounter.increment();
  }

  public void recordAuthentication(String result) {
    authCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_AUTH_TOTAL)
                    .description("API key validation outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordServed(LogEndpoint endpoint) {
    servedCounters
        .computeIfAbsent(
            endpoint,
            ignored ->
                Counter.builder(METRIC_FILES_SERVED_TOTAL)
                    .description("Successful log catalog, read and download responses")
                    .tags(Tags.of("endpoint", endpoint.metricTag()))
                    .register(meterRegistry))
        .increment();
  }
}
