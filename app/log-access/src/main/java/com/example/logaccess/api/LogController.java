/*
 * Where: app/log-access API
 * What: Catalog, read and download routes over the log storage directory
 * Why: Audit and key checks run in filters, so handlers only serve files
 */
package com.example.logaccess.api;

import com.example.logaccess.api.response.LogContentResponse;
import com.example.logaccess.api.response.LogListResponse;
import com.example.logaccess.model.LogEndpoint;
import com.example.logaccess.model.LogFile;
import com.example.logaccess.service.LogAccessMetrics;
import com.example.logaccess.service.LogCatalog;
import com.example.logaccess.service.LogFileReader;
import com.example.logaccess.service.LogNotFoundException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/logs")
@RequiredArgsConstructor
public class LogController {

  private final LogCatalog logCatalog;
  private final LogFileReader logFileReader;
  private final LogAccessMetrics metrics;

  @GetMapping
  public ResponseEntity<LogListResponse> listLogs() {
    final List<String> logs = logCatalog.list();
    if (logs.isEmpty()) {
      throw new LogNotFoundException("no logs found");
    }
    metrics.recordServed(LogEndpoint.LIST_LOGS);
    return ResponseEntity.ok(new LogListResponse(logs));
  }

  @GetMapping("/{filename}")
  public ResponseEntity<LogContentResponse> readLog(@PathVariable("filename") String filename) {
    final String content = logFileReader.read(filename);
    metrics.recordServed(LogEndpoint.READ_LOG);
    return ResponseEntity.ok(new LogContentResponse(filename, content));
  }

  /** Streams the file as an attachment; the media type is never sniffed from the content. */
  @GetMapping("/download/{filename}")
  public ResponseEntity<Resource> downloadLog(@PathVariable("filename") String filename) {
    final LogFile logFile = logFileReader.resolve(filename);
    final Resource body = new InputStreamResource(logFileReader.openStream(logFile));
    metrics.recordServed(LogEndpoint.DOWNLOAD_LOG);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_OCTET_STREAM)
        .contentLength(logFile.size())
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(logFile.name(), StandardCharsets.UTF_8)
                .build()
                .toString())
        .body(body);
  }
}
