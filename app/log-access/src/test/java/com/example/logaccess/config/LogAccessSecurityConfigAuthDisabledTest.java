package com.example.logaccess.config;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.logaccess.api.ApiExceptionHandler;
import com.example.logaccess.api.LogController;
import com.example.logaccess.service.ApiCallAuditor;
import com.example.logaccess.service.ApiKeyValidator;
import com.example.logaccess.service.LogAccessMetrics;
import com.example.logaccess.service.LogCatalog;
import com.example.logaccess.service.LogFileReader;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(LogController.class)
@AutoConfigureMockMvc
@Import({LogAccessSecurityConfig.class, ApiExceptionHandler.class})
@TestPropertySource(
    properties = {
      "logaccess.storage-dir=build/test-storage",
      "logaccess.audit-log-path=build/test-audit/api_calls.log",
      "logaccess.rotation-threshold-bytes=1024",
      "logaccess.auth.enabled=false"
    })
class LogAccessSecurityConfigAuthDisabledTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private ApiKeyValidator apiKeyValidator;
  @MockitoBean private ApiCallAuditor apiCallAuditor;
  @MockitoBean private LogCatalog logCatalog;
  @MockitoBean private LogFileReader logFileReader;
  @MockitoBean private LogAccessMetrics metrics;

  @Test
  void listIsServedWithoutKeyButStillAudited() throws Exception {
    when(logCatalog.list()).thenReturn(List.of("app.log"));

    mockMvc.perform(get("/logs")).andExpect(status().isOk());

    verify(apiCallAuditor).record("anonymous", "127.0.0.1", "List Logs", "");
    verifyNoInteractions(apiKeyValidator);
  }
}
