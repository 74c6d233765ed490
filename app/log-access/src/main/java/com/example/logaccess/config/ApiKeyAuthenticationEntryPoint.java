package com.example.logaccess.config;

import com.example.logaccess.api.ApiErrorResponseWriter;
import com.example.logaccess.service.InvalidApiKeyException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

public class ApiKeyAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ApiErrorResponseWriter errorWriter;

  public ApiKeyAuthenticationEntryPoint(ApiErrorResponseWriter errorWriter) {
    this.errorWriter = errorWriter;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    errorWriter.write(
        response, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", InvalidApiKeyException.MESSAGE);
  }
}
