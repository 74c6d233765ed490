package com.example.logaccess.config;

import com.example.logaccess.api.ApiErrorResponseWriter;
import com.example.logaccess.service.ApiCallAuditor;
import com.example.logaccess.service.ApiKeyValidator;
import com.example.logaccess.service.LogAccessMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.security.web.firewall.RequestRejectedHandler;

@Configuration
@EnableConfigurationProperties({LogAccessProperties.class, LogAccessAuthProperties.class})
public class LogAccessSecurityConfig {

  private static final String[] PUBLIC_PATHS = {
    "/", "/error", "/actuator/health", "/actuator/health/**", "/actuator/info", "/actuator/prometheus"
  };

  @Bean
  ApiErrorResponseWriter apiErrorResponseWriter(ObjectMapper objectMapper) {
    return new ApiErrorResponseWriter(objectMapper);
  }

  @Bean
  ApiKeyAuthenticationEntryPoint apiKeyAuthenticationEntryPoint(
      ApiErrorResponseWriter apiErrorResponseWriter) {
    return new ApiKeyAuthenticationEntryPoint(apiErrorResponseWriter);
  }

  @Bean
  LogCallRecorder logCallRecorder(
      ApiCallAuditor apiCallAuditor,
      ApiErrorResponseWriter apiErrorResponseWriter,
      LogAccessProperties properties,
      LogAccessAuthProperties authProperties) {
    return new LogCallRecorder(
        apiCallAuditor,
        apiErrorResponseWriter,
        authProperties.headerName(),
        properties.trustForwardedFor());
  }

  // Picked up by the FilterChainProxy in place of the bare 400 default.
  @Bean
  RequestRejectedHandler requestRejectedHandler(
      LogCallRecorder logCallRecorder, ApiErrorResponseWriter apiErrorResponseWriter) {
    return new AuditingRequestRejectedHandler(
        new LogEndpointMatcher(), logCallRecorder, apiErrorResponseWriter);
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      LogAccessAuthProperties authProperties,
      ApiKeyValidator apiKeyValidator,
      LogCallRecorder logCallRecorder,
      LogAccessMetrics metrics,
      ApiErrorResponseWriter apiErrorResponseWriter,
      ApiKeyAuthenticationEntryPoint entryPoint)
      throws Exception {
    final ApiKeyAuthenticationFilter apiKeyFilter =
        new ApiKeyAuthenticationFilter(
            apiKeyValidator, authProperties, entryPoint, apiErrorResponseWriter, metrics);
    final CallAuditFilter callAuditFilter =
        new CallAuditFilter(new LogEndpointMatcher(), logCallRecorder);

    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint))
        .addFilterBefore(apiKeyFilter, AuthorizationFilter.class)
        // auditing runs first so rejected keys are still recorded
        .addFilterBefore(callAuditFilter, ApiKeyAuthenticationFilter.class)
        .authorizeHttpRequests(
            auth -> {
              auth.requestMatchers(PUBLIC_PATHS).permitAll();
              if (authProperties.isEnabled()) {
                // every method, so HEAD on a log route is checked like GET
                auth.requestMatchers(authProperties.protectedPaths().toArray(String[]::new))
                    .hasRole("LOG_READER");
              }
              auth.anyRequest().permitAll();
            });
    return http.build();
  }
}
