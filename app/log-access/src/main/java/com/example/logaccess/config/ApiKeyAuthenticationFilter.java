package com.example.logaccess.config;

import com.example.logaccess.api.ApiErrorResponseWriter;
import com.example.logaccess.model.CallerIdentity;
import com.example.logaccess.service.ApiKeyValidator;
import com.example.logaccess.service.InvalidApiKeyException;
import com.example.logaccess.service.KeyStoreUnavailableException;
import com.example.logaccess.service.LogAccessMetrics;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthenticationFilter.class);
  static final String LOG_READER_ROLE = "ROLE_LOG_READER";

  private final ApiKeyValidator validator;
  private final LogAccessAuthProperties properties;
  private final AuthenticationEntryPoint entryPoint;
  private final ApiErrorResponseWriter errorWriter;
  private final LogAccessMetrics metrics;
  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public ApiKeyAuthenticationFilter(
      ApiKeyValidator validator,
      LogAccessAuthProperties properties,
      AuthenticationEntryPoint entryPoint,
      ApiErrorResponseWriter errorWriter,
      LogAccessMetrics metrics) {
    this.validator = validator;
    this.properties = properties;
    this.entryPoint = entryPoint;
    this.errorWriter = errorWriter;
    this.metrics = metrics;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !properties.isEnabled() || !isProtectedPath(request);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String presentedKey = request.getHeader(properties.headerName());
    if (presentedKey == null || presentedKey.isBlank()) {
      reject(request, response, new BadCredentialsException(InvalidApiKeyException.MESSAGE));
      return;
    }
    final CallerIdentity identity;
    try {
      identity = validator.validate(presentedKey);
    } catch (InvalidApiKeyException ex) {
      reject(request, response, new BadCredentialsException(ex.getMessage(), ex));
      return;
    } catch (KeyStoreUnavailableException ex) {
      metrics.recordAuthentication("unavailable");
      errorWriter.write(
          response,
          HttpStatus.SERVICE_UNAVAILABLE,
          "KEY_STORE_UNAVAILABLE",
          "api key store is unavailable");
      return;
    }

    metrics.recordAuthentication("success");
    final UsernamePasswordAuthenticationToken authentication =
        new UsernamePasswordAuthenticationToken(
            identity.username(), "N/A", List.of(new SimpleGrantedAuthority(LOG_READER_ROLE)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    logger.debug("api key accepted user={} path={}", identity.username(), request.getRequestURI());
    filterChain.doFilter(request, response);
  }

  private void reject(
      HttpServletRequest request, HttpServletResponse response, BadCredentialsException cause)
      throws IOException, ServletException {
    metrics.recordAuthentication("rejected");
    logger.warn("api key rejected path={}", request.getRequestURI());
    SecurityContextHolder.clearContext();
    entryPoint.commence(request, response, cause);
  }

  private boolean isProtectedPath(HttpServletRequest request) {
    final String path = LogEndpointMatcher.pathWithinApplication(request);
    return properties.protectedPaths().stream()
        .anyMatch(pattern -> pathMatcher.match(pattern, path));
  }
}
