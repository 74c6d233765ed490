package com.example.logaccess.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientAddresses {

  private ClientAddresses() {}

  /**
   * Returns the socket peer address, or the first {@code X-Forwarded-For} hop when the service
   * runs behind a trusted proxy.
   */
  public static String resolve(HttpServletRequest request, boolean trustForwardedFor) {
    if (!trustForwardedFor) {
      return request.getRemoteAddr();
    }
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
