package com.example.authgateway.util;

import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Client address extraction and masking for rate-limit keys and log lines.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ClientAddressUtil {

  private static final String UNKNOWN = "unknown";

  /**
   * Extract client IP address, honouring the first hop of X-Forwarded-For
   */
  public static String getClientIpAddress(HttpServletRequest request) {
    String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
      return xForwardedFor.split(",")[0].trim();
    }

    String xRealIp = request.getHeader("X-Real-IP");
    if (xRealIp != null && !xRealIp.isEmpty()) {
      return xRealIp;
    }

    String remoteAddr = request.getRemoteAddr();
    return remoteAddr != null ? remoteAddr : UNKNOWN;
  }

  public static String maskIpAddress(String ip) {
    if (ip == null || !ip.contains(".")) {
      return "***";
    }
    String[] parts = ip.split("\\.");
    if (parts.length == 4) {
      return parts[0] + "." + parts[1] + ".***." + parts[3];
    }
    return "***";
  }

  public static String maskIdentifier(String id) {
    if (id == null || id.length() < 8) {
      return "***";
    }
    return id.substring(0, 8) + "...";
  }
}
