package com.example.authgateway.util;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.util.WebUtils;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Percent-encoding and lookup for session cookie values. Only {@code SessionCookieCodec} goes
 * through here; everything else reads cookies via the codec.
 */
@Slf4j
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CookieUtil {

  /**
   * Returns the decoded value of the named cookie. Absent, empty and blank-after-decoding
   * values all come back empty, so callers never see a cookie that was cleared with
   * {@code Max-Age=0}.
   */
  public static Optional<String> readValue(HttpServletRequest request, String name) {
    if (request == null || name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WebUtils.getCookie(request, name))
        .map(Cookie::getValue)
        .filter(raw -> !raw.isEmpty())
        .map(CookieUtil::decode)
        .filter(decoded -> !decoded.isBlank());
  }

  public static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  // Tokens are base64url and normally pass through unchanged; a malformed escape keeps the raw value.
  public static String decode(String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("Cookie value is not percent-encoded: {}", e.getMessage());
      return value;
    }
  }
}
