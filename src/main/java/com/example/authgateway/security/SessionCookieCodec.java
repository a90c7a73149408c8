package com.example.authgateway.security;

import com.example.authgateway.domain.entity.SessionTokens;
import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.util.CookieUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Writes, clears and reads the three session cookies.
 * <p>
 * access-token and refresh-token are HttpOnly; csrf-token is deliberately script-readable
 * and carries no authentication power on its own. The refresh cookie is only sent to the
 * refresh endpoint.
 */
@Slf4j
@Component
public class SessionCookieCodec {

  private static final String ROOT_PATH = "/";
  private static final String SAME_SITE_LAX = "Lax";
  private static final String SAME_SITE_STRICT = "Strict";
  private static final int CSRF_TOKEN_BYTES = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private final ApplicationProperties.CookieProperties cookies;
  private final boolean secure;

  public SessionCookieCodec(ApplicationProperties properties) {
    this.cookies = properties.cookies();
    this.secure = !properties.isDevelopment();
  }

  /**
   * Generates a 256-bit anti-forgery nonce, base64url without padding.
   */
  public static String generateCsrfToken() {
    byte[] randomBytes = new byte[CSRF_TOKEN_BYTES];
    SECURE_RANDOM.nextBytes(randomBytes);
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
  }

  public void setSessionCookies(HttpServletResponse response, SessionTokens tokens) {
    setSessionCookies(response, tokens.accessToken(), tokens.refreshToken(), tokens.csrfToken());
  }

  public void setSessionCookies(HttpServletResponse response,
                                String accessToken,
                                String refreshToken,
                                String csrfToken) {
    requireValue(accessToken, "Access token");
    requireValue(refreshToken, "Refresh token");
    requireValue(csrfToken, "CSRF token");

    addCookie(response, accessCookie(accessToken, cookies.accessTokenMaxAge()));
    addCookie(response, refreshCookie(refreshToken, cookies.refreshTokenMaxAge()));
    addCookie(response, csrfCookie(csrfToken, cookies.csrfTokenMaxAge()));

    log.debug("Set session cookies: secure={}, refreshPath={}", secure, cookies.refreshPath());
  }

  /**
   * Expires all three cookies at once. Attributes match the ones used when setting them,
   * otherwise browsers keep the original cookie.
   */
  public void clearSessionCookies(HttpServletResponse response) {
    addCookie(response, accessCookie("", Duration.ZERO));
    addCookie(response, refreshCookie("", Duration.ZERO));
    addCookie(response, csrfCookie("", Duration.ZERO));

    log.debug("Cleared session cookies");
  }

  public Optional<String> readCookie(HttpServletRequest request, String name) {
    return CookieUtil.readValue(request, name);
  }

  public Optional<String> readAccessToken(HttpServletRequest request) {
    return readCookie(request, cookies.accessTokenName());
  }

  public Optional<String> readRefreshToken(HttpServletRequest request) {
    return readCookie(request, cookies.refreshTokenName());
  }

  public Optional<String> readCsrfToken(HttpServletRequest request) {
    return readCookie(request, cookies.csrfTokenName());
  }

  private ResponseCookie accessCookie(String value, Duration maxAge) {
    return baseCookie(cookies.accessTokenName(), value, maxAge)
        .httpOnly(true)
        .sameSite(SAME_SITE_LAX)
        .path(ROOT_PATH)
        .build();
  }

  private ResponseCookie refreshCookie(String value, Duration maxAge) {
    return baseCookie(cookies.refreshTokenName(), value, maxAge)
        .httpOnly(true)
        .sameSite(SAME_SITE_STRICT)
        .path(cookies.refreshPath())
        .build();
  }

  private ResponseCookie csrfCookie(String value, Duration maxAge) {
    return baseCookie(cookies.csrfTokenName(), value, maxAge)
        .httpOnly(false) // read by page scripts and mirrored into the request header
        .sameSite(SAME_SITE_LAX)
        .path(ROOT_PATH)
        .build();
  }

  private ResponseCookie.ResponseCookieBuilder baseCookie(String name, String value, Duration maxAge) {
    ResponseCookie.ResponseCookieBuilder builder = ResponseCookie
        .from(name, value.isEmpty() ? value : CookieUtil.encode(value))
        .secure(secure)
        .maxAge(maxAge);

    if (cookies.domain() != null && !cookies.domain().isBlank()) {
      builder.domain(cookies.domain());
    }
    return builder;
  }

  private static void addCookie(HttpServletResponse response, ResponseCookie cookie) {
    response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
  }

  private static void requireValue(String value, String label) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(label + " cannot be null or empty");
    }
  }
}
