package com.example.authgateway.security.csrf;

import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.security.SessionCookieCodec;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Double-submit CSRF verification plus an origin allow-list.
 * <p>
 * A state-changing request passes only when the {@code csrf-token} cookie equals the
 * {@code X-CSRF-Token} header and the request's origin (from {@code Origin}, else from
 * {@code Referer}) is allow-listed. Safe methods are never checked.
 */
@Slf4j
@Component
public class CsrfVerifier {

  private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS", "TRACE");

  private final SessionCookieCodec cookieCodec;
  private final String headerName;
  private final Set<String> allowedOrigins;

  public CsrfVerifier(SessionCookieCodec cookieCodec, ApplicationProperties properties) {
    this.cookieCodec = cookieCodec;
    this.headerName = properties.security().csrf().headerName();
    this.allowedOrigins = properties.security().csrf().allowedOrigins().stream()
        .map(CsrfVerifier::normalizeOrigin)
        .flatMap(Optional::stream)
        .collect(Collectors.toUnmodifiableSet());
  }

  public CsrfVerdict verify(HttpServletRequest request) {
    if (isSafeMethod(request.getMethod())) {
      return CsrfVerdict.allow();
    }

    Optional<String> cookieToken = cookieCodec.readCsrfToken(request);
    String headerToken = request.getHeader(headerName);

    if (cookieToken.isEmpty()) {
      return CsrfVerdict.reject("CSRF cookie missing");
    }
    if (headerToken == null || headerToken.isBlank()) {
      return CsrfVerdict.reject("CSRF header missing");
    }
    if (!constantTimeEquals(cookieToken.get(), headerToken)) {
      return CsrfVerdict.reject("CSRF token mismatch");
    }

    Optional<String> origin = requestOrigin(request);
    if (origin.isEmpty()) {
      return CsrfVerdict.reject("Origin could not be determined");
    }
    if (!allowedOrigins.contains(origin.get())) {
      log.info("Rejected request from origin {} to {}", origin.get(), request.getRequestURI());
      return CsrfVerdict.reject("Origin not allowed");
    }

    return CsrfVerdict.allow();
  }

  public static boolean isSafeMethod(String method) {
    return method != null && SAFE_METHODS.contains(method.toUpperCase(Locale.ROOT));
  }

  private static Optional<String> requestOrigin(HttpServletRequest request) {
    String origin = request.getHeader(HttpHeaders.ORIGIN);
    if (origin != null && !origin.isBlank() && !"null".equals(origin)) {
      return normalizeOrigin(origin);
    }
    String referer = request.getHeader(HttpHeaders.REFERER);
    if (referer != null && !referer.isBlank()) {
      return normalizeOrigin(referer);
    }
    return Optional.empty();
  }

  /**
   * Reduces a URL to {@code scheme://host[:port]}, lower-cased, dropping default ports.
   */
  static Optional<String> normalizeOrigin(String value) {
    try {
      URI uri = new URI(value.trim());
      if (uri.getScheme() == null || uri.getHost() == null) {
        return Optional.empty();
      }
      String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
      String host = uri.getHost().toLowerCase(Locale.ROOT);
      int port = uri.getPort();
      boolean defaultPort = port == -1
          || ("http".equals(scheme) && port == 80)
          || ("https".equals(scheme) && port == 443);
      return Optional.of(defaultPort ? scheme + "://" + host : scheme + "://" + host + ":" + port);
    } catch (URISyntaxException e) {
      log.debug("Unparseable origin value: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static boolean constantTimeEquals(String expected, String actual) {
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8),
        actual.getBytes(StandardCharsets.UTF_8));
  }
}
