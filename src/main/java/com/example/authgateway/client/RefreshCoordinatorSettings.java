package com.example.authgateway.client;

import okhttp3.HttpUrl;

import java.time.Duration;

/**
 * Client settings. {@code origin} is sent on every request so the gateway's origin check
 * passes for non-browser clients.
 */
public record RefreshCoordinatorSettings(
    HttpUrl baseUrl,
    String origin,
    String sessionPath,
    String refreshPath,
    String csrfHeaderName,
    String csrfCookieName,
    Duration refreshTimeout,
    Duration proactiveRefreshMargin
) {

  public static final Duration DEFAULT_REFRESH_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_PROACTIVE_MARGIN = Duration.ofMinutes(5);

  public static RefreshCoordinatorSettings defaults(HttpUrl baseUrl, String origin) {
    return new RefreshCoordinatorSettings(
        baseUrl,
        origin,
        "/session",
        "/session/refresh",
        "X-CSRF-Token",
        "csrf-token",
        DEFAULT_REFRESH_TIMEOUT,
        DEFAULT_PROACTIVE_MARGIN);
  }

  public RefreshCoordinatorSettings withRefreshTimeout(Duration timeout) {
    return new RefreshCoordinatorSettings(baseUrl, origin, sessionPath, refreshPath, csrfHeaderName,
                                          csrfCookieName, timeout, proactiveRefreshMargin);
  }

  public RefreshCoordinatorSettings withProactiveRefreshMargin(Duration margin) {
    return new RefreshCoordinatorSettings(baseUrl, origin, sessionPath, refreshPath, csrfHeaderName,
                                          csrfCookieName, refreshTimeout, margin);
  }

  HttpUrl resolve(String path) {
    HttpUrl resolved = baseUrl.resolve(path);
    if (resolved == null) {
      throw new IllegalArgumentException("Cannot resolve " + path + " against " + baseUrl);
    }
    return resolved;
  }
}
