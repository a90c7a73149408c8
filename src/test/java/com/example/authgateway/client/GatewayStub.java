package com.example.authgateway.client;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Minimal stand-in for the gateway's session endpoints and one protected resource.
 * {@code /api/data} answers 200 only when the request carries the refreshed access token.
 */
class GatewayStub extends Dispatcher {

  static final String REFRESHED_ACCESS = "access-2";

  final AtomicInteger refreshCalls = new AtomicInteger();
  final List<String> dataRequests = Collections.synchronizedList(new ArrayList<>());
  final List<RecordedRequest> refreshRequests = Collections.synchronizedList(new ArrayList<>());

  volatile boolean refreshFails;
  volatile boolean dataAlwaysUnauthorized;
  volatile long refreshDelayMillis;

  @Override
  public MockResponse dispatch(RecordedRequest request) {
    String path = request.getRequestUrl().encodedPath();
    String method = request.getMethod();

    if ("/session".equals(path) && "POST".equals(method)) {
      return sessionResponse("access-1", "refresh-1", "csrf-1")
          .setBody("{\"success\":true,\"user\":{\"id\":\"user-1\",\"email\":\"person@example.com\"},"
                       + "\"expiresAt\":\"" + Instant.now().plusSeconds(3600) + "\"}");
    }
    if ("/session".equals(path) && "DELETE".equals(method)) {
      return new MockResponse().setResponseCode(200).setBody("{\"success\":true}");
    }
    if ("/session/refresh".equals(path)) {
      refreshCalls.incrementAndGet();
      refreshRequests.add(request);
      MockResponse response = refreshFails
          ? new MockResponse().setResponseCode(401)
              .setBody("{\"error\":{\"message\":\"Refresh token rejected\",\"code\":\"REFRESH_FAILED\"}}")
          : sessionResponse(REFRESHED_ACCESS, "refresh-2", "csrf-2")
              .setBody("{\"success\":true,\"expiresAt\":\"" + Instant.now().plusSeconds(3600) + "\"}");
      if (refreshDelayMillis > 0) {
        response.setHeadersDelay(refreshDelayMillis, TimeUnit.MILLISECONDS);
      }
      return response;
    }
    if ("/api/data".equals(path)) {
      String cookie = request.getHeader("Cookie");
      boolean refreshed = cookie != null && cookie.contains("access-token=" + REFRESHED_ACCESS);
      if (refreshed) {
        dataRequests.add(request.getRequestUrl().queryParameter("id"));
      }
      if (dataAlwaysUnauthorized || !refreshed) {
        return new MockResponse().setResponseCode(401)
            .setBody("{\"error\":{\"message\":\"Authentication required\",\"code\":\"UNAUTHENTICATED\"}}");
      }
      return new MockResponse().setResponseCode(200).setBody("ok-" + request.getRequestUrl().queryParameter("id"));
    }
    return new MockResponse().setResponseCode(404);
  }

  private static MockResponse sessionResponse(String access, String refresh, String csrf) {
    return new MockResponse()
        .setResponseCode(200)
        .setHeader("Content-Type", "application/json")
        .addHeader("Set-Cookie", "access-token=" + access + "; Path=/; HttpOnly; SameSite=Lax")
        .addHeader("Set-Cookie", "refresh-token=" + refresh + "; Path=/session/refresh; HttpOnly; SameSite=Strict")
        .addHeader("Set-Cookie", "csrf-token=" + csrf + "; Path=/; SameSite=Lax");
  }
}
