package com.example.authgateway.client;

import com.example.authgateway.exception.CredentialsRejectedException;
import com.example.authgateway.exception.ErrorCode;
import com.example.authgateway.exception.RateLimitedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for applications talking to the gateway: logs in, keeps the session cookies, and
 * sends requests through a {@link RefreshCoordinator}.
 */
@Slf4j
public class SessionApiClient implements Closeable {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final long DEFAULT_RETRY_AFTER_SECONDS = 1;

  private final OkHttpClient httpClient;
  private final SessionCookieJar cookieJar;
  private final RefreshCoordinator coordinator;
  private final RefreshCoordinatorSettings settings;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public SessionApiClient(RefreshCoordinatorSettings settings,
                          OkHttpClient baseClient,
                          ObjectMapper objectMapper,
                          SessionEventListener listener) {
    this(settings, baseClient, objectMapper, listener, Clock.systemUTC());
  }

  public SessionApiClient(RefreshCoordinatorSettings settings,
                          OkHttpClient baseClient,
                          ObjectMapper objectMapper,
                          SessionEventListener listener,
                          Clock clock) {
    this.settings = settings;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.cookieJar = new SessionCookieJar(settings.csrfCookieName());
    this.httpClient = baseClient.newBuilder().cookieJar(cookieJar).build();
    this.coordinator = new RefreshCoordinator(httpClient, cookieJar, settings, objectMapper, listener, clock);
  }

  /**
   * Logs in and returns the user summary from the response body.
   *
   * @throws CredentialsRejectedException when the credentials are rejected
   * @throws RateLimitedException when too many attempts were made
   */
  public JsonNode login(String email, String password) throws IOException {
    byte[] payload = objectMapper.writeValueAsBytes(Map.of("email", email, "password", password));
    Request request = sessionRequest()
        .post(RequestBody.create(payload, JSON))
        .build();

    try (Response response = httpClient.newCall(request).execute()) {
      JsonNode body = readBody(response.body());
      if (response.isSuccessful()) {
        coordinator.onLogin(readInstant(body.get("expiresAt")));
        return body.path("user");
      }
      if (response.code() == 429) {
        throw new RateLimitedException(errorMessage(body, "Too many login attempts"),
                                       retryAfterSeconds(response.header(HttpHeaders.RETRY_AFTER)));
      }
      if (response.code() == 401 || response.code() == 400) {
        throw new CredentialsRejectedException(ErrorCode.LOGIN_FAILED, HttpStatus.UNAUTHORIZED,
                                               errorMessage(body, "Login failed"));
      }
      throw new UpstreamUnavailableException("Login failed, status: " + response.code());
    }
  }

  /**
   * Ends the session on the server (best effort) and locally.
   */
  public void logout() {
    Request request = sessionRequest().delete().build();

    try (Response response = httpClient.newCall(request).execute()) {
      log.debug("Logout answered with status {}", response.code());
    } catch (IOException e) {
      log.warn("Logout request failed, discarding the local session anyway", e);
    } finally {
      coordinator.onLogout();
    }
  }

  public Response execute(Request request) throws IOException {
    return coordinator.execute(request);
  }

  public CompletableFuture<Response> executeAsync(Request request) {
    return coordinator.enqueue(request);
  }

  /**
   * Request builder for a path on the gateway.
   */
  public Request.Builder newRequest(String path) {
    return new Request.Builder().url(settings.resolve(path));
  }

  public RefreshState state() {
    return coordinator.state();
  }

  /**
   * Reads {@code Retry-After} as delta-seconds or as an HTTP-date. Anything unreadable, or a
   * moment already past, becomes {@value #DEFAULT_RETRY_AFTER_SECONDS} second.
   */
  long retryAfterSeconds(String header) {
    if (header == null || header.isBlank()) {
      return DEFAULT_RETRY_AFTER_SECONDS;
    }
    String value = header.trim();
    try {
      return Math.max(DEFAULT_RETRY_AFTER_SECONDS, Long.parseLong(value));
    } catch (NumberFormatException notSeconds) {
      try {
        Instant retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        long seconds = Duration.between(clock.instant(), retryAt).toSeconds();
        return Math.max(DEFAULT_RETRY_AFTER_SECONDS, seconds);
      } catch (DateTimeParseException notDate) {
        log.debug("Unreadable Retry-After value '{}'", value);
        return DEFAULT_RETRY_AFTER_SECONDS;
      }
    }
  }

  SessionCookieJar cookieJar() {
    return cookieJar;
  }

  RefreshCoordinator coordinator() {
    return coordinator;
  }

  @Override
  public void close() {
    coordinator.close();
  }

  private Request.Builder sessionRequest() {
    Request.Builder builder = new Request.Builder().url(settings.resolve(settings.sessionPath()));
    if (settings.origin() != null) {
      builder.header(HttpHeaders.ORIGIN, settings.origin());
    }
    return builder;
  }

  private JsonNode readBody(ResponseBody body) throws IOException {
    if (body == null) {
      return objectMapper.createObjectNode();
    }
    String text = body.string();
    return text.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(text);
  }

  private static Instant readInstant(JsonNode node) {
    if (node == null || !node.isTextual()) {
      return null;
    }
    try {
      return Instant.parse(node.asText());
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static String errorMessage(JsonNode body, String fallback) {
    JsonNode message = body.path("error").path("message");
    return message.isTextual() ? message.asText() : fallback;
  }
}
