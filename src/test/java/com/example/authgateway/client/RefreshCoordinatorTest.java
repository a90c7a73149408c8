package com.example.authgateway.client;

import com.example.authgateway.exception.RefreshFailedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

/**
 * Runs the refresh protocol against a stub gateway. The OkHttp dispatcher is limited to
 * one call at a time so that the order in which calls reach the server is deterministic.
 */
@DisplayName("RefreshCoordinator")
class RefreshCoordinatorTest {

  private static final String ORIGIN = "https://app.example.com";
  private static final int CONCURRENT_REQUESTS = 5;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final List<RefreshFailedException> loggedOut = new CopyOnWriteArrayList<>();
  private final List<Instant> refreshed = new CopyOnWriteArrayList<>();

  private MockWebServer server;
  private GatewayStub gateway;
  private CountDownLatch refreshedLatch;
  private Dispatcher dispatcher;

  @BeforeEach
  void setUp() throws IOException {
    gateway = new GatewayStub();
    server = new MockWebServer();
    server.setDispatcher(gateway);
    server.start();
    refreshedLatch = new CountDownLatch(1);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private SessionApiClient client(Duration refreshTimeout) {
    dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(1);
    OkHttpClient base = new OkHttpClient.Builder()
        .dispatcher(dispatcher)
        .retryOnConnectionFailure(false)
        .build();
    RefreshCoordinatorSettings settings = RefreshCoordinatorSettings.defaults(server.url("/"), ORIGIN)
        .withRefreshTimeout(refreshTimeout);
    SessionEventListener listener = new SessionEventListener() {
      @Override
      public void onLoggedOut(RefreshFailedException cause) {
        loggedOut.add(cause);
      }

      @Override
      public void onRefreshed(Instant accessTokenExpiresAt) {
        refreshed.add(accessTokenExpiresAt);
        refreshedLatch.countDown();
      }
    };
    return new SessionApiClient(settings, base, objectMapper, listener);
  }

  private SessionApiClient loggedInClient() throws IOException {
    SessionApiClient client = client(Duration.ofSeconds(5));
    client.login("person@example.com", "secret-pass");
    return client;
  }

  private static List<CompletableFuture<Response>> sendConcurrently(SessionApiClient client) {
    List<CompletableFuture<Response>> futures = new ArrayList<>();
    for (int i = 1; i <= CONCURRENT_REQUESTS; i++) {
      Request request = client.newRequest("/api/data?id=" + i).get().build();
      futures.add(client.executeAsync(request));
    }
    return futures;
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
    while (!condition.getAsBoolean()) {
      assertThat(System.nanoTime()).as("condition not met in time").isLessThan(deadline);
      Thread.sleep(20);
    }
  }

  // the refresh callback has returned once OkHttp has no call left in flight
  private void awaitIdleDispatcher() throws InterruptedException {
    await(() -> dispatcher.runningCallsCount() == 0 && dispatcher.queuedCallsCount() == 0);
  }

  private static String bodyOf(CompletableFuture<Response> future) throws Exception {
    try (Response response = future.get(10, TimeUnit.SECONDS)) {
      return response.body().string();
    }
  }

  @Test
  @DisplayName("concurrent 401s trigger exactly one refresh and are replayed in order")
  void singleRefreshOrderedReplay() throws Exception {
    try (SessionApiClient client = loggedInClient()) {
      List<CompletableFuture<Response>> futures = sendConcurrently(client);

      List<String> bodies = new ArrayList<>();
      for (CompletableFuture<Response> future : futures) {
        bodies.add(bodyOf(future));
      }

      assertThat(bodies).containsExactly("ok-1", "ok-2", "ok-3", "ok-4", "ok-5");
      assertThat(gateway.refreshCalls).hasValue(1);
      assertThat(gateway.dataRequests).containsExactly("1", "2", "3", "4", "5");
      assertThat(client.state()).isEqualTo(RefreshState.IDLE);
      assertThat(loggedOut).isEmpty();
    }
  }

  @Test
  @DisplayName("the refresh call carries the csrf header, the origin and the refresh cookie")
  void refreshRequestIsDecorated() throws Exception {
    try (SessionApiClient client = loggedInClient()) {
      bodyOf(client.executeAsync(client.newRequest("/api/data?id=1").get().build()));

      RecordedRequest refresh = gateway.refreshRequests.get(0);
      assertThat(refresh.getMethod()).isEqualTo("POST");
      assertThat(refresh.getHeader("X-CSRF-Token")).isEqualTo("csrf-1");
      assertThat(refresh.getHeader("Origin")).isEqualTo(ORIGIN);
      assertThat(refresh.getHeader("Cookie")).contains("refresh-token=refresh-1");
      assertThat(client.cookieJar().csrfToken()).contains("csrf-2");
    }
  }

  @Test
  @DisplayName("a failed refresh rejects every waiting request with the same error and logs out")
  void failedRefreshRejectsAll() throws Exception {
    gateway.refreshFails = true;
    try (SessionApiClient client = loggedInClient()) {
      List<CompletableFuture<Response>> futures = sendConcurrently(client);

      List<Throwable> failures = new ArrayList<>();
      for (CompletableFuture<Response> future : futures) {
        Throwable failure = catchThrowable(() -> future.get(10, TimeUnit.SECONDS));
        assertThat(failure).isInstanceOf(ExecutionException.class);
        failures.add(failure.getCause());
      }

      assertThat(failures).hasSize(CONCURRENT_REQUESTS).allMatch(f -> f instanceof RefreshFailedException);
      assertThat(failures).allMatch(f -> f == failures.get(0));
      assertThat(gateway.refreshCalls).hasValue(1);
      assertThat(loggedOut).containsExactly((RefreshFailedException) failures.get(0));
      assertThat(client.state()).isEqualTo(RefreshState.LOGGED_OUT);
      assertThat(client.cookieJar().isEmpty()).isTrue();

      Request later = client.newRequest("/api/data?id=6").get().build();
      assertThatThrownBy(() -> client.execute(later)).isSameAs(failures.get(0));
      assertThat(gateway.refreshCalls).hasValue(1);
    }
  }

  @Test
  @DisplayName("a replay that is rejected again is returned as-is")
  void replayedUnauthorizedIsReturned() throws Exception {
    gateway.dataAlwaysUnauthorized = true;
    try (SessionApiClient client = loggedInClient()) {
      try (Response response = client.execute(client.newRequest("/api/data?id=1").get().build())) {
        assertThat(response.code()).isEqualTo(401);
      }
      assertThat(gateway.refreshCalls).hasValue(1);
      assertThat(client.state()).isEqualTo(RefreshState.IDLE);
    }
  }

  @Test
  @DisplayName("a refresh that exceeds its timeout logs out before the caller sees the failure")
  void refreshTimeout() throws Exception {
    gateway.refreshDelayMillis = 2_000;
    try (SessionApiClient client = client(Duration.ofMillis(300))) {
      client.login("person@example.com", "secret-pass");

      assertThatThrownBy(() -> client.execute(client.newRequest("/api/data?id=1").get().build()))
          .isInstanceOf(RefreshFailedException.class)
          .hasMessage("Session refresh timed out");
      assertThat(client.state()).isEqualTo(RefreshState.LOGGED_OUT);
      assertThat(loggedOut).hasSize(1);
    }
  }

  @Test
  @DisplayName("a refresh that completes after a local logout does not revive the session")
  void lateRefreshSuccessAfterLogout() throws Exception {
    gateway.refreshDelayMillis = 1_500;
    try (SessionApiClient client = loggedInClient()) {
      CompletableFuture<Response> pending = client.executeAsync(client.newRequest("/api/data?id=1").get().build());
      await(() -> client.state() == RefreshState.REFRESHING);

      client.coordinator().onLogout();
      assertThat(catchThrowable(() -> pending.get(10, TimeUnit.SECONDS)))
          .hasCauseInstanceOf(RefreshFailedException.class);

      awaitIdleDispatcher();
      assertThat(gateway.refreshCalls).hasValue(1);
      assertThat(client.state()).isEqualTo(RefreshState.LOGGED_OUT);
      assertThat(client.cookieJar().isEmpty()).isTrue();
      assertThat(client.cookieJar().csrfToken()).isEmpty();
      assertThat(refreshed).isEmpty();
    }
  }

  @Test
  @DisplayName("a refresh that fails after a new login does not end the new session")
  void lateRefreshFailureAfterLogin() throws Exception {
    gateway.refreshFails = true;
    gateway.refreshDelayMillis = 1_500;
    try (SessionApiClient client = loggedInClient()) {
      CompletableFuture<Response> pending = client.executeAsync(client.newRequest("/api/data?id=1").get().build());
      await(() -> client.state() == RefreshState.REFRESHING);

      client.coordinator().onLogin(Instant.now().plusSeconds(3600));

      awaitIdleDispatcher();
      assertThat(client.state()).isEqualTo(RefreshState.IDLE);
      assertThat(client.cookieJar().csrfToken()).contains("csrf-1");
      assertThat(loggedOut).isEmpty();
      // the queued request went out again with the current cookies instead of failing
      try (Response response = pending.get(10, TimeUnit.SECONDS)) {
        assertThat(response.code()).isEqualTo(401);
      }
    }
  }

  @Test
  @DisplayName("refreshes ahead of expiry without waiting for a 401")
  void proactiveRefresh() throws Exception {
    try (SessionApiClient client = client(Duration.ofSeconds(5))) {
      RefreshCoordinatorSettings settings = RefreshCoordinatorSettings.defaults(server.url("/"), ORIGIN);
      client.login("person@example.com", "secret-pass");

      // expiry inside the margin: refresh is due immediately
      client.coordinator().onLogin(Instant.now().plus(settings.proactiveRefreshMargin()).minusSeconds(1));

      assertThat(refreshedLatch.await(5, TimeUnit.SECONDS)).isTrue();
      assertThat(gateway.refreshCalls).hasValue(1);
      assertThat(refreshed).hasSize(1);
    }
  }

  @Test
  @DisplayName("local logout clears the session without notifying the listener")
  void logout() throws Exception {
    try (SessionApiClient client = loggedInClient()) {
      client.logout();

      assertThat(client.state()).isEqualTo(RefreshState.LOGGED_OUT);
      assertThat(client.cookieJar().isEmpty()).isTrue();
      assertThat(loggedOut).isEmpty();
    }
  }
}
