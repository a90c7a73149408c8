package com.example.authgateway.client;

import com.example.authgateway.exception.RefreshFailedException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.http.HttpHeaders;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-flight session refresh for an HTTP client.
 * <p>
 * The first 401 starts exactly one refresh call. While it is in flight, new requests and
 * further 401s wait in a queue; on success they are replayed once, in arrival order, and a
 * replay that gets 401 again is returned as-is. On failure the cookie jar is cleared, every
 * waiting request fails with the same {@link RefreshFailedException} and the coordinator
 * stays {@link RefreshState#LOGGED_OUT} until the next login.
 * <p>
 * A 401 for a request that was sent before the latest successful refresh is replayed without
 * another refresh, since it carried the old cookies.
 * <p>
 * Each refresh attempt carries an id. A result that arrives after a logout, a login or a newer
 * attempt is discarded, so {@link RefreshState#LOGGED_OUT} holds until the next login.
 */
@Slf4j
public class RefreshCoordinator implements Closeable {

  private static final String ORIGIN_HEADER = HttpHeaders.ORIGIN;

  private final OkHttpClient httpClient;
  private final OkHttpClient refreshClient;
  private final SessionCookieJar cookieJar;
  private final RefreshCoordinatorSettings settings;
  private final ObjectMapper objectMapper;
  private final SessionEventListener listener;
  private final Clock clock;
  private final ScheduledExecutorService scheduler;

  private final Object lock = new Object();
  private final List<PendingCall> queue = new ArrayList<>();
  private RefreshState state = RefreshState.IDLE;
  private long generation;
  private long refreshAttempt;
  private RefreshFailedException lastFailure;
  private ScheduledFuture<?> proactiveRefresh;

  public RefreshCoordinator(OkHttpClient httpClient,
                            SessionCookieJar cookieJar,
                            RefreshCoordinatorSettings settings,
                            ObjectMapper objectMapper,
                            SessionEventListener listener,
                            Clock clock) {
    this.httpClient = httpClient;
    this.refreshClient = httpClient.newBuilder().callTimeout(settings.refreshTimeout()).build();
    this.cookieJar = cookieJar;
    this.settings = settings;
    this.objectMapper = objectMapper;
    this.listener = listener != null ? listener : SessionEventListener.NO_OP;
    this.clock = clock;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
      Thread thread = new Thread(runnable, "session-refresh");
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Sends {@code request}, refreshing the session once if it is answered with 401.
   *
   * @throws RefreshFailedException when the session could not be refreshed or has ended
   */
  public Response execute(Request request) throws IOException {
    try {
      return enqueue(request).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("Interrupted waiting for " + request.url());
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RefreshFailedException refreshFailed) {
        throw refreshFailed;
      }
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("Request to " + request.url() + " failed", cause);
    }
  }

  public CompletableFuture<Response> enqueue(Request request) {
    PendingCall pending = new PendingCall(request, new CompletableFuture<>());
    long sentGeneration;

    synchronized (lock) {
      if (state == RefreshState.LOGGED_OUT) {
        pending.future().completeExceptionally(loggedOut());
        return pending.future();
      }
      if (state == RefreshState.REFRESHING) {
        queue.add(pending);
        return pending.future();
      }
      sentGeneration = generation;
    }

    dispatch(pending, sentGeneration, false);
    return pending.future();
  }

  /**
   * Marks a fresh session after a login and schedules its proactive refresh.
   */
  public void onLogin(Instant accessTokenExpiresAt) {
    List<PendingCall> waiting;
    long newGeneration;
    synchronized (lock) {
      state = RefreshState.IDLE;
      lastFailure = null;
      generation++;
      newGeneration = generation;
      waiting = new ArrayList<>(queue);
      queue.clear();
    }
    // requests queued behind a refresh that the login superseded go out with the new cookies
    for (PendingCall pending : waiting) {
      dispatch(pending, newGeneration, true);
    }
    scheduleProactiveRefresh(accessTokenExpiresAt);
  }

  /**
   * Local logout. Waiting requests fail; the listener is not notified since the
   * application asked for it.
   */
  public void onLogout() {
    RefreshFailedException reason = new RefreshFailedException("Logged out");
    List<PendingCall> toFail = transitionToLoggedOut(reason);
    toFail.forEach(pending -> pending.future().completeExceptionally(reason));
  }

  /**
   * Starts a refresh unless one is already running or the session has ended.
   */
  public void refreshNow() {
    long attempt;
    synchronized (lock) {
      if (state != RefreshState.IDLE) {
        return;
      }
      attempt = beginRefresh();
    }
    startRefresh(attempt);
  }

  public RefreshState state() {
    synchronized (lock) {
      return state;
    }
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  private void dispatch(PendingCall pending, long sentGeneration, boolean replay) {
    Request request = decorate(pending.request());
    httpClient.newCall(request).enqueue(new Callback() {
      @Override
      public void onResponse(Call call, Response response) {
        if (response.code() != 401 || replay) {
          pending.future().complete(response);
          return;
        }
        response.close();
        onUnauthorized(pending, sentGeneration);
      }

      @Override
      public void onFailure(Call call, IOException e) {
        pending.future().completeExceptionally(e);
      }
    });
  }

  private void onUnauthorized(PendingCall pending, long sentGeneration) {
    boolean replayNow = false;
    long attempt = 0;
    long currentGeneration;

    synchronized (lock) {
      currentGeneration = generation;
      if (state == RefreshState.LOGGED_OUT) {
        pending.future().completeExceptionally(loggedOut());
        return;
      }
      if (sentGeneration < generation) {
        replayNow = true;
      } else {
        queue.add(pending);
        if (state == RefreshState.IDLE) {
          attempt = beginRefresh();
        }
      }
    }

    if (replayNow) {
      log.debug("401 for a request sent before the last refresh, replaying");
      dispatch(pending, currentGeneration, true);
    } else if (attempt != 0) {
      startRefresh(attempt);
    }
  }

  // caller holds lock
  private long beginRefresh() {
    state = RefreshState.REFRESHING;
    return ++refreshAttempt;
  }

  // caller holds lock
  private boolean isCurrent(long attempt) {
    return state == RefreshState.REFRESHING && attempt == refreshAttempt;
  }

  private void startRefresh(long attempt) {
    log.debug("Refreshing session");
    Request refreshRequest = decorate(new Request.Builder()
                                          .url(settings.resolve(settings.refreshPath()))
                                          .post(RequestBody.create(new byte[0], null))
                                          .build());

    refreshClient.newCall(refreshRequest).enqueue(new Callback() {
      @Override
      public void onResponse(Call call, Response response) {
        try (response) {
          if (!response.isSuccessful()) {
            onRefreshFailed(attempt, new RefreshFailedException("Session refresh rejected, status: " + response.code()));
            return;
          }
          onRefreshSucceeded(attempt, readExpiry(response.body()));
        }
      }

      @Override
      public void onFailure(Call call, IOException e) {
        String message = e instanceof InterruptedIOException
            ? "Session refresh timed out"
            : "Session refresh failed";
        onRefreshFailed(attempt, new RefreshFailedException(message, e));
      }
    });
  }

  private void onRefreshSucceeded(long attempt, Optional<Instant> expiresAt) {
    List<PendingCall> toReplay;
    long newGeneration;

    synchronized (lock) {
      if (!isCurrent(attempt)) {
        // OkHttp has already stored the rotated cookies; they must not revive an ended session
        if (state == RefreshState.LOGGED_OUT) {
          cookieJar.clear();
        }
        log.debug("Discarding result of superseded refresh attempt {}", attempt);
        return;
      }
      generation++;
      newGeneration = generation;
      state = RefreshState.IDLE;
      toReplay = new ArrayList<>(queue);
      queue.clear();
    }

    log.debug("Session refreshed, replaying {} request(s)", toReplay.size());
    for (PendingCall pending : toReplay) {
      dispatch(pending, newGeneration, true);
    }

    expiresAt.ifPresent(expiry -> {
      listener.onRefreshed(expiry);
      scheduleProactiveRefresh(expiry);
    });
  }

  private void onRefreshFailed(long attempt, RefreshFailedException failure) {
    List<PendingCall> toFail;
    synchronized (lock) {
      if (!isCurrent(attempt)) {
        log.debug("Ignoring failure of superseded refresh attempt {}: {}", attempt, failure.getMessage());
        return;
      }
      toFail = endSession(failure);
    }
    cookieJar.clear();
    log.info("Session refresh failed: {}", failure.getMessage());
    // the application learns about the logout before any caller sees the failure
    listener.onLoggedOut(failure);
    for (PendingCall pending : toFail) {
      pending.future().completeExceptionally(failure);
    }
  }

  private List<PendingCall> transitionToLoggedOut(RefreshFailedException reason) {
    List<PendingCall> toFail;
    synchronized (lock) {
      toFail = endSession(reason);
    }
    cookieJar.clear();
    return toFail;
  }

  // caller holds lock
  private List<PendingCall> endSession(RefreshFailedException reason) {
    state = RefreshState.LOGGED_OUT;
    lastFailure = reason;
    List<PendingCall> toFail = new ArrayList<>(queue);
    queue.clear();
    if (proactiveRefresh != null) {
      proactiveRefresh.cancel(false);
      proactiveRefresh = null;
    }
    return toFail;
  }

  private void scheduleProactiveRefresh(Instant accessTokenExpiresAt) {
    if (accessTokenExpiresAt == null) {
      return;
    }
    Duration delay = Duration.between(clock.instant(), accessTokenExpiresAt)
        .minus(settings.proactiveRefreshMargin());
    long delayMillis = Math.max(0, delay.toMillis());

    synchronized (lock) {
      if (proactiveRefresh != null) {
        proactiveRefresh.cancel(false);
      }
      proactiveRefresh = scheduler.schedule(this::refreshNow, delayMillis, TimeUnit.MILLISECONDS);
    }
    log.debug("Proactive refresh scheduled in {} ms", delayMillis);
  }

  private Request decorate(Request request) {
    Request.Builder builder = request.newBuilder();
    cookieJar.csrfToken().ifPresent(token -> builder.header(settings.csrfHeaderName(), token));
    if (settings.origin() != null && request.header(ORIGIN_HEADER) == null) {
      builder.header(ORIGIN_HEADER, settings.origin());
    }
    return builder.build();
  }

  private Optional<Instant> readExpiry(ResponseBody body) {
    if (body == null) {
      return Optional.empty();
    }
    try {
      JsonNode node = objectMapper.readTree(body.string());
      JsonNode expiresAt = node.get("expiresAt");
      if (expiresAt == null || !expiresAt.isTextual()) {
        return Optional.empty();
      }
      return Optional.of(Instant.parse(expiresAt.asText()));
    } catch (IOException | DateTimeParseException e) {
      log.debug("Refresh response carried no readable expiry: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private RefreshFailedException loggedOut() {
    return lastFailure != null ? lastFailure : new RefreshFailedException("Session has ended");
  }

  private record PendingCall(Request request, CompletableFuture<Response> future) {}
}
