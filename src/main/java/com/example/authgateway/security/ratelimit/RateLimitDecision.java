package com.example.authgateway.security.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of a rate-limit check.
 */
public record RateLimitDecision(
    boolean allowed,
    int limit,
    long remaining,
    Instant resetAt
) {

  /**
   * Seconds until the window resets, rounded up and clamped to {@code [1, window]}.
   */
  public long retryAfterSeconds(Instant now, Duration window) {
    long millis = Duration.between(now, resetAt).toMillis();
    long seconds = (millis + 999) / 1000;
    long windowSeconds = Math.max(1, window.toSeconds());
    return Math.min(windowSeconds, Math.max(1, seconds));
  }
}
