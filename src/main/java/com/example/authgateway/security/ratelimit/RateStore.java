package com.example.authgateway.security.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Counter storage behind the rate limiter. The in-process implementation is correct for a
 * single instance; horizontally scaled deployments switch to the Redis-backed one so that
 * all instances share the same buckets.
 */
public interface RateStore {

  /**
   * Counts one hit against {@code key}. Opens a fresh window of length {@code window}
   * when none is active.
   */
  RateWindow increment(String key, Duration window);

  /**
   * Returns one hit counted in the window that ends at {@code windowResetAt}, never going
   * below zero. Once that window has ended the hit is gone with it and a newer window is
   * left untouched.
   */
  void decrement(String key, Instant windowResetAt);

  /**
   * Drops buckets whose window has elapsed.
   */
  void sweep();

  boolean isHealthy();

  String name();
}
