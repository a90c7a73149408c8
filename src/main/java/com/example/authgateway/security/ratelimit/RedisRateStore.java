package com.example.authgateway.security.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Shared bucket store for multi-instance deployments. INCR opens the bucket, the first hit
 * sets the expiry and Redis evicts it when the window ends, so {@link #sweep()} has
 * nothing to do.
 * <p>
 * A Redis outage fails open: the request is counted as the first of a fresh window and the
 * error is logged.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisRateStore implements RateStore {

  private static final String KEY_PREFIX = "ratelimit:";

  private final StringRedisTemplate redisTemplate;
  private final Clock clock;

  @Override
  public RateWindow increment(String key, Duration window) {
    String redisKey = KEY_PREFIX + key;
    Instant now = clock.instant();

    try {
      Long count = redisTemplate.opsForValue().increment(redisKey);
      if (count != null && count == 1) {
        redisTemplate.expire(redisKey, window);
      }

      Long ttlMillis = redisTemplate.getExpire(redisKey, TimeUnit.MILLISECONDS);
      if (ttlMillis == null || ttlMillis < 0) {
        // Key without expiry (expire lost after INCR): re-arm it.
        redisTemplate.expire(redisKey, window);
        ttlMillis = window.toMillis();
      }

      return new RateWindow(count != null ? count : 1, now.plusMillis(ttlMillis));
    } catch (Exception e) {
      log.error("Rate store increment failed for key prefix {}, allowing request", KEY_PREFIX, e);
      return new RateWindow(1, now.plus(window));
    }
  }

  @Override
  public void decrement(String key, Instant windowResetAt) {
    // resetAt is derived from PTTL and only approximate here, so the window is matched by time
    if (!clock.instant().isBefore(windowResetAt)) {
      log.debug("Window for {} already ended, not returning the hit", KEY_PREFIX + key);
      return;
    }
    String redisKey = KEY_PREFIX + key;
    try {
      Long count = redisTemplate.opsForValue().decrement(redisKey);
      if (count != null && count < 0) {
        redisTemplate.opsForValue().increment(redisKey);
      }
    } catch (Exception e) {
      log.error("Rate store decrement failed", e);
    }
  }

  @Override
  public void sweep() {
    // Redis expires buckets itself.
  }

  @Override
  public boolean isHealthy() {
    try {
      String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      return "PONG".equals(pong);
    } catch (Exception e) {
      log.error("Rate store health check failed", e);
      return false;
    }
  }

  @Override
  public String name() {
    return "redis";
  }
}
