package com.example.authgateway.security.ratelimit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local bucket map. Each bucket is replaced atomically through
 * {@link ConcurrentMap#compute}, so concurrent requests on the same key never lose a count.
 * Expired windows reset lazily on access and are removed by the periodic sweep.
 */
@Slf4j
public class InMemoryRateStore implements RateStore {

  private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryRateStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public RateWindow increment(String key, Duration window) {
    Instant now = clock.instant();
    Bucket bucket = buckets.compute(key, (k, current) -> {
      if (current == null || current.isExpired(now)) {
        return new Bucket(1, now.plus(window));
      }
      return new Bucket(current.count() + 1, current.resetAt());
    });
    return new RateWindow(bucket.count(), bucket.resetAt());
  }

  @Override
  public void decrement(String key, Instant windowResetAt) {
    buckets.computeIfPresent(key, (k, current) -> current.resetAt().equals(windowResetAt)
        ? new Bucket(Math.max(0, current.count() - 1), current.resetAt())
        : current);
  }

  @Override
  @Scheduled(fixedDelayString = "${app.rate-limit.sweep-interval-ms:60000}")
  public void sweep() {
    Instant now = clock.instant();
    int before = buckets.size();
    buckets.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    int removed = before - buckets.size();
    if (removed > 0) {
      log.debug("Rate store sweep removed {} expired bucket(s), {} remaining", removed, buckets.size());
    }
  }

  @Override
  public boolean isHealthy() {
    return true;
  }

  @Override
  public String name() {
    return "memory";
  }

  int size() {
    return buckets.size();
  }

  private record Bucket(long count, Instant resetAt) {
    boolean isExpired(Instant now) {
      return !now.isBefore(resetAt);
    }
  }
}
