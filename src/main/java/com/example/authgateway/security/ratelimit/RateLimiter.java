package com.example.authgateway.security.ratelimit;

import com.example.authgateway.domain.entity.EnvironmentProfile;
import com.example.authgateway.properties.ApplicationProperties;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.Limit;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.TierLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window request counter per key.
 * <p>
 * Limits come from the strict or lenient table according to the configured environment
 * profile. The bypass flag is honoured under the development profile only.
 */
@Slf4j
@Component
public class RateLimiter {

  private final RateStore store;
  private final TierLimits limits;
  private final boolean bypass;
  private final Clock clock;

  public RateLimiter(RateStore store, ApplicationProperties properties, Clock clock) {
    this.store = store;
    this.clock = clock;

    EnvironmentProfile profile = properties.environmentProfile();
    this.limits = properties.rateLimit().limitsFor(profile);
    this.bypass = properties.rateLimit().bypass() && profile == EnvironmentProfile.DEVELOPMENT;
    log.info("Rate limiter using {} store, profile {}, bypass {}", store.name(), profile, bypass);
  }

  public RateLimitDecision check(String key, int limit, Duration window) {
    RateWindow current = store.increment(key, window);
    boolean allowed = current.count() <= limit;
    long remaining = Math.max(0, limit - current.count());
    return new RateLimitDecision(allowed, limit, remaining, current.resetAt());
  }

  /**
   * Counts one request for {@code clientKey} against the tier's limit.
   */
  public RateLimitDecision check(RateLimitTier tier, String clientKey) {
    Limit limit = limitFor(tier);
    if (bypass) {
      log.warn("Rate limit bypassed for tier {} ({})", tier, clientKey);
      return new RateLimitDecision(true, limit.requests(), limit.requests(),
                                   clock.instant().plus(limit.window()));
    }
    return check(bucketKey(tier, clientKey), limit.requests(), limit.window());
  }

  /**
   * Returns the hit behind {@code decision}, a result of {@link #check(RateLimitTier, String)};
   * used for tiers that only count unsuccessful requests.
   */
  public void release(RateLimitTier tier, String clientKey, RateLimitDecision decision) {
    if (!bypass) {
      store.decrement(bucketKey(tier, clientKey), decision.resetAt());
    }
  }

  public Limit limitFor(RateLimitTier tier) {
    return tier.limitFrom(limits);
  }

  public boolean isBypassActive() {
    return bypass;
  }

  public boolean isStoreHealthy() {
    return store.isHealthy();
  }

  public String storeName() {
    return store.name();
  }

  public Instant now() {
    return clock.instant();
  }

  private static String bucketKey(RateLimitTier tier, String clientKey) {
    return tier.keyPrefix() + ":" + clientKey;
  }
}
