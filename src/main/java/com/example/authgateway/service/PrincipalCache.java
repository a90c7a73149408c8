package com.example.authgateway.service;

import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.properties.ApplicationProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Short-lived cache of resolved principals keyed by user id, so that consecutive requests of
 * the same user do not each re-read the profile store. Entries expire after the configured
 * TTL; a role change therefore takes effect within one TTL at the latest. Expiry follows the
 * application {@link Clock}.
 */
@Slf4j
@Component
public class PrincipalCache {

  private final Cache<String, UserPrincipal> cache;

  public PrincipalCache(ApplicationProperties properties, Clock clock) {
    ApplicationProperties.CacheProperties.PrincipalCacheProperties cacheProps =
        properties.cache().principal();

    this.cache = Caffeine.newBuilder()
        .maximumSize(cacheProps.maxSize())
        .expireAfterWrite(cacheProps.ttl())
        .ticker(clockTicker(clock))
        .recordStats()
        .build();
  }

  /**
   * Returns the cached principal or resolves and caches it. Failures of {@code resolver}
   * propagate and nothing is cached.
   */
  public UserPrincipal get(String userId, Function<String, UserPrincipal> resolver) {
    return cache.get(userId, resolver);
  }

  public void evict(String userId) {
    if (userId != null) {
      cache.invalidate(userId);
      log.debug("Evicted cached principal {}", maskIdentifier(userId));
    }
  }

  public long evictAll() {
    long size = cache.estimatedSize();
    cache.invalidateAll();
    log.info("Evicted all cached principals ({} entries)", size);
    return size;
  }

  public CacheStats stats() {
    return cache.stats();
  }

  private static Ticker clockTicker(Clock clock) {
    return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }
}
