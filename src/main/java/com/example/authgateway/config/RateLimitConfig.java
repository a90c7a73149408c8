package com.example.authgateway.config;

import com.example.authgateway.security.ratelimit.InMemoryRateStore;
import com.example.authgateway.security.ratelimit.RateStore;
import com.example.authgateway.security.ratelimit.RedisRateStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Rate store selection. The in-memory store is the default; {@code app.rate-limit.store=redis}
 * switches every instance onto the shared Redis buckets.
 */
@Configuration(proxyBeanMethods = false)
public class RateLimitConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "memory", matchIfMissing = true)
  public RateStore inMemoryRateStore(Clock clock) {
    return new InMemoryRateStore(clock);
  }

  @Bean
  @ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "redis")
  public RateStore redisRateStore(StringRedisTemplate redisTemplate, Clock clock) {
    return new RedisRateStore(redisTemplate, clock);
  }
}
