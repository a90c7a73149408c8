package com.example.authgateway.security.ratelimit;

import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.Limit;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.TierLimits;

/**
 * Groups of endpoints that share limits.
 */
public enum RateLimitTier {

  /** Session endpoints (login, refresh, logout, signup). Successful requests are not counted. */
  AUTH("auth", true),
  API("api", false),
  ADMIN("admin", false);

  private final String keyPrefix;
  private final boolean skipSuccessfulRequests;

  RateLimitTier(String keyPrefix, boolean skipSuccessfulRequests) {
    this.keyPrefix = keyPrefix;
    this.skipSuccessfulRequests = skipSuccessfulRequests;
  }

  public String keyPrefix() {
    return keyPrefix;
  }

  public boolean skipSuccessfulRequests() {
    return skipSuccessfulRequests;
  }

  public Limit limitFrom(TierLimits limits) {
    return switch (this) {
      case AUTH -> limits.auth();
      case API -> limits.api();
      case ADMIN -> limits.admin();
    };
  }
}
