package com.example.authgateway.security.middleware;

import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.security.ratelimit.RateLimitTier;

import java.util.ArrayList;
import java.util.List;

/**
 * Named middleware stacks. Every endpoint is served by exactly one of them.
 * <ul>
 *   <li>{@code PUBLIC}: rate limit (auth tier)</li>
 *   <li>{@code AUTHENTICATED}: rate limit (api tier), CSRF, authenticate</li>
 *   <li>{@code ADMIN}: rate limit (admin tier), CSRF, authenticate, require admin role</li>
 * </ul>
 */
public enum EndpointPreset {

  PUBLIC(RateLimitTier.AUTH, false, false, null),
  AUTHENTICATED(RateLimitTier.API, true, true, null),
  ADMIN(RateLimitTier.ADMIN, true, true, Role.ADMIN);

  private final RateLimitTier tier;
  private final boolean csrf;
  private final boolean authenticate;
  private final Role requiredRole;

  EndpointPreset(RateLimitTier tier, boolean csrf, boolean authenticate, Role requiredRole) {
    this.tier = tier;
    this.csrf = csrf;
    this.authenticate = authenticate;
    this.requiredRole = requiredRole;
  }

  public RateLimitTier tier() {
    return tier;
  }

  public List<RequestMiddleware> stages(MiddlewareFactory factory) {
    List<RequestMiddleware> stages = new ArrayList<>();
    stages.add(factory.rateLimit(tier));
    if (csrf) {
      stages.add(factory.csrf());
    }
    if (authenticate) {
      stages.add(factory.authenticate());
    }
    if (requiredRole != null) {
      stages.add(factory.requireRole(requiredRole));
    }
    return List.copyOf(stages);
  }
}
