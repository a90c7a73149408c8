package com.example.authgateway.security.middleware;

import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.security.SessionAuthenticator;
import com.example.authgateway.security.csrf.CsrfVerifier;
import com.example.authgateway.security.ratelimit.RateLimitTier;
import com.example.authgateway.security.ratelimit.RateLimiter;
import com.example.authgateway.service.AuditTrail;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the individual middleware stages from their collaborators.
 */
@Component
@RequiredArgsConstructor
public class MiddlewareFactory {

  private final RateLimiter rateLimiter;
  private final CsrfVerifier csrfVerifier;
  private final SessionAuthenticator authenticator;
  private final AuditTrail auditTrail;

  public RequestMiddleware rateLimit(RateLimitTier tier) {
    return new RateLimitMiddleware(rateLimiter, tier);
  }

  public RequestMiddleware csrf() {
    return new CsrfMiddleware(csrfVerifier);
  }

  public RequestMiddleware authenticate() {
    return new AuthenticationMiddleware(authenticator);
  }

  public RequestMiddleware requireRole(Role role) {
    return new RequireRoleMiddleware(authenticator, auditTrail, role);
  }
}
