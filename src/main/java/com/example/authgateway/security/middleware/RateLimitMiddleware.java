package com.example.authgateway.security.middleware;

import com.example.authgateway.exception.RateLimitedException;
import com.example.authgateway.properties.ApplicationProperties.RateLimitProperties.Limit;
import com.example.authgateway.security.ratelimit.RateLimitDecision;
import com.example.authgateway.security.ratelimit.RateLimitTier;
import com.example.authgateway.security.ratelimit.RateLimiter;
import com.example.authgateway.util.ClientAddressUtil;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import java.io.IOException;

/**
 * Counts the request against its tier and rejects it with 429 once the window is used up.
 * <p>
 * For tiers that skip successful requests the hit is handed back after the request
 * completes with a status below 400, so only failed attempts use up the budget.
 */
@Slf4j
public class RateLimitMiddleware implements RequestMiddleware {

  public static final String HEADER_LIMIT = "X-RateLimit-Limit";
  public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  public static final String HEADER_RESET = "X-RateLimit-Reset";

  private final RateLimiter rateLimiter;
  private final RateLimitTier tier;

  public RateLimitMiddleware(RateLimiter rateLimiter, RateLimitTier tier) {
    this.rateLimiter = rateLimiter;
    this.tier = tier;
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, RequestHandler next)
      throws IOException, ServletException {
    String clientKey = clientKey(request);
    RateLimitDecision decision = rateLimiter.check(tier, clientKey);

    response.setHeader(HEADER_LIMIT, String.valueOf(decision.limit()));
    response.setHeader(HEADER_REMAINING, String.valueOf(decision.remaining()));
    response.setHeader(HEADER_RESET, String.valueOf(decision.resetAt().toEpochMilli()));

    if (!decision.allowed()) {
      Limit limit = rateLimiter.limitFor(tier);
      long retryAfter = decision.retryAfterSeconds(rateLimiter.now(), limit.window());
      response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
      log.info("Rate limit exceeded on tier {} for {} {}", tier,
               ClientAddressUtil.maskIpAddress(ClientAddressUtil.getClientIpAddress(request)),
               request.getRequestURI());
      throw new RateLimitedException("Too many requests, please try again later", retryAfter);
    }

    next.handle(request, response);

    if (tier.skipSuccessfulRequests() && response.getStatus() < 400) {
      rateLimiter.release(tier, clientKey, decision);
    }
  }

  public RateLimitTier tier() {
    return tier;
  }

  /**
   * Session endpoints are limited per address and path, so failed logins do not use up the
   * refresh budget. Other tiers are limited per address.
   */
  private String clientKey(HttpServletRequest request) {
    String ip = ClientAddressUtil.getClientIpAddress(request);
    if (tier == RateLimitTier.AUTH) {
      return ip + ":" + request.getRequestURI();
    }
    return ip;
  }
}
