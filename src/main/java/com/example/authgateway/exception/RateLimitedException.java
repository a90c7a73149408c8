package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Request bucket exhausted; clients may retry after {@link #getRetryAfterSeconds()}.
 */
public class RateLimitedException extends GatewayException {

  private final long retryAfterSeconds;

  public RateLimitedException(String message, long retryAfterSeconds) {
    super(ErrorCode.RATE_LIMITED, HttpStatus.TOO_MANY_REQUESTS, message);
    this.retryAfterSeconds = retryAfterSeconds;
  }

  public long getRetryAfterSeconds() {
    return retryAfterSeconds;
  }
}
