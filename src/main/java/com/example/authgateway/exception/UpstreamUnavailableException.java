package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Identity provider or datastore unreachable. Never conflated with {@link UnauthenticatedException}.
 */
public class UpstreamUnavailableException extends GatewayException {
  public UpstreamUnavailableException(String message) {
    super(ErrorCode.UPSTREAM_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(ErrorCode.UPSTREAM_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, message, cause);
  }
}
