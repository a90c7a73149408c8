package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Refresh token missing, invalid, expired or already used. Terminal for the session.
 */
public class RefreshFailedException extends GatewayException {
  public RefreshFailedException(String message) {
    super(ErrorCode.REFRESH_FAILED, HttpStatus.UNAUTHORIZED, message);
  }

  public RefreshFailedException(String message, Throwable cause) {
    super(ErrorCode.REFRESH_FAILED, HttpStatus.UNAUTHORIZED, message, cause);
  }
}
