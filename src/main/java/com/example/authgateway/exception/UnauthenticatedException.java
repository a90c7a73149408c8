package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Missing, expired or invalid access token.
 */
public class UnauthenticatedException extends GatewayException {
  public UnauthenticatedException(String message) {
    super(ErrorCode.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED, message);
  }

  public UnauthenticatedException(String message, Throwable cause) {
    super(ErrorCode.UNAUTHENTICATED, HttpStatus.UNAUTHORIZED, message, cause);
  }
}
