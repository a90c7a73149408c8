package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Authenticated but lacking the required role or capability.
 */
public class ForbiddenException extends GatewayException {
  public ForbiddenException(String message) {
    super(ErrorCode.FORBIDDEN, HttpStatus.FORBIDDEN, message);
  }

  public ForbiddenException(String message, Throwable cause) {
    super(ErrorCode.FORBIDDEN, HttpStatus.FORBIDDEN, message, cause);
  }
}
