package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Anti-forgery check failed. Distinct from {@link ForbiddenException} so clients never mistake it for a role failure.
 */
public class CsrfRejectedException extends GatewayException {
  public CsrfRejectedException(String message) {
    super(ErrorCode.CSRF_REJECTED, HttpStatus.FORBIDDEN, message);
  }

  public CsrfRejectedException(String message, Throwable cause) {
    super(ErrorCode.CSRF_REJECTED, HttpStatus.FORBIDDEN, message, cause);
  }
}
