package com.example.authgateway.exception;

/**
 * Stable error codes returned in {@code error.code}. Clients branch on these,
 * so values are never renamed.
 */
public enum ErrorCode {
  UNAUTHENTICATED,
  FORBIDDEN,
  CSRF_REJECTED,
  RATE_LIMITED,
  REFRESH_FAILED,
  UPSTREAM_UNAVAILABLE,
  VALIDATION_ERROR,
  LOGIN_FAILED,
  SIGNUP_FAILED,
  METHOD_NOT_ALLOWED,
  NOT_FOUND,
  INTERNAL_ERROR
}
