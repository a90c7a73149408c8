package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * The identity provider refused a login or signup.
 */
public class CredentialsRejectedException extends GatewayException {
  public CredentialsRejectedException(ErrorCode errorCode, HttpStatus status, String message) {
    super(errorCode, status, message);
  }
}
