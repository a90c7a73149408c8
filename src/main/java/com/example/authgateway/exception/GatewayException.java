package com.example.authgateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for failures that map onto the gateway's error taxonomy.
 */
public abstract class GatewayException extends RuntimeException {

  private final ErrorCode errorCode;
  private final HttpStatus status;

  protected GatewayException(ErrorCode errorCode, HttpStatus status, String message) {
    super(message);
    this.errorCode = errorCode;
    this.status = status;
  }

  protected GatewayException(ErrorCode errorCode, HttpStatus status, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.status = status;
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public HttpStatus getStatus() {
    return status;
  }
}
