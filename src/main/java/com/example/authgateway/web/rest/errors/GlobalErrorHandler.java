package com.example.authgateway.web.rest.errors;

import com.example.authgateway.exception.ErrorCode;
import com.example.authgateway.exception.GatewayException;
import com.example.authgateway.exception.RateLimitedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global Error Handler
 *
 * Renders controller failures in the same body shape the middleware pipeline uses,
 * without exposing internal details.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalErrorHandler {

  private final ErrorResponseWriter errorResponseWriter;

  @ExceptionHandler(GatewayException.class)
  public ResponseEntity<Map<String, Object>> handleGatewayException(GatewayException ex) {
    if (ex instanceof UpstreamUnavailableException) {
      log.error("Upstream failure: {}", ex.getMessage(), ex);
    } else {
      log.debug("Request rejected with {}: {}", ex.getErrorCode(), ex.getMessage());
    }

    ResponseEntity.BodyBuilder builder = ResponseEntity.status(ex.getStatus())
        .contentType(MediaType.APPLICATION_JSON);
    if (ex instanceof RateLimitedException rateLimited) {
      builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.getRetryAfterSeconds()));
    }
    return builder.body(errorResponseWriter.body(ex.getErrorCode(), ex.getMessage()));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<Map<String, Object>> handleAccessDeniedException(AccessDeniedException ex) {
    log.debug("Access denied: {}", ex.getMessage());
    return build(HttpStatus.FORBIDDEN, ErrorCode.FORBIDDEN, "Access denied");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
    String errors = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + ": " + error.getDefaultMessage())
        .sorted()
        .collect(Collectors.joining(", "));

    return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, errors);
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
    String errors = ex.getConstraintViolations().stream()
        .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
        .sorted()
        .collect(Collectors.joining(", "));

    return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, errors);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, "Malformed request body");
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<Map<String, Object>> handleMissingParams(MissingServletRequestParameterException ex) {
    return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR,
                 String.format("Missing required parameter: %s", ex.getParameterName()));
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<Map<String, Object>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
    return build(HttpStatus.METHOD_NOT_ALLOWED, ErrorCode.METHOD_NOT_ALLOWED,
                 String.format("Method %s not supported", ex.getMethod()));
  }

  @ExceptionHandler(NoResourceFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException ex) {
    return build(HttpStatus.NOT_FOUND, ErrorCode.NOT_FOUND, "Resource not found");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
    log.error("Unexpected error", ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.INTERNAL_ERROR,
                 "An error occurred processing your request");
  }

  private ResponseEntity<Map<String, Object>> build(HttpStatus status, ErrorCode code, String message) {
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(errorResponseWriter.body(code, message));
  }
}
