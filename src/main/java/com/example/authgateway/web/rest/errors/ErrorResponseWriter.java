package com.example.authgateway.web.rest.errors;

import com.example.authgateway.exception.ErrorCode;
import com.example.authgateway.exception.GatewayException;
import com.example.authgateway.exception.RateLimitedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the standard error body {@code {"error":{"message","code"},"timestamp"}} straight to
 * the servlet response, for failures raised outside Spring MVC.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void write(HttpServletResponse response, GatewayException ex) throws IOException {
    if (ex instanceof RateLimitedException rateLimited) {
      response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(rateLimited.getRetryAfterSeconds()));
    }
    write(response, ex.getStatus(), ex.getErrorCode(), ex.getMessage());
  }

  public void write(HttpServletResponse response, HttpStatus status, ErrorCode code, String message)
      throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), body(code, message));
  }

  public Map<String, Object> body(ErrorCode code, String message) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("message", message);
    error.put("code", code.name());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error);
    body.put("timestamp", clock.instant().toString());
    return body;
  }
}
