package com.example.authgateway.web.rest.errors;

import com.example.authgateway.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Handles what happens when a request reaches a protected chain without an authentication.
 *
 * We are an API gateway, so instead of redirecting to a login page we return the standard
 * 401 JSON error and let the client decide (refresh, or show its login screen).
 */
@Component
@RequiredArgsConstructor
public class DelegatedAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private final ErrorResponseWriter errorResponseWriter;

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    errorResponseWriter.write(response, HttpStatus.UNAUTHORIZED, ErrorCode.UNAUTHENTICATED,
                              "Authentication required");
  }
}
