package com.example.authgateway.web.rest.errors;

import com.example.authgateway.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * JSON 403 for requests an authorization rule turns away. Also serves as the entry point of
 * the deny-all chain, so paths no preset serves answer 403 rather than asking for a login.
 */
@Component
@RequiredArgsConstructor
public class JsonAccessDeniedHandler implements AccessDeniedHandler, AuthenticationEntryPoint {

  private final ErrorResponseWriter errorResponseWriter;

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response,
                     AccessDeniedException accessDeniedException) throws IOException {
    errorResponseWriter.write(response, HttpStatus.FORBIDDEN, ErrorCode.FORBIDDEN, "Access denied");
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    errorResponseWriter.write(response, HttpStatus.FORBIDDEN, ErrorCode.FORBIDDEN, "Access denied");
  }
}
