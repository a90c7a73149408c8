package com.example.authgateway.security.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * One stage of a request pipeline. A stage either calls {@code next} or ends the request,
 * normally by throwing a {@link com.example.authgateway.exception.GatewayException} that the
 * pipeline renders as the error response.
 */
@FunctionalInterface
public interface RequestMiddleware {

  void handle(HttpServletRequest request, HttpServletResponse response, RequestHandler next)
      throws IOException, ServletException;
}
