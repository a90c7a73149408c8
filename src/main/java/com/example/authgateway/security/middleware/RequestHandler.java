package com.example.authgateway.security.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;

/**
 * Terminal request handler at the end of a middleware pipeline.
 */
@FunctionalInterface
public interface RequestHandler {

  void handle(HttpServletRequest request, HttpServletResponse response)
      throws IOException, ServletException;
}
