package com.example.authgateway.security.middleware;

import com.example.authgateway.security.SessionAuthenticator;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

import java.io.IOException;

@RequiredArgsConstructor
public class AuthenticationMiddleware implements RequestMiddleware {

  private final SessionAuthenticator authenticator;

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, RequestHandler next)
      throws IOException, ServletException {
    authenticator.authenticate(request);
    next.handle(request, response);
  }
}
