package com.example.authgateway.security.middleware;

import com.example.authgateway.exception.CsrfRejectedException;
import com.example.authgateway.security.csrf.CsrfVerdict;
import com.example.authgateway.security.csrf.CsrfVerifier;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

@Slf4j
@RequiredArgsConstructor
public class CsrfMiddleware implements RequestMiddleware {

  private final CsrfVerifier csrfVerifier;

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, RequestHandler next)
      throws IOException, ServletException {
    CsrfVerdict verdict = csrfVerifier.verify(request);
    if (!verdict.allowed()) {
      log.debug("CSRF check failed for {} {}: {}", request.getMethod(), request.getRequestURI(),
                verdict.reason());
      throw new CsrfRejectedException(verdict.reason());
    }
    next.handle(request, response);
  }
}
