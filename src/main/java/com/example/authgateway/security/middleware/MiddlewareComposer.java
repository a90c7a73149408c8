package com.example.authgateway.security.middleware;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.util.List;

/**
 * Left-to-right composition of middleware stages.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class MiddlewareComposer {

  /**
   * Composes {@code stages} around {@code terminal}. The first stage runs first.
   */
  public static RequestHandler compose(List<RequestMiddleware> stages, RequestHandler terminal) {
    RequestMiddleware pipeline = compose(stages);
    return (request, response) -> pipeline.handle(request, response, terminal);
  }

  /**
   * Composes {@code stages} into a single middleware whose {@code next} is supplied per
   * request. Lets a pipeline be built once and run in front of a different terminal each time.
   */
  public static RequestMiddleware compose(List<RequestMiddleware> stages) {
    List<RequestMiddleware> ordered = List.copyOf(stages);
    return (request, response, terminal) -> dispatch(ordered, 0, request, response, terminal);
  }

  private static void dispatch(List<RequestMiddleware> stages,
                               int index,
                               HttpServletRequest request,
                               HttpServletResponse response,
                               RequestHandler terminal)
      throws IOException, ServletException {
    if (index == stages.size()) {
      terminal.handle(request, response);
      return;
    }
    stages.get(index).handle(request, response,
                             (req, res) -> dispatch(stages, index + 1, req, res, terminal));
  }
}
