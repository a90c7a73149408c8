package com.example.authgateway.security.filter;

import com.example.authgateway.exception.GatewayException;
import com.example.authgateway.security.middleware.EndpointPreset;
import com.example.authgateway.security.middleware.MiddlewareComposer;
import com.example.authgateway.security.middleware.RequestMiddleware;
import com.example.authgateway.web.rest.errors.ErrorResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Runs one preset's middleware pipeline inside a security filter chain. The rest of the
 * servlet chain is the pipeline's terminal handler, so controllers only run once every
 * stage has passed.
 * <p>
 * Not a Spring bean: each instance belongs to exactly one security filter chain and must
 * not be picked up as a container-wide servlet filter.
 */
@Slf4j
public class MiddlewarePipelineFilter extends OncePerRequestFilter {

  private final EndpointPreset preset;
  private final RequestMiddleware pipeline;
  private final ErrorResponseWriter errorResponseWriter;

  public MiddlewarePipelineFilter(EndpointPreset preset,
                                  List<RequestMiddleware> stages,
                                  ErrorResponseWriter errorResponseWriter) {
    this.preset = preset;
    this.pipeline = MiddlewareComposer.compose(stages);
    this.errorResponseWriter = errorResponseWriter;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain
                                 ) throws ServletException, IOException {
    try {
      pipeline.handle(request, response, filterChain::doFilter);
    } catch (GatewayException e) {
      if (response.isCommitted()) {
        log.error("{} pipeline failed after the response was committed", preset, e);
        return;
      }
      log.debug("{} pipeline rejected {} {}: {}", preset, request.getMethod(),
                request.getRequestURI(), e.getErrorCode());
      errorResponseWriter.write(response, e);
    }
  }

  public EndpointPreset getPreset() {
    return preset;
  }
}
