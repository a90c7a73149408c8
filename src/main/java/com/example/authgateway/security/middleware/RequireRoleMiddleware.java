package com.example.authgateway.security.middleware;

import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.example.authgateway.security.SessionAuthenticator;
import com.example.authgateway.service.AuditTrail;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Role gate for privileged pipelines. Must run after {@link AuthenticationMiddleware}.
 * <p>
 * Every decision is audited before the handler runs. A grant whose audit entry cannot be
 * written is turned into 503; a denial stays a 403 even when its audit entry fails.
 */
@Slf4j
public class RequireRoleMiddleware implements RequestMiddleware {

  private final SessionAuthenticator authenticator;
  private final AuditTrail auditTrail;
  private final Role requiredRole;

  public RequireRoleMiddleware(SessionAuthenticator authenticator, AuditTrail auditTrail, Role requiredRole) {
    this.authenticator = authenticator;
    this.auditTrail = auditTrail;
    this.requiredRole = requiredRole;
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response, RequestHandler next)
      throws IOException, ServletException {
    AuthenticatedSession session = SessionAuthenticator.currentSession(request)
        .orElseThrow(() -> new UnauthenticatedException("Authentication required"));

    try {
      authenticator.requireRole(session, requiredRole);
    } catch (ForbiddenException denied) {
      log.warn("Denied {} access to {} for {}", requiredRole, request.getRequestURI(),
               maskIdentifier(session.principal().userId()));
      try {
        auditTrail.recordAdminAccess(request, session, requiredRole, false);
      } catch (UpstreamUnavailableException auditFailure) {
        denied.addSuppressed(auditFailure);
      }
      throw denied;
    }

    auditTrail.recordAdminAccess(request, session, requiredRole, true);
    next.handle(request, response);
  }

  public Role requiredRole() {
    return requiredRole;
  }
}
