package com.example.authgateway.web.rest.controller;

import com.example.authgateway.domain.entity.AuditEntry;
import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Capability;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UnauthenticatedException;
import com.example.authgateway.security.SessionAuthenticator;
import com.example.authgateway.service.AuditTrail;
import com.example.authgateway.service.PrincipalCache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
public class AdminController implements AdminAPI {

  private final AuditTrail auditTrail;
  private final PrincipalCache principalCache;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> verify(HttpServletRequest request) {
    UserPrincipal principal = currentSession(request).principal();

    Map<String, Object> user = new LinkedHashMap<>();
    user.put("id", principal.userId());
    user.put("email", principal.email());
    user.put("role", principal.role().value());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("success", true);
    body.put("isAdmin", principal.role().isAdmin());
    body.put("isSuperAdmin", principal.role() == Role.SUPER_ADMIN);
    body.put("capabilities", principal.capabilities().stream().map(Capability::tag).sorted().toList());
    body.put("user", user);
    body.put("timestamp", clock.instant().toString());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> exportAudit(int limit, HttpServletRequest request) {
    AuthenticatedSession session = currentSession(request);
    if (!session.principal().hasCapability(Capability.SYSTEM_ADMINISTRATION)) {
      throw new ForbiddenException("System administration capability required");
    }

    List<AuditEntry> entries = auditTrail.export(session, request, limit);
    log.info("Audit export of {} entries by {}", entries.size(), maskIdentifier(session.principal().userId()));

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("entries", entries);
    body.put("count", entries.size());
    body.put("timestamp", clock.instant().toString());
    return ResponseEntity.ok(body);
  }

  @Override
  public ResponseEntity<Map<String, Object>> clearCache(HttpServletRequest request) {
    AuthenticatedSession session = currentSession(request);
    long cleared = principalCache.evictAll();
    log.info("Principal cache cleared by {}", maskIdentifier(session.principal().userId()));

    return ResponseEntity.ok(Map.of(
        "success", true,
        "cleared", cleared,
        "timestamp", clock.instant().toString()
                                   ));
  }

  private static AuthenticatedSession currentSession(HttpServletRequest request) {
    return SessionAuthenticator.currentSession(request)
        .orElseThrow(() -> new UnauthenticatedException("Authentication required"));
  }
}
