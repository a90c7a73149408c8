package com.example.authgateway.service;

import com.example.authgateway.adapter.datastore.AdministrativeOperation;
import com.example.authgateway.adapter.datastore.DataClient;
import com.example.authgateway.domain.entity.AuditEntry;
import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.exception.GatewayException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import com.example.authgateway.util.ClientAddressUtil;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.example.authgateway.util.ClientAddressUtil.maskIdentifier;

/**
 * Append-only record of privileged access in {@code admin_audit_log}.
 * <p>
 * Entries are written with the acting user's own data client. An entry that cannot be
 * written fails the request with {@link UpstreamUnavailableException}; privileged work
 * never runs unrecorded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrail {

  public static final String AUDIT_TABLE = "admin_audit_log";
  private static final int MAX_EXPORT_ROWS = 1000;

  private final AuthorizedDataClientFactory dataClientFactory;
  private final Clock clock;

  /**
   * Records an admin-gated access decision for {@code request}.
   */
  public AuditEntry recordAdminAccess(HttpServletRequest request,
                                      AuthenticatedSession session,
                                      Role requiredRole,
                                      boolean granted) {
    UserPrincipal principal = session.principal();

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("method", request.getMethod());
    metadata.put("role", principal.role().value());
    metadata.put("requiredRole", requiredRole.value());
    metadata.put("capabilities", principal.capabilities().size());

    AuditEntry entry = new AuditEntry(
        principal.userId(),
        granted ? AuditEntry.ADMIN_ACCESS_GRANTED : AuditEntry.ADMIN_ACCESS_DENIED,
        request.getRequestURI(),
        principal.role().isAdmin(),
        clock.instant(),
        ClientAddressUtil.getClientIpAddress(request),
        request.getHeader("User-Agent"),
        metadata);

    append(dataClientFactory.forRequest(session), entry);
    return entry;
  }

  public void append(DataClient client, AuditEntry entry) {
    try {
      client.insert(AUDIT_TABLE, entry);
      log.info("Audit {} by {} on {}", entry.action(), maskIdentifier(entry.actorId()), entry.resource());
    } catch (GatewayException | IllegalStateException e) {
      log.error("Failed to write audit entry {} for {}", entry.action(), maskIdentifier(entry.actorId()), e);
      throw new UpstreamUnavailableException("Audit log unavailable", e);
    }
  }

  /**
   * Reads the most recent entries across all users with the service credential and records
   * the export itself.
   */
  public List<AuditEntry> export(AuthenticatedSession requester, HttpServletRequest request, int limit) {
    int rows = Math.max(1, Math.min(limit, MAX_EXPORT_ROWS));
    DataClient adminClient = dataClientFactory.forAdministrativeOperation(AdministrativeOperation.AUDIT_EXPORT);
    List<AuditEntry> entries = adminClient.select(AUDIT_TABLE, Map.of(), "timestamp.desc", rows, AuditEntry.class);

    AuditEntry exportEntry = new AuditEntry(
        requester.principal().userId(),
        AuditEntry.AUDIT_EXPORTED,
        request.getRequestURI(),
        true,
        clock.instant(),
        ClientAddressUtil.getClientIpAddress(request),
        request.getHeader("User-Agent"),
        Map.of("rows", entries.size()));
    append(dataClientFactory.forRequest(requester), exportEntry);

    return entries;
  }
}
