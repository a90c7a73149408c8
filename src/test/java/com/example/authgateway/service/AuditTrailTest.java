package com.example.authgateway.service;

import com.example.authgateway.MutableClock;
import com.example.authgateway.adapter.datastore.AdministrativeOperation;
import com.example.authgateway.adapter.datastore.DataClient;
import com.example.authgateway.domain.entity.AuditEntry;
import com.example.authgateway.domain.entity.AuthenticatedSession;
import com.example.authgateway.domain.entity.Role;
import com.example.authgateway.domain.entity.UserPrincipal;
import com.example.authgateway.exception.ForbiddenException;
import com.example.authgateway.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuditTrail")
class AuditTrailTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock
  private AuthorizedDataClientFactory dataClientFactory;

  @Mock
  private DataClient userClient;

  @Mock
  private DataClient serviceClient;

  private AuditTrail auditTrail;
  private AuthenticatedSession session;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    auditTrail = new AuditTrail(dataClientFactory, new MutableClock(NOW));
    session = new AuthenticatedSession(UserPrincipal.of("admin-0001-xyz", "a@example.com", Role.ADMIN), "jwt");
    request = new MockHttpServletRequest("POST", "/admin/verify");
    request.setRemoteAddr("198.51.100.4");
    request.addHeader("User-Agent", "JUnit");
  }

  @Test
  @DisplayName("writes the access decision with the actor's own client")
  void recordsWithUserClient() {
    when(dataClientFactory.forRequest(session)).thenReturn(userClient);

    AuditEntry entry = auditTrail.recordAdminAccess(request, session, Role.ADMIN, true);

    ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
    verify(userClient).insert(eq(AuditTrail.AUDIT_TABLE), captor.capture());
    AuditEntry written = captor.getValue();
    assertThat(written).isEqualTo(entry);
    assertThat(written.action()).isEqualTo(AuditEntry.ADMIN_ACCESS_GRANTED);
    assertThat(written.actorId()).isEqualTo("admin-0001-xyz");
    assertThat(written.resource()).isEqualTo("/admin/verify");
    assertThat(written.timestamp()).isEqualTo(NOW);
    assertThat(written.ipAddress()).isEqualTo("198.51.100.4");
    assertThat(written.userAgent()).isEqualTo("JUnit");
    assertThat(written.metadata()).containsEntry("method", "POST").containsEntry("requiredRole", "admin");
  }

  @Test
  @DisplayName("records denials as their own action")
  void recordsDenial() {
    when(dataClientFactory.forRequest(session)).thenReturn(userClient);

    AuditEntry entry = auditTrail.recordAdminAccess(request, session, Role.SUPER_ADMIN, false);

    assertThat(entry.action()).isEqualTo(AuditEntry.ADMIN_ACCESS_DENIED);
  }

  @Test
  @DisplayName("turns a failed write into upstream unavailable")
  void failedWrite() {
    when(dataClientFactory.forRequest(session)).thenReturn(userClient);
    doThrow(new ForbiddenException("Datastore denied access")).when(userClient).insert(any(), any());

    assertThatThrownBy(() -> auditTrail.recordAdminAccess(request, session, Role.ADMIN, true))
        .isInstanceOf(UpstreamUnavailableException.class)
        .hasMessage("Audit log unavailable");
  }

  @Test
  @DisplayName("exports with the service client and records the export")
  void export() {
    AuditEntry row = new AuditEntry("u", AuditEntry.ADMIN_ACCESS_GRANTED, "/admin/verify", true, NOW,
                                    "ip", "ua", Map.of());
    when(dataClientFactory.forAdministrativeOperation(AdministrativeOperation.AUDIT_EXPORT)).thenReturn(serviceClient);
    when(serviceClient.select(AuditTrail.AUDIT_TABLE, Map.of(), "timestamp.desc", 1000, AuditEntry.class))
        .thenReturn(List.of(row));
    when(dataClientFactory.forRequest(session)).thenReturn(userClient);

    List<AuditEntry> entries = auditTrail.export(session, request, 5000);

    assertThat(entries).containsExactly(row);
    ArgumentCaptor<AuditEntry> captor = ArgumentCaptor.forClass(AuditEntry.class);
    verify(userClient).insert(eq(AuditTrail.AUDIT_TABLE), captor.capture());
    assertThat(captor.getValue().action()).isEqualTo(AuditEntry.AUDIT_EXPORTED);
    assertThat(captor.getValue().metadata()).containsEntry("rows", 1);
  }
}
