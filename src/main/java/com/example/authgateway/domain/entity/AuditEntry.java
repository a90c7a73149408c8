package com.example.authgateway.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable record of a privileged action. Mirrors a row of {@code admin_audit_log};
 * application code only ever appends.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditEntry(
    @JsonProperty("user_id") String actorId,
    String action,
    String resource,
    @JsonProperty("is_admin") boolean admin,
    Instant timestamp,
    @JsonProperty("ip_address") String ipAddress,
    @JsonProperty("user_agent") String userAgent,
    Map<String, Object> metadata
) {

  public static final String ADMIN_ACCESS_GRANTED = "ADMIN_ACCESS_GRANTED";
  public static final String ADMIN_ACCESS_DENIED = "ADMIN_ACCESS_DENIED";
  public static final String AUDIT_EXPORTED = "AUDIT_EXPORTED";
}
