package com.example.authgateway.domain.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Row of the {@code user_profiles} table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
    String id,
    String email,
    String role,
    @JsonProperty("full_name") String fullName,
    @JsonProperty("avatar_url") String avatarUrl,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

  public Role resolvedRole() {
    return Role.fromStoredValue(role);
  }
}
