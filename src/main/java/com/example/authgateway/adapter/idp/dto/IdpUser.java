package com.example.authgateway.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * User object returned by the identity provider
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdpUser(
    @JsonProperty("id")
    String id,
    @JsonProperty("email")
    String email,
    @JsonProperty("user_metadata")
    Map<String, Object> userMetadata,
    @JsonProperty("created_at")
    Instant createdAt,
    @JsonProperty("updated_at")
    Instant updatedAt
) {

  public String fullName() {
    Object fullName = userMetadata != null ? userMetadata.get("full_name") : null;
    return fullName instanceof String name && !name.isBlank() ? name : email;
  }
}
