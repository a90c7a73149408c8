package com.example.authgateway.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Token response of the password and refresh-token grants
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IdpSession(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("expires_in")
    Long expiresIn,
    @JsonProperty("expires_at")
    Long expiresAt,
    @JsonProperty("user")
    IdpUser user
) {

  public boolean hasTokens() {
    return accessToken != null && !accessToken.isBlank()
        && refreshToken != null && !refreshToken.isBlank();
  }

  /**
   * Access-token expiry, from {@code expires_at} (epoch seconds) or else {@code now + expires_in}.
   */
  public Instant expiry(Instant now) {
    if (expiresAt != null) {
      return Instant.ofEpochSecond(expiresAt);
    }
    return now.plusSeconds(expiresIn != null ? expiresIn : 3600);
  }

  @Override
  public String toString() {
    return "IdpSession[userId=" + (user != null ? user.id() : null) + ", expiresAt=" + expiresAt + "]";
  }
}
