package com.example.authgateway.domain.entity;

import java.time.Instant;

/**
 * The three values written as session cookies, plus the access-token expiry
 * reported back to the client.
 */
public record SessionTokens(
    String accessToken,
    String refreshToken,
    String csrfToken,
    Instant expiresAt
) {

  @Override
  public String toString() {
    return "SessionTokens[expiresAt=" + expiresAt + "]";
  }
}
