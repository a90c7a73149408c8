package com.example.authgateway.domain.entity;

/**
 * The principal of a request together with the access token it was verified from.
 * The token is what scopes downstream data access to this user; it never leaves
 * the server in a response body.
 */
public record AuthenticatedSession(
    UserPrincipal principal,
    String accessToken
) {

  @Override
  public String toString() {
    return "AuthenticatedSession[userId=" + (principal != null ? principal.userId() : null) + "]";
  }
}
