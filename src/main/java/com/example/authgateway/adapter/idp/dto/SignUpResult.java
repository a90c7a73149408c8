package com.example.authgateway.adapter.idp.dto;

/**
 * Outcome of account creation. {@code session} is null when the provider requires the
 * e-mail address to be confirmed before the first login.
 */
public record SignUpResult(IdpUser user, IdpSession session) {

  public boolean requiresEmailConfirmation() {
    return session == null || !session.hasTokens();
  }
}
