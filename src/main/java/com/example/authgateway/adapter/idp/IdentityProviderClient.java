package com.example.authgateway.adapter.idp;

import com.example.authgateway.adapter.idp.dto.IdpSession;
import com.example.authgateway.adapter.idp.dto.IdpUser;
import com.example.authgateway.adapter.idp.dto.SignUpResult;

/**
 * Interface for the external identity provider.
 * Handles protocol operations only; credential verification happens on the provider side.
 */
public interface IdentityProviderClient {

  /**
   * Exchanges e-mail and password for a token pair.
   */
  IdpSession signInWithPassword(String email, String password);

  SignUpResult signUp(String email, String password, String fullName);

  /**
   * Exchanges a refresh token for a rotated token pair.
   */
  IdpSession refreshSession(String refreshToken);

  /**
   * Verifies an access token and returns the user it belongs to.
   */
  IdpUser getUser(String accessToken);

  /**
   * Revokes the session the access token belongs to.
   */
  void signOut(String accessToken);
}
