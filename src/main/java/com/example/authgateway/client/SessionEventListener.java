package com.example.authgateway.client;

import com.example.authgateway.exception.RefreshFailedException;

import java.time.Instant;

/**
 * Callbacks for session changes the application did not initiate itself.
 */
public interface SessionEventListener {

  /**
   * The session could not be refreshed and has been discarded. Typically the application
   * navigates to its login screen.
   */
  void onLoggedOut(RefreshFailedException cause);

  default void onRefreshed(Instant accessTokenExpiresAt) {
  }

  SessionEventListener NO_OP = cause -> {
  };
}
