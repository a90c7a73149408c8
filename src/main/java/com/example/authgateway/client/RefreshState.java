package com.example.authgateway.client;

/**
 * Refresh coordinator states. {@code LOGGED_OUT} is left only by a new login.
 */
public enum RefreshState {
  IDLE,
  REFRESHING,
  LOGGED_OUT
}
