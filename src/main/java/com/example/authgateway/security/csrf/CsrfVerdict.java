package com.example.authgateway.security.csrf;

/**
 * Result of verifying a request against the double-submit and origin rules.
 */
public record CsrfVerdict(boolean allowed, String reason) {

  private static final CsrfVerdict ALLOWED = new CsrfVerdict(true, null);

  public static CsrfVerdict allow() {
    return ALLOWED;
  }

  public static CsrfVerdict reject(String reason) {
    return new CsrfVerdict(false, reason);
  }
}
