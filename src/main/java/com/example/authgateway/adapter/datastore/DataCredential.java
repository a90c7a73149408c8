package com.example.authgateway.adapter.datastore;

/**
 * Bearer credential a {@link DataClient} presents to the datastore.
 */
public record DataCredential(Kind kind, String subject, String bearerToken) {

  public enum Kind {
    /** The user's own access token; row-level security applies. */
    USER,
    /** Service key; row-level security is bypassed. */
    SERVICE
  }

  public static DataCredential user(String userId, String accessToken) {
    return new DataCredential(Kind.USER, userId, accessToken);
  }

  public static DataCredential service(AdministrativeOperation operation, String serviceKey) {
    return new DataCredential(Kind.SERVICE, operation.name(), serviceKey);
  }

  @Override
  public String toString() {
    return "DataCredential[kind=" + kind + ", subject=" + subject + "]";
  }
}
