package com.example.authgateway.domain.entity;

/**
 * Deployment profile. Selects strict or lenient rate limits and whether
 * cookies carry the Secure attribute.
 */
public enum EnvironmentProfile {
  //Local and shared development environments.
  DEVELOPMENT,
  //Anything reachable by real users.
  PRODUCTION
}
