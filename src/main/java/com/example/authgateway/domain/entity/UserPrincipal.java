package com.example.authgateway.domain.entity;

import java.util.Set;

/**
 * Verified identity resolved for one request.
 */
public record UserPrincipal(
    String userId,
    String email,
    Role role,
    Set<Capability> capabilities
) {

  public static UserPrincipal of(String userId, String email, Role role) {
    return new UserPrincipal(userId, email, role, role.capabilities());
  }

  public boolean hasCapability(Capability capability) {
    return capabilities.contains(capability);
  }
}
