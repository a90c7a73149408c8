package com.example.authgateway.domain.entity;

/**
 * Capability tags granted by a {@link Role}. Serialized in lower snake case.
 */
public enum Capability {
  VIEW_ALL_USERS,
  VIEW_ALL_PROJECTS,
  UPDATE_USER_STATUS,
  VIEW_PLATFORM_STATS,
  UPDATE_USER_ROLES,
  DELETE_ANY_PROJECT,
  SYSTEM_ADMINISTRATION;

  public String tag() {
    return name().toLowerCase();
  }
}
