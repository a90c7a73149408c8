package com.example.authgateway.domain.entity;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Closed set of platform roles, ordered by privilege.
 * <p>
 * The capability table is static; a principal's role is always re-read from the
 * profile store and never taken from request input.
 */
public enum Role {

  USER("user", EnumSet.noneOf(Capability.class)),
  ADMIN("admin", EnumSet.of(
      Capability.VIEW_ALL_USERS,
      Capability.VIEW_ALL_PROJECTS,
      Capability.UPDATE_USER_STATUS,
      Capability.VIEW_PLATFORM_STATS)),
  SUPER_ADMIN("super_admin", EnumSet.allOf(Capability.class));

  private final String value;
  private final Set<Capability> capabilities;

  Role(String value, Set<Capability> capabilities) {
    this.value = value;
    this.capabilities = Collections.unmodifiableSet(capabilities);
  }

  /** The value stored in the profile table (e.g. "super_admin"). */
  public String value() {
    return value;
  }

  public Set<Capability> capabilities() {
    return capabilities;
  }

  /**
   * Whether this role meets a required role. Higher roles satisfy lower ones.
   */
  public boolean satisfies(Role required) {
    return this.ordinal() >= required.ordinal();
  }

  public boolean isAdmin() {
    return satisfies(ADMIN);
  }

  /**
   * Maps a stored role string to a role. Unknown, blank or missing values map to
   * {@link #USER}, so a corrupt row can never widen access.
   */
  public static Role fromStoredValue(String value) {
    if (value == null) {
      return USER;
    }
    for (Role role : values()) {
      if (role.value.equalsIgnoreCase(value.trim())) {
        return role;
      }
    }
    return USER;
  }
}
