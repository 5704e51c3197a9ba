package com.scholary.speech.gateway.access;

import java.util.Locale;

/** Caller role as asserted by the authentication layer. */
public enum Role {
  ADMIN,
  SUPER_USER,
  NORMAL_USER;

  /** Admins and super users bypass entitlement and quota checks. */
  public boolean isPrivileged() {
    return this != NORMAL_USER;
  }

  /**
   * Parse a role header value such as {@code admin}, {@code super_user} or {@code super-user}.
   * Anything unrecognized, including null, is treated as a normal user.
   */
  public static Role fromHeader(String value) {
    if (value == null || value.isBlank()) {
      return NORMAL_USER;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (Role role : values()) {
      if (role.name().equals(normalized)) {
        return role;
      }
    }
    return NORMAL_USER;
  }
}
