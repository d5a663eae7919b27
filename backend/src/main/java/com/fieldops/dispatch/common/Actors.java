package com.fieldops.dispatch.common;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class Actors {
  public static final String SYSTEM = "system";

  private Actors() {
  }

  /** Name of the authenticated caller, or {@code system} for scheduled work. */
  public static String current() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth == null || !auth.isAuthenticated() || auth.getName() == null || auth.getName().isBlank()) {
      return SYSTEM;
    }
    return auth.getName();
  }
}
