package io.b2mash.b2b.vatledger.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/** Resolves the authenticated caller's identity from the security context. */
public final class CurrentActor {

  private CurrentActor() {}

  /** Returns the JWT subject of the current caller, or {@code null} outside an authenticated call. */
  public static String subject() {
    Authentication auth = SecurityContextHolder.getContext().getAuthentication();
    if (auth instanceof JwtAuthenticationToken jwtAuth) {
      return jwtAuth.getToken().getSubject();
    }
    return null;
  }
}
