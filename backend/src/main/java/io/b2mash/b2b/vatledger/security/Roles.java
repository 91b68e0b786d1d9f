package io.b2mash.b2b.vatledger.security;

/**
 * Centralized role constants used across authentication and method security.
 *
 * <p>Org roles come from the JWT {@code o.rol} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // Org-level roles ("o.rol" values)
  public static final String ORG_OWNER = "owner";
  public static final String ORG_ADMIN = "admin";
  public static final String ORG_MEMBER = "member";

  // Spring Security granted authorities
  public static final String AUTHORITY_ORG_OWNER = "ROLE_ORG_OWNER";
  public static final String AUTHORITY_ORG_ADMIN = "ROLE_ORG_ADMIN";
  public static final String AUTHORITY_ORG_MEMBER = "ROLE_ORG_MEMBER";

  private Roles() {}
}
