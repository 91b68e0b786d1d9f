package io.b2mash.b2b.vatledger.security;

import java.util.Map;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts the org role from the nested "o" object of the access token.
 *
 * <p>Format: {@code { "o": { "id": "org_xxx", "rol": "owner" } }}
 */
public final class OrgClaims {

  private static final String ORG_CLAIM = "o";

  public static String extractOrgRole(Jwt jwt) {
    return extractNestedClaim(jwt, "rol");
  }

  private static String extractNestedClaim(Jwt jwt, String key) {
    Object orgClaim = jwt.getClaim(ORG_CLAIM);
    if (orgClaim instanceof Map<?, ?> map) {
      Object value = map.get(key);
      if (value instanceof String str) {
        return str;
      }
    }
    return null;
  }

  private OrgClaims() {}
}
