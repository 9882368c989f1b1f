package io.b2mash.b2b.tenantcore.security;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts the tenant identifier from an access token.
 *
 * <p>The identity provider puts the tenant's id in {@code tenant_id}; older tokens carry only the
 * slug in {@code tenant_slug}.
 */
public final class TenantClaims {

  public static final String TENANT_ID_CLAIM = "tenant_id";
  public static final String TENANT_SLUG_CLAIM = "tenant_slug";

  /** Returns the tenant id or slug from the token, or null if neither claim is present. */
  public static String extractTenantIdentifier(Jwt jwt) {
    String tenantId = stringClaim(jwt, TENANT_ID_CLAIM);
    return tenantId != null ? tenantId : stringClaim(jwt, TENANT_SLUG_CLAIM);
  }

  private static String stringClaim(Jwt jwt, String name) {
    Object value = jwt.getClaim(name);
    if (value instanceof String str && !str.isBlank()) {
      return str;
    }
    return null;
  }

  private TenantClaims() {}
}
