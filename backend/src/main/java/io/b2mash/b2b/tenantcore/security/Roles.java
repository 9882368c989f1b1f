package io.b2mash.b2b.tenantcore.security;

/** Spring Security authorities granted by this service's authentication filters. */
public final class Roles {

  /** Operator and service-to-service calls authenticated with the internal API key. */
  public static final String AUTHORITY_INTERNAL = "ROLE_INTERNAL_SERVICE";

  public static final String INTERNAL = "INTERNAL_SERVICE";

  private Roles() {}
}
