package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;

/**
 * A tenant's schema could not be brought up to date. {@link #getVersion()} is the migration that
 * failed, or {@code null} when the schema's history itself was rejected.
 */
public class MigrationApplyException extends RuntimeException {

  private final TenantContext tenant;
  private final String version;

  public MigrationApplyException(
      TenantContext tenant, String version, String message, Throwable cause) {
    super(message, cause);
    this.tenant = tenant;
    this.version = version;
  }

  public TenantContext getTenant() {
    return tenant;
  }

  public String getVersion() {
    return version;
  }
}
