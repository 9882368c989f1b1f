package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;

public class PatchApplyException extends RuntimeException {

  private final String patchId;
  private final TenantContext tenant;

  public PatchApplyException(String patchId, TenantContext tenant, Throwable cause) {
    super(
        "Patch "
            + patchId
            + " failed for schema "
            + tenant.schemaName()
            + ": "
            + cause.getMessage(),
        cause);
    this.patchId = patchId;
    this.tenant = tenant;
  }

  public String getPatchId() {
    return patchId;
  }

  public TenantContext getTenant() {
    return tenant;
  }
}
