package io.b2mash.b2b.tenantcore.migration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import java.util.UUID;

public record PatchResult(
    String patchId,
    UUID tenantId,
    String schemaName,
    PatchStatus status,
    String message,
    @JsonIgnore PatchApplyException error) {

  static PatchResult applied(String patchId, TenantContext tenant) {
    return new PatchResult(
        patchId, tenant.tenantId(), tenant.schemaName().value(), PatchStatus.APPLIED, null, null);
  }

  static PatchResult alreadyApplied(String patchId, TenantContext tenant) {
    return new PatchResult(
        patchId,
        tenant.tenantId(),
        tenant.schemaName().value(),
        PatchStatus.ALREADY_APPLIED,
        null,
        null);
  }

  static PatchResult failed(String patchId, TenantContext tenant, PatchApplyException error) {
    return new PatchResult(
        patchId,
        tenant.tenantId(),
        tenant.schemaName().value(),
        PatchStatus.FAILED,
        error.getMessage(),
        error);
  }
}
