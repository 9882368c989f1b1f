package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import java.util.List;
import java.util.UUID;

public record ProvisioningResult(
    UUID tenantId,
    SchemaName schemaName,
    ProvisioningStep initialState,
    ProvisioningStep state,
    List<String> migrationsApplied) {

  public boolean alreadyProvisioned() {
    return initialState == ProvisioningStep.READY;
  }
}
