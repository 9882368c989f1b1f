package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import java.util.List;
import java.util.UUID;

/** Outcome of bringing one tenant schema up to date. */
public record TenantMigrationResult(
    UUID tenantId,
    String slug,
    SchemaName schemaName,
    List<String> previouslyApplied,
    List<String> newlyApplied) {

  static TenantMigrationResult of(
      TenantContext tenant, List<String> previouslyApplied, List<String> newlyApplied) {
    return new TenantMigrationResult(
        tenant.tenantId(),
        tenant.slug(),
        tenant.schemaName(),
        List.copyOf(previouslyApplied),
        List.copyOf(newlyApplied));
  }

  public boolean alreadyUpToDate() {
    return newlyApplied.isEmpty();
  }
}
