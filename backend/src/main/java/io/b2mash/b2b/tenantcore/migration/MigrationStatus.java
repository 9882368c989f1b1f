package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.TenantStatus;
import java.util.List;
import java.util.UUID;

/** Point-in-time view of the shared schema and every tenant schema against the known migrations. */
public record MigrationStatus(
    SharedSchemaStatus sharedSchema,
    List<String> locations,
    List<TenantSchemaStatus> tenants) {

  public record SharedSchemaStatus(List<String> applied, List<String> pending) {}

  public record TenantSchemaStatus(
      UUID tenantId,
      String slug,
      String schemaName,
      TenantStatus status,
      boolean schemaPresent,
      List<String> applied,
      List<String> pending,
      String error) {}

  public long tenantsWithPendingMigrations() {
    return tenants.stream().filter(tenant -> !tenant.pending().isEmpty()).count();
  }
}
