package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor.BatchOutcome;
import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor.TenantOutcome;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/** Summary of a migration batch across tenants. */
public record BatchReport(
    List<TenantMigrationResult> succeeded, List<TenantFailure> failed, List<UUID> skipped) {

  public static BatchReport empty() {
    return new BatchReport(List.of(), List.of(), List.of());
  }

  static BatchReport from(BatchOutcome<TenantMigrationResult> outcome) {
    List<TenantMigrationResult> succeeded = new ArrayList<>();
    List<TenantFailure> failed = new ArrayList<>();
    for (TenantOutcome<TenantMigrationResult> tenantOutcome : outcome.outcomes()) {
      if (tenantOutcome.succeeded()) {
        succeeded.add(tenantOutcome.result());
      } else {
        failed.add(TenantFailure.of(tenantOutcome.tenant(), tenantOutcome.error()));
      }
    }
    List<UUID> skipped = outcome.skipped().stream().map(TenantDescriptor::id).toList();
    return new BatchReport(List.copyOf(succeeded), List.copyOf(failed), skipped);
  }

  public List<UUID> succeededTenantIds() {
    return succeeded.stream().map(TenantMigrationResult::tenantId).toList();
  }

  public List<UUID> failedTenantIds() {
    return failed.stream().map(TenantFailure::tenantId).toList();
  }

  public int totalMigrationsApplied() {
    return succeeded.stream().mapToInt(result -> result.newlyApplied().size()).sum();
  }

  public boolean isFullySuccessful() {
    return failed.isEmpty() && skipped.isEmpty();
  }
}
