package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor.BatchOutcome;
import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor.TenantOutcome;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/** Per-tenant, per-patch results of one patch run across tenants. */
public record PatchBatchReport(
    List<PatchResult> results, List<TenantFailure> failed, List<UUID> skipped) {

  public static PatchBatchReport empty() {
    return new PatchBatchReport(List.of(), List.of(), List.of());
  }

  static PatchBatchReport from(BatchOutcome<List<PatchResult>> outcome) {
    List<PatchResult> results = new ArrayList<>();
    List<TenantFailure> failed = new ArrayList<>();
    for (TenantOutcome<List<PatchResult>> tenantOutcome : outcome.outcomes()) {
      if (tenantOutcome.succeeded()) {
        results.addAll(tenantOutcome.result());
      } else {
        failed.add(TenantFailure.of(tenantOutcome.tenant(), tenantOutcome.error()));
      }
    }
    List<UUID> skipped = outcome.skipped().stream().map(TenantDescriptor::id).toList();
    return new PatchBatchReport(List.copyOf(results), List.copyOf(failed), skipped);
  }

  public long count(PatchStatus status) {
    return results.stream().filter(result -> result.status() == status).count();
  }

  /** Tenants with at least one failed patch or a failure outside any single patch. */
  public Set<UUID> failedTenantIds() {
    Set<UUID> ids = new LinkedHashSet<>();
    results.stream()
        .filter(result -> result.status() == PatchStatus.FAILED)
        .forEach(result -> ids.add(result.tenantId()));
    failed.forEach(failure -> ids.add(failure.tenantId()));
    return ids;
  }
}
