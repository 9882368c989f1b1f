package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDirectory;
import io.b2mash.b2b.tenantcore.multitenancy.TenantScope;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Applies registered {@link SchemaPatch}es. Each patch is checked and applied inside one
 * transaction, so re-running a patch reports {@link PatchStatus#ALREADY_APPLIED} and changes
 * nothing.
 */
@Service
public class SchemaPatchApplier {

  private static final Logger log = LoggerFactory.getLogger(SchemaPatchApplier.class);

  private final TenantDirectory tenantDirectory;
  private final SchemaRouter schemaRouter;
  private final TenantBatchExecutor batchExecutor;
  private final Map<String, SchemaPatch> patches = new LinkedHashMap<>();

  public SchemaPatchApplier(
      TenantDirectory tenantDirectory,
      @Qualifier("migrationSchemaRouter") SchemaRouter schemaRouter,
      TenantBatchExecutor batchExecutor,
      List<SchemaPatch> patches) {
    this.tenantDirectory = tenantDirectory;
    this.schemaRouter = schemaRouter;
    this.batchExecutor = batchExecutor;
    for (SchemaPatch patch : patches) {
      if (this.patches.putIfAbsent(patch.id(), patch) != null) {
        throw new IllegalArgumentException("Duplicate schema patch id: " + patch.id());
      }
    }
  }

  public Collection<SchemaPatch> registeredPatches() {
    return patches.values();
  }

  /**
   * Applies one patch to one tenant. Failures are returned as {@link PatchStatus#FAILED}.
   *
   * @throws IllegalArgumentException if no patch is registered under {@code patchId}
   */
  public PatchResult applyPatch(String patchId, UUID tenantId) {
    SchemaPatch patch = requirePatch(patchId);
    TenantContext tenant = tenantDirectory.findById(tenantId).toContext();
    return TenantScope.callWith(tenant, () -> applyToTenant(patch, tenant));
  }

  public PatchBatchReport applyAll() {
    return applyAll(BatchCancellation.create());
  }

  /** Applies every registered patch to every eligible tenant. Safe to re-run. */
  public PatchBatchReport applyAll(BatchCancellation cancellation) {
    List<TenantDescriptor> tenants = tenantDirectory.listEligibleTenants();
    if (patches.isEmpty() || tenants.isEmpty()) {
      log.info(
          "No schema patches to apply ({} patches, {} tenants)", patches.size(), tenants.size());
      return PatchBatchReport.empty();
    }

    log.info("Applying {} schema patches to {} tenants", patches.size(), tenants.size());
    var outcome =
        batchExecutor.run(
            "schema-patch",
            tenants,
            tenant -> {
              List<PatchResult> results = new ArrayList<>();
              for (SchemaPatch patch : patches.values()) {
                results.add(applyToTenant(patch, tenant));
              }
              return results;
            },
            cancellation);
    var report = PatchBatchReport.from(outcome);
    log.info(
        "Schema patch run completed: {} applied, {} already applied, {} failed, {} skipped tenants",
        report.count(PatchStatus.APPLIED),
        report.count(PatchStatus.ALREADY_APPLIED),
        report.count(PatchStatus.FAILED),
        report.skipped().size());
    return report;
  }

  PatchResult applyToTenant(SchemaPatch patch, TenantContext tenant) {
    try (SchemaSession session = schemaRouter.openSession(tenant)) {
      boolean applied =
          session.inTransaction(
              tx -> {
                if (patch.isApplied(tx)) {
                  return false;
                }
                patch.apply(tx);
                return true;
              });
      if (applied) {
        log.info("Applied patch {} to schema {}", patch.id(), tenant.schemaName());
        return PatchResult.applied(patch.id(), tenant);
      }
      log.debug("Patch {} already present in schema {}", patch.id(), tenant.schemaName());
      return PatchResult.alreadyApplied(patch.id(), tenant);
    } catch (RuntimeException e) {
      var error = new PatchApplyException(patch.id(), tenant, e);
      log.warn("Patch {} failed for schema {}", patch.id(), tenant.schemaName(), e);
      return PatchResult.failed(patch.id(), tenant, error);
    }
  }

  private SchemaPatch requirePatch(String patchId) {
    SchemaPatch patch = patches.get(patchId);
    if (patch == null) {
      throw new IllegalArgumentException("Unknown schema patch: " + patchId);
    }
    return patch;
  }
}
