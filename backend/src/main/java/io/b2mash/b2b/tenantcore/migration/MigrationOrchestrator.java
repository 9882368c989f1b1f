package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.migration.MigrationStatus.SharedSchemaStatus;
import io.b2mash.b2b.tenantcore.migration.MigrationStatus.TenantSchemaStatus;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDirectory;
import io.b2mash.b2b.tenantcore.multitenancy.TenantScope;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Keeps every eligible tenant schema in step with a {@link MigrationSet}. Tenants are processed
 * independently: one tenant's failure is recorded in the report and never stops the others.
 * Nothing is retried automatically; re-running the batch is the retry.
 */
@Service
public class MigrationOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

  private final TenantDirectory tenantDirectory;
  private final SchemaRouter schemaRouter;
  private final TenantMigrator tenantMigrator;
  private final TenantBatchExecutor batchExecutor;
  private final Flyway globalFlyway;
  private final Set<BatchCancellation> activeRuns = ConcurrentHashMap.newKeySet();

  public MigrationOrchestrator(
      TenantDirectory tenantDirectory,
      @Qualifier("migrationSchemaRouter") SchemaRouter schemaRouter,
      TenantMigrator tenantMigrator,
      TenantBatchExecutor batchExecutor,
      Flyway globalFlyway) {
    this.tenantDirectory = tenantDirectory;
    this.schemaRouter = schemaRouter;
    this.tenantMigrator = tenantMigrator;
    this.batchExecutor = batchExecutor;
    this.globalFlyway = globalFlyway;
  }

  public BatchReport runAll(MigrationSet migrationSet) {
    return runAll(migrationSet, BatchCancellation.create());
  }

  public BatchReport runAll(MigrationSet migrationSet, BatchCancellation cancellation) {
    List<TenantDescriptor> tenants = tenantDirectory.listEligibleTenants();
    if (tenants.isEmpty()) {
      log.info("No eligible tenants found, skipping tenant migrations");
      return BatchReport.empty();
    }

    log.info(
        "Running tenant migrations from {} for {} tenants (parallelism {})",
        migrationSet,
        tenants.size(),
        batchExecutor.getParallelism());
    activeRuns.add(cancellation);
    try {
      var outcome =
          batchExecutor.run(
              "tenant-migration",
              tenants,
              tenant -> migrateSchema(tenant, migrationSet),
              cancellation);
      var report = BatchReport.from(outcome);
      log.info(
          "Tenant migration batch completed: {} succeeded, {} failed, {} skipped, {} migrations"
              + " applied",
          report.succeeded().size(),
          report.failed().size(),
          report.skipped().size(),
          report.totalMigrationsApplied());
      return report;
    } finally {
      activeRuns.remove(cancellation);
    }
  }

  /** Runs the per-tenant algorithm for one tenant, bound to the caller's thread. */
  public TenantMigrationResult migrateTenant(UUID tenantId, MigrationSet migrationSet) {
    TenantContext tenant = tenantDirectory.findById(tenantId).toContext();
    log.info("Migrating single tenant {} (schema {})", tenant.slug(), tenant.schemaName());
    return TenantScope.callWith(tenant, () -> migrateSchema(tenant, migrationSet));
  }

  /**
   * Creates the tenant's schema if needed and applies pending migrations on one routed session.
   * The caller owns the unit of work.
   */
  public TenantMigrationResult migrateSchema(TenantContext tenant, MigrationSet migrationSet) {
    schemaRouter.ensureSchema(tenant.schemaName());
    try (SchemaSession session = schemaRouter.openSession(tenant)) {
      return tenantMigrator.migrate(session, migrationSet);
    }
  }

  /** Signals every running batch to stop launching tenants. Returns how many were signalled. */
  public int cancelRunning() {
    int signalled = 0;
    for (BatchCancellation cancellation : activeRuns) {
      cancellation.cancel();
      signalled++;
    }
    if (signalled > 0) {
      log.warn("Cancellation requested for {} running migration batches", signalled);
    }
    return signalled;
  }

  public MigrationStatus status(MigrationSet migrationSet) {
    List<TenantSchemaStatus> tenants = new ArrayList<>();
    for (TenantDescriptor tenant : tenantDirectory.listAll()) {
      tenants.add(tenantStatus(tenant, migrationSet));
    }
    return new MigrationStatus(
        sharedSchemaStatus(), migrationSet.locations(), List.copyOf(tenants));
  }

  private TenantSchemaStatus tenantStatus(TenantDescriptor tenant, MigrationSet migrationSet) {
    try {
      if (!schemaRouter.schemaExists(tenant.schemaName())) {
        try (SchemaSession session = schemaRouter.openSharedSession()) {
          TenantMigrationState state =
              tenantMigrator.inspect(session, tenant.schemaName(), migrationSet);
          return new TenantSchemaStatus(
              tenant.id(),
              tenant.slug(),
              tenant.schemaName().value(),
              tenant.status(),
              false,
              List.of(),
              state.pending(),
              null);
        }
      }
      try (SchemaSession session = schemaRouter.openSession(tenant.toContext())) {
        TenantMigrationState state = tenantMigrator.inspect(session, migrationSet);
        return new TenantSchemaStatus(
            tenant.id(),
            tenant.slug(),
            tenant.schemaName().value(),
            tenant.status(),
            true,
            state.applied(),
            state.pending(),
            null);
      }
    } catch (RuntimeException e) {
      log.warn("Unable to read migration state of schema {}", tenant.schemaName(), e);
      return new TenantSchemaStatus(
          tenant.id(),
          tenant.slug(),
          tenant.schemaName().value(),
          tenant.status(),
          false,
          List.of(),
          List.of(),
          e.getMessage());
    }
  }

  private SharedSchemaStatus sharedSchemaStatus() {
    MigrationInfoService info = globalFlyway.info();
    return new SharedSchemaStatus(describe(info.applied()), describe(info.pending()));
  }

  private static List<String> describe(MigrationInfo[] migrations) {
    return Arrays.stream(migrations)
        .map(
            migration ->
                (migration.getVersion() != null ? migration.getVersion().getVersion() : "R")
                    + " "
                    + migration.getDescription())
        .toList();
  }
}
