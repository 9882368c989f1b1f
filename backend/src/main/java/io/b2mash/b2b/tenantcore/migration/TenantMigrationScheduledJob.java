package io.b2mash.b2b.tenantcore.migration;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic catch-up run on {@code tenancy.migration.cron}. Disabled unless a cron expression is
 * configured. A run still in progress causes the next trigger to be skipped.
 */
@Component
public class TenantMigrationScheduledJob {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrationScheduledJob.class);

  private final MigrationOrchestrator migrationOrchestrator;
  private final SchemaPatchApplier schemaPatchApplier;
  private final MigrationSet tenantMigrationSet;
  private final AtomicBoolean running = new AtomicBoolean();

  public TenantMigrationScheduledJob(
      MigrationOrchestrator migrationOrchestrator,
      SchemaPatchApplier schemaPatchApplier,
      MigrationSet tenantMigrationSet) {
    this.migrationOrchestrator = migrationOrchestrator;
    this.schemaPatchApplier = schemaPatchApplier;
    this.tenantMigrationSet = tenantMigrationSet;
  }

  @Scheduled(cron = "${tenancy.migration.cron:-}")
  public void migrateTenants() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Scheduled tenant migration skipped, previous run still in progress");
      return;
    }
    try {
      log.info("Scheduled tenant migration started");
      var report = migrationOrchestrator.runAll(tenantMigrationSet);
      var patchReport = schemaPatchApplier.applyAll();
      log.info(
          "Scheduled tenant migration completed: {} tenants failed migrations, {} failed patches",
          report.failed().size(),
          patchReport.failedTenantIds().size());
    } finally {
      running.set(false);
    }
  }
}
