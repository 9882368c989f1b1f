package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.config.TenancyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Brings every eligible tenant schema up to date at startup, then applies the registered schema
 * patches. The shared schema has already been migrated by Flyway when this runs. Tenant failures
 * are logged and reported; they never stop the application from starting.
 */
@Component
@Order(50)
public class TenantMigrationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrationRunner.class);

  private final MigrationOrchestrator migrationOrchestrator;
  private final SchemaPatchApplier schemaPatchApplier;
  private final MigrationSet tenantMigrationSet;
  private final TenancyProperties properties;

  public TenantMigrationRunner(
      MigrationOrchestrator migrationOrchestrator,
      SchemaPatchApplier schemaPatchApplier,
      MigrationSet tenantMigrationSet,
      TenancyProperties properties) {
    this.migrationOrchestrator = migrationOrchestrator;
    this.schemaPatchApplier = schemaPatchApplier;
    this.tenantMigrationSet = tenantMigrationSet;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.migration().runOnStartup()) {
      log.info("Tenant migrations on startup are disabled");
      return;
    }

    var report = migrationOrchestrator.runAll(tenantMigrationSet);
    for (TenantFailure failure : report.failed()) {
      log.error(
          "Tenant {} (schema {}) is behind: {}",
          failure.slug(),
          failure.schemaName(),
          failure.message());
    }

    if (properties.patches().runOnStartup()) {
      var patchReport = schemaPatchApplier.applyAll();
      if (!patchReport.failedTenantIds().isEmpty()) {
        log.error("Schema patches failed for tenants {}", patchReport.failedTenantIds());
      }
    }
    log.info("Tenant migration runner completed");
  }
}
