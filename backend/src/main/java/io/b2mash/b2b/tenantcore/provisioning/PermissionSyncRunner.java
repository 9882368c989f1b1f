package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.config.TenancyProperties;
import io.b2mash.b2b.tenantcore.migration.BatchCancellation;
import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDirectory;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Adds permissions introduced since a tenant was provisioned and grants them to its Owner role.
 * Tenants without seeded roles are left to provisioning.
 *
 * <p>Ordered after TenantMigrationRunner ({@code @Order(50)}) so schemas are fully migrated first.
 */
@Component
@Order(100)
public class PermissionSyncRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(PermissionSyncRunner.class);

  private final TenantDirectory tenantDirectory;
  private final SchemaRouter schemaRouter;
  private final TenantBatchExecutor batchExecutor;
  private final RolePermissionSeeder rolePermissionSeeder;
  private final TenancyProperties properties;

  public PermissionSyncRunner(
      TenantDirectory tenantDirectory,
      @Qualifier("migrationSchemaRouter") SchemaRouter schemaRouter,
      TenantBatchExecutor batchExecutor,
      RolePermissionSeeder rolePermissionSeeder,
      TenancyProperties properties) {
    this.tenantDirectory = tenantDirectory;
    this.schemaRouter = schemaRouter;
    this.batchExecutor = batchExecutor;
    this.rolePermissionSeeder = rolePermissionSeeder;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.migration().runOnStartup()) {
      return;
    }
    List<TenantDescriptor> tenants = tenantDirectory.listEligibleTenants();
    if (tenants.isEmpty()) {
      log.info("No tenant schemas found, skipping permission sync");
      return;
    }

    var outcome =
        batchExecutor.run(
            "permission-sync",
            tenants,
            tenant -> {
              if (!schemaRouter.schemaExists(tenant.schemaName())) {
                return false;
              }
              try (SchemaSession session = schemaRouter.openSession(tenant)) {
                if (!rolePermissionSeeder.isSeeded(session)) {
                  return false;
                }
                rolePermissionSeeder.seed(session);
                return true;
              }
            },
            BatchCancellation.create());

    long synced = outcome.outcomes().stream().filter(o -> Boolean.TRUE.equals(o.result())).count();
    long failed = outcome.outcomes().stream().filter(o -> !o.succeeded()).count();
    log.info("Permission sync completed: {} tenants synced, {} failed", synced, failed);
  }
}
