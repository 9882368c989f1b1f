package io.b2mash.b2b.tenantcore.provisioning;

import io.b2mash.b2b.tenantcore.migration.MigrationOrchestrator;
import io.b2mash.b2b.tenantcore.migration.MigrationSet;
import io.b2mash.b2b.tenantcore.migration.TenantMigrationResult;
import io.b2mash.b2b.tenantcore.migration.TenantMigrator;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaNameGenerator;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import io.b2mash.b2b.tenantcore.multitenancy.TenantScope;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * First-time setup of a tenant schema: create and migrate the schema, seed roles, create the owner
 * and default settings. Every step checks what already exists, so re-running after a failure
 * resumes where it stopped without creating duplicates. Tenant status is left untouched.
 */
@Service
public class TenantProvisioner {

  private static final Logger log = LoggerFactory.getLogger(TenantProvisioner.class);

  private final SchemaRouter schemaRouter;
  private final MigrationOrchestrator migrationOrchestrator;
  private final TenantMigrator tenantMigrator;
  private final MigrationSet migrationSet;
  private final RolePermissionSeeder rolePermissionSeeder;
  private final OwnerAccountSeeder ownerAccountSeeder;
  private final TenantSettingsSeeder tenantSettingsSeeder;

  public TenantProvisioner(
      @Qualifier("migrationSchemaRouter") SchemaRouter schemaRouter,
      MigrationOrchestrator migrationOrchestrator,
      TenantMigrator tenantMigrator,
      MigrationSet migrationSet,
      RolePermissionSeeder rolePermissionSeeder,
      OwnerAccountSeeder ownerAccountSeeder,
      TenantSettingsSeeder tenantSettingsSeeder) {
    this.schemaRouter = schemaRouter;
    this.migrationOrchestrator = migrationOrchestrator;
    this.tenantMigrator = tenantMigrator;
    this.migrationSet = migrationSet;
    this.rolePermissionSeeder = rolePermissionSeeder;
    this.ownerAccountSeeder = ownerAccountSeeder;
    this.tenantSettingsSeeder = tenantSettingsSeeder;
  }

  public ProvisioningResult provision(
      UUID tenantId,
      String schemaName,
      String ownerEmail,
      String ownerPasswordHash,
      String companyName) {
    if (tenantId == null) {
      throw new IllegalArgumentException("Tenant id must not be null");
    }
    requireText(ownerEmail, "Owner email");
    requireText(ownerPasswordHash, "Owner password hash");
    requireText(companyName, "Company name");
    SchemaName schema = SchemaName.of(schemaName);
    TenantContext tenant = new TenantContext(tenantId, schema, SchemaNameGenerator.slugOf(schema));

    try (TenantScope.Binding ignored = TenantScope.bind(tenant)) {
      ProvisioningStep attempting = ProvisioningStep.SCHEMA_CREATED;
      try {
        ProvisioningStep initialState = currentState(tenant);
        if (initialState == ProvisioningStep.READY) {
          log.info("Tenant {} already provisioned in schema {}", tenantId, schema);
          return new ProvisioningResult(tenantId, schema, initialState, initialState, List.of());
        }
        log.info("Provisioning tenant {} into schema {} from {}", tenantId, schema, initialState);

        TenantMigrationResult migration = migrationOrchestrator.migrateSchema(tenant, migrationSet);
        try (SchemaSession session = schemaRouter.openSession(tenant)) {
          attempting = ProvisioningStep.ROLES_SEEDED;
          rolePermissionSeeder.seed(session);
          attempting = ProvisioningStep.OWNER_CREATED;
          ownerAccountSeeder.seed(session, ownerEmail, ownerPasswordHash);
          attempting = ProvisioningStep.SETTINGS_CREATED;
          tenantSettingsSeeder.seed(session, companyName);
        }

        log.info("Successfully provisioned tenant {} in schema {}", tenantId, schema);
        return new ProvisioningResult(
            tenantId, schema, initialState, ProvisioningStep.READY, migration.newlyApplied());
      } catch (RuntimeException e) {
        log.error("Failed to provision tenant {} at step {}", tenantId, attempting, e);
        throw new ProvisioningException(tenantId, attempting, e);
      }
    }
  }

  /** Derives how far provisioning got from what exists in the schema. */
  public ProvisioningStep currentState(TenantContext tenant) {
    if (!schemaRouter.schemaExists(tenant.schemaName())) {
      return ProvisioningStep.NOT_PROVISIONED;
    }
    try (SchemaSession session = schemaRouter.openSession(tenant)) {
      if (!tenantMigrator.inspect(session, migrationSet).isUpToDate()) {
        return ProvisioningStep.NOT_PROVISIONED;
      }
      if (!rolePermissionSeeder.isSeeded(session)) {
        return ProvisioningStep.SCHEMA_CREATED;
      }
      if (!ownerAccountSeeder.isSeeded(session)) {
        return ProvisioningStep.ROLES_SEEDED;
      }
      if (!tenantSettingsSeeder.isSeeded(session)) {
        return ProvisioningStep.OWNER_CREATED;
      }
      return ProvisioningStep.READY;
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}
