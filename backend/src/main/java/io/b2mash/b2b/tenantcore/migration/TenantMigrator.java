package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.ContextMisuseException;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantContext;
import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies a {@link MigrationSet} to the schema of one tenant session. Flyway runs over the
 * session's own connection, so every statement lands in the routed schema. Concurrent runs against
 * the same schema are serialized by Flyway's lock on that schema's history table.
 */
@Component
public class TenantMigrator {

  private static final Logger log = LoggerFactory.getLogger(TenantMigrator.class);

  public TenantMigrationResult migrate(SchemaSession session, MigrationSet migrationSet) {
    TenantContext tenant =
        session
            .tenant()
            .orElseThrow(
                () -> new ContextMisuseException("Tenant migrations need a tenant-bound session"));

    session.reassertSchema();
    return session.withDataSource(
        dataSource -> {
          Flyway flyway = migrationSet.flywayFor(dataSource, tenant.schemaName());
          List<String> applied = versions(flyway.info().applied());
          MigrateResult result;
          try {
            result = flyway.migrate();
          } catch (FlywayValidateException e) {
            throw new MigrationApplyException(
                tenant,
                null,
                "Migration history of "
                    + tenant.schemaName()
                    + " is inconsistent: "
                    + e.getMessage(),
                e);
          } catch (FlywayException e) {
            String failedVersion = firstPending(flyway, tenant);
            throw new MigrationApplyException(
                tenant,
                failedVersion,
                "Migration V"
                    + failedVersion
                    + " failed for schema "
                    + tenant.schemaName()
                    + ": "
                    + e.getMessage(),
                e);
          }

          List<String> newlyApplied =
              result.migrations.stream().map(migration -> migration.version).toList();
          if (newlyApplied.isEmpty()) {
            log.debug("Schema {} is up to date at version {}", tenant.schemaName(), last(applied));
          } else {
            log.info(
                "Migrated schema {} to version {} ({} applied)",
                tenant.schemaName(),
                last(newlyApplied),
                newlyApplied.size());
          }
          return TenantMigrationResult.of(tenant, applied, newlyApplied);
        });
  }

  /** Reports applied and pending versions of the session's schema without changing anything. */
  public TenantMigrationState inspect(SchemaSession session, MigrationSet migrationSet) {
    return inspect(session, session.schema(), migrationSet);
  }

  /**
   * Reports applied and pending versions of {@code target}, reading through {@code session}. A
   * target schema that does not exist yet reports every known version as pending.
   */
  public TenantMigrationState inspect(
      SchemaSession session, SchemaName target, MigrationSet migrationSet) {
    return session.withDataSource(
        dataSource -> {
          MigrationInfoService info = migrationSet.flywayFor(dataSource, target).info();
          return new TenantMigrationState(versions(info.applied()), versions(info.pending()));
        });
  }

  private static String firstPending(Flyway flyway, TenantContext tenant) {
    try {
      MigrationInfo[] pending = flyway.info().pending();
      return pending.length == 0 || pending[0].getVersion() == null
          ? null
          : pending[0].getVersion().getVersion();
    } catch (FlywayException e) {
      log.warn("Unable to determine the failed migration of schema {}", tenant.schemaName(), e);
      return null;
    }
  }

  private static List<String> versions(MigrationInfo[] migrations) {
    return Arrays.stream(migrations)
        .filter(migration -> migration.getVersion() != null)
        .map(migration -> migration.getVersion().getVersion())
        .toList();
  }

  private static String last(List<String> versions) {
    return versions.isEmpty() ? "0" : versions.get(versions.size() - 1);
  }
}
