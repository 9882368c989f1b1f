package io.b2mash.b2b.tenantcore.config;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Migrates the shared schema on startup, which holds the tenant registry and every other global
 * table. Tenant schemas each get their own Flyway run from the tenant migrator.
 */
@Configuration
public class FlywayConfig {

  @Bean(initMethod = "migrate")
  public Flyway globalFlyway(
      @Qualifier("migrationDataSource") DataSource migrationDataSource,
      TenancyProperties properties) {
    return Flyway.configure()
        .dataSource(migrationDataSource)
        .locations(properties.shared().locations().toArray(String[]::new))
        .schemas(SchemaName.SHARED.value())
        // existing databases that predate the registry tables start from a baseline
        .baselineOnMigrate(true)
        .load();
  }
}
