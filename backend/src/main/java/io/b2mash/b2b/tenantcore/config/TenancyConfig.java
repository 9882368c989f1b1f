package io.b2mash.b2b.tenantcore.config;

import io.b2mash.b2b.tenantcore.migration.MigrationSet;
import io.b2mash.b2b.tenantcore.migration.TenantBatchExecutor;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

@Configuration
@EnableConfigurationProperties(TenancyProperties.class)
public class TenancyConfig {

  private static final Logger log = LoggerFactory.getLogger(TenancyConfig.class);

  /** Router for request-time tenant sessions. */
  @Bean
  @Primary
  public SchemaRouter schemaRouter(@Qualifier("appDataSource") DataSource appDataSource) {
    return new SchemaRouter(appDataSource);
  }

  /** Router for DDL: schema creation, migrations, patches and provisioning. */
  @Bean
  public SchemaRouter migrationSchemaRouter(
      @Qualifier("migrationDataSource") DataSource migrationDataSource) {
    return new SchemaRouter(migrationDataSource);
  }

  @Bean
  public MigrationSet tenantMigrationSet(TenancyProperties properties) {
    MigrationSet migrationSet = MigrationSet.fromLocations(properties.migration().locations());
    log.info("Tenant migrations resolved from {}", migrationSet);
    return migrationSet;
  }

  @Bean
  public TenantBatchExecutor tenantBatchExecutor(TenancyProperties properties) {
    return new TenantBatchExecutor(properties.migration().parallelism());
  }
}
