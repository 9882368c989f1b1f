package io.b2mash.b2b.tenantcore.config;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Two pools: {@code appDataSource} serves JPA and every request-time tenant session, {@code
 * migrationDataSource} serves schema creation, Flyway and the tenant batches.
 */
@Configuration
public class DataSourceConfig {

  private static final Logger log = LoggerFactory.getLogger(DataSourceConfig.class);

  @Bean(name = "appDataSource")
  @Primary
  @ConfigurationProperties("spring.datasource.app")
  public HikariDataSource appDataSource() {
    return new HikariDataSource();
  }

  @Bean(name = "migrationDataSource")
  @ConfigurationProperties("spring.datasource.migration")
  public HikariDataSource migrationDataSource() {
    return new HikariDataSource();
  }

  /**
   * Every tenant in a migration batch holds one migration connection for its whole run, so the
   * pool must be at least as large as the batch parallelism.
   */
  @Bean
  public SmartInitializingSingleton migrationPoolSizeCheck(
      @Qualifier("migrationDataSource") HikariDataSource migrationDataSource,
      TenancyProperties properties) {
    return () -> {
      int poolSize = migrationDataSource.getMaximumPoolSize();
      int parallelism = properties.migration().parallelism();
      if (poolSize < parallelism) {
        throw new IllegalStateException(
            "spring.datasource.migration.maximum-pool-size ("
                + poolSize
                + ") must be at least tenancy.migration.parallelism ("
                + parallelism
                + ")");
      }
      log.info(
          "Migration pool {} sized {} for parallelism {}",
          migrationDataSource.getPoolName(),
          poolSize,
          parallelism);
    };
  }
}
