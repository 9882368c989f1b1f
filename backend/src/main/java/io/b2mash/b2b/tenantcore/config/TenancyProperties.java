package io.b2mash.b2b.tenantcore.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for tenant routing and schema migration.
 *
 * @param shared shared schema migration settings
 * @param migration tenant migration batch settings
 * @param patches schema patch settings
 * @param cache tenant resolution cache used by the request filter
 */
@ConfigurationProperties(prefix = "tenancy")
public record TenancyProperties(
    @DefaultValue Shared shared,
    @DefaultValue Migration migration,
    @DefaultValue Patches patches,
    @DefaultValue Cache cache) {

  /** @param locations Flyway locations of the shared schema's scripts */
  public record Shared(@DefaultValue("classpath:db/migration/global") List<String> locations) {}

  /**
   * @param parallelism maximum number of tenants migrated at the same time
   * @param runOnStartup whether migrations run for all eligible tenants at startup
   * @param cron schedule for periodic runs, {@code -} disables it
   * @param locations Flyway locations holding the {@code V<n>__<description>.sql} tenant scripts
   */
  public record Migration(
      @DefaultValue("4") int parallelism,
      @DefaultValue("true") boolean runOnStartup,
      @DefaultValue("-") String cron,
      @DefaultValue("classpath:db/migration/tenant") List<String> locations) {}

  public record Patches(@DefaultValue("true") boolean runOnStartup) {}

  public record Cache(
      @DefaultValue("10000") long maximumSize, @DefaultValue("5m") Duration ttl) {}
}
