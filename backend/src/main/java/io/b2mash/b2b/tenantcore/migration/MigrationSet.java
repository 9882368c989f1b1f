package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;

/**
 * The ordered tenant schema migrations, resolved by Flyway from one or more locations. Every tenant
 * schema's applied history must be a prefix of this set: a schema that is ahead of it, or that
 * skipped a version, fails validation instead of being migrated.
 */
public final class MigrationSet {

  private final List<String> locations;

  private MigrationSet(List<String> locations) {
    this.locations = locations;
  }

  public static MigrationSet fromLocations(List<String> locations) {
    if (locations == null || locations.isEmpty()) {
      throw new IllegalArgumentException("At least one migration location is required");
    }
    for (String location : locations) {
      if (location == null || location.isBlank()) {
        throw new IllegalArgumentException("Migration locations must not be blank");
      }
    }
    return new MigrationSet(List.copyOf(locations));
  }

  public static MigrationSet fromLocations(String... locations) {
    return fromLocations(List.of(locations));
  }

  public List<String> locations() {
    return locations;
  }

  /**
   * Flyway confined to {@code schema}, working only through {@code dataSource}. The schema must
   * already exist; its history lives in the schema's own {@code flyway_schema_history} table.
   */
  Flyway flywayFor(DataSource dataSource, SchemaName schema) {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations(locations.toArray(String[]::new))
        .schemas(schema.value())
        .createSchemas(false)
        // only pending versions may be absent from the history; future and skipped ones fail
        .ignoreMigrationPatterns("*:pending")
        .load();
  }

  @Override
  public String toString() {
    return String.join(",", locations);
  }
}
