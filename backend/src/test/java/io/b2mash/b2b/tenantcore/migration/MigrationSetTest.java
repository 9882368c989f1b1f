package io.b2mash.b2b.tenantcore.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import io.b2mash.b2b.tenantcore.testutil.TestDatabase;
import java.util.ArrayList;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.api.Location;
import org.flywaydb.core.api.configuration.Configuration;
import org.junit.jupiter.api.Test;

class MigrationSetTest {

  @Test
  void fromLocations_keepsLocationsInOrder() {
    MigrationSet set =
        MigrationSet.fromLocations(
            "classpath:db/test-migration/v1", "classpath:db/test-migration/v2");

    assertThat(set.locations())
        .containsExactly("classpath:db/test-migration/v1", "classpath:db/test-migration/v2");
    assertThat(set).hasToString("classpath:db/test-migration/v1,classpath:db/test-migration/v2");
  }

  @Test
  void fromLocations_rejectsMissingOrBlankLocations() {
    assertThatThrownBy(() -> MigrationSet.fromLocations(List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("At least one");
    assertThatThrownBy(() -> MigrationSet.fromLocations((List<String>) null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> MigrationSet.fromLocations("classpath:db/migration/tenant", " "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("blank");
  }

  @Test
  void fromLocations_copiesTheGivenList() {
    List<String> locations = new ArrayList<>(List.of("classpath:db/migration/tenant"));
    MigrationSet set = MigrationSet.fromLocations(locations);

    locations.add("classpath:db/test-migration/v1");

    assertThat(set.locations()).containsExactly("classpath:db/migration/tenant");
  }

  @Test
  void flywayFor_isConfinedToOneExistingSchema() {
    DataSource dataSource = mock(DataSource.class);

    Configuration configuration =
        TestDatabase.tenantMigrations()
            .flywayFor(dataSource, SchemaName.of("tenant_acme"))
            .getConfiguration();

    assertThat(configuration.getDataSource()).isSameAs(dataSource);
    assertThat(configuration.getSchemas()).containsExactly("tenant_acme");
    assertThat(configuration.isCreateSchemas()).isFalse();
    assertThat(configuration.isBaselineOnMigrate()).isFalse();
    assertThat(configuration.isOutOfOrder()).isFalse();
    assertThat(configuration.getLocations())
        .extracting(Location::getPath)
        .containsExactly("db/migration/tenant");
  }
}
