package io.b2mash.b2b.tenantcore.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaName;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaRouter;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDescriptor;
import io.b2mash.b2b.tenantcore.multitenancy.TenantDirectory;
import io.b2mash.b2b.tenantcore.multitenancy.TenantScope;
import io.b2mash.b2b.tenantcore.testutil.TestDatabase;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class MigrationOrchestratorTest {

  private TestDatabase database;
  private SchemaRouter router;
  private TenantDirectory tenantDirectory;
  private TenantMigrator tenantMigrator;
  private MigrationOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    database = TestDatabase.create();
    router = database.schemaRouter();
    tenantDirectory = mock(TenantDirectory.class);
    tenantMigrator = new TenantMigrator();
    orchestrator =
        new MigrationOrchestrator(
            tenantDirectory, router, tenantMigrator, new TenantBatchExecutor(2), database.flyway());
  }

  @AfterEach
  void tearDown() {
    database.close();
  }

  @Test
  void runAll_bringsEveryTenantToLatestVersionFromDifferentStartingPoints() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    TenantDescriptor globex = TestDatabase.tenant("globex");
    when(tenantDirectory.listEligibleTenants()).thenReturn(List.of(acme, globex));

    orchestrator.migrateSchema(acme.toContext(), tableMigrations(2));
    orchestrator.migrateSchema(globex.toContext(), tableMigrations(1));

    BatchReport report = orchestrator.runAll(tableMigrations(3));

    assertThat(report.succeededTenantIds()).containsExactlyInAnyOrder(acme.id(), globex.id());
    assertThat(report.failed()).isEmpty();
    assertThat(report.skipped()).isEmpty();
    assertThat(appliedVersions(acme)).containsExactly("1", "2", "3");
    assertThat(appliedVersions(globex)).containsExactly("1", "2", "3");
    assertThat(resultFor(report, acme).newlyApplied()).containsExactly("3");
    assertThat(resultFor(report, globex).newlyApplied()).containsExactly("2", "3");
    assertThat(resultFor(report, globex).previouslyApplied()).containsExactly("1");
  }

  @Test
  void runAll_secondRunAppliesNothing() {
    List<TenantDescriptor> tenants =
        List.of(
            TestDatabase.tenant("acme"),
            TestDatabase.tenant("globex"),
            TestDatabase.tenant("initech"));
    when(tenantDirectory.listEligibleTenants()).thenReturn(tenants);
    MigrationSet migrations = TestDatabase.tenantMigrations();

    BatchReport first = orchestrator.runAll(migrations);
    BatchReport second = orchestrator.runAll(migrations);

    assertThat(first.isFullySuccessful()).isTrue();
    assertThat(first.totalMigrationsApplied()).isEqualTo(9);
    assertThat(second.isFullySuccessful()).isTrue();
    assertThat(second.succeeded()).hasSize(3);
    assertThat(second.totalMigrationsApplied()).isZero();
    assertThat(second.succeeded()).allMatch(TenantMigrationResult::alreadyUpToDate);
  }

  @Test
  void runAll_failingTenantIsTheOnlyFailure() {
    List<TenantDescriptor> tenants = new ArrayList<>();
    for (int i = 1; i <= 5; i++) {
      tenants.add(TestDatabase.tenant("shop-" + i));
    }
    TenantDescriptor broken = tenants.get(2);
    when(tenantDirectory.listEligibleTenants()).thenReturn(tenants);
    orchestrator.runAll(tableMigrations(1));
    // V2 creates t2, which already exists in this one schema
    database
        .jdbc()
        .sql("CREATE TABLE " + broken.schemaName().qualify("t2").toSql() + " (id INTEGER)")
        .update();

    BatchReport report = orchestrator.runAll(tableMigrations(3));

    assertThat(report.failedTenantIds()).containsExactly(broken.id());
    assertThat(report.succeeded()).hasSize(4);
    TenantFailure failure = report.failed().get(0);
    assertThat(failure.failedVersion()).isEqualTo("2");
    assertThat(failure.errorType()).isEqualTo("MigrationApplyException");
    assertThat(failure.message()).contains("already exists");
    assertThat(appliedVersions(broken)).containsExactly("1");
    for (TenantDescriptor tenant : tenants) {
      if (tenant != broken) {
        assertThat(appliedVersions(tenant)).containsExactly("1", "2", "3");
      }
    }
  }

  @Test
  void runAll_reportsEveryFailureWhenAllTenantsFail() {
    List<TenantDescriptor> tenants =
        List.of(TestDatabase.tenant("acme"), TestDatabase.tenant("globex"));
    when(tenantDirectory.listEligibleTenants()).thenReturn(tenants);

    BatchReport report = orchestrator.runAll(brokenSecondMigration());

    assertThat(report.succeeded()).isEmpty();
    assertThat(report.failedTenantIds())
        .containsExactlyInAnyOrder(tenants.get(0).id(), tenants.get(1).id());
    assertThat(report.failed()).allMatch(failure -> "2".equals(failure.failedVersion()));
  }

  @Test
  void runAll_rejectsHistoryAheadOfKnownMigrations() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    when(tenantDirectory.listEligibleTenants()).thenReturn(List.of(acme));
    orchestrator.migrateSchema(acme.toContext(), tableMigrations(2));

    BatchReport report = orchestrator.runAll(tableMigrations(1));

    assertThat(report.failedTenantIds()).containsExactly(acme.id());
    assertThat(report.failed().get(0).failedVersion()).isNull();
    assertThat(report.failed().get(0).message()).contains("inconsistent");
    assertThat(appliedVersions(acme)).containsExactly("1", "2");
  }

  @Test
  void runAll_rejectsHistoryWithAGap() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    when(tenantDirectory.listEligibleTenants()).thenReturn(List.of(acme));
    MigrationSet withoutSecond =
        MigrationSet.fromLocations(
            "classpath:db/test-migration/v1", "classpath:db/test-migration/v3");
    orchestrator.migrateSchema(acme.toContext(), withoutSecond);

    BatchReport report = orchestrator.runAll(tableMigrations(3));

    assertThat(report.failedTenantIds()).containsExactly(acme.id());
    assertThat(report.failed().get(0).failedVersion()).isNull();
    assertThat(report.failed().get(0).message()).contains("inconsistent");
    assertThat(appliedVersions(acme)).containsExactly("1", "3");
  }

  @Test
  void runAll_cancelledBeforeStartSkipsEveryTenant() {
    List<TenantDescriptor> tenants =
        List.of(TestDatabase.tenant("acme"), TestDatabase.tenant("globex"));
    when(tenantDirectory.listEligibleTenants()).thenReturn(tenants);
    BatchCancellation cancellation = BatchCancellation.create();
    cancellation.cancel();

    BatchReport report = orchestrator.runAll(tableMigrations(1), cancellation);

    assertThat(report.succeeded()).isEmpty();
    assertThat(report.skipped()).containsExactly(tenants.get(0).id(), tenants.get(1).id());
    assertThat(report.isFullySuccessful()).isFalse();
    assertThat(router.schemaExists(tenants.get(0).schemaName())).isFalse();
  }

  @Test
  void runAll_withNoEligibleTenantsReturnsEmptyReport() {
    when(tenantDirectory.listEligibleTenants()).thenReturn(List.of());

    BatchReport report = orchestrator.runAll(tableMigrations(1));

    assertThat(report.succeeded()).isEmpty();
    assertThat(report.isFullySuccessful()).isTrue();
  }

  @Test
  void migrateTenant_bindsContextOnlyForTheCall() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    when(tenantDirectory.findById(acme.id())).thenReturn(acme);

    TenantMigrationResult result = orchestrator.migrateTenant(acme.id(), tableMigrations(2));

    assertThat(result.newlyApplied()).containsExactly("1", "2");
    assertThat(result.schemaName()).isEqualTo(SchemaName.of("tenant_acme"));
    assertThat(TenantScope.isBound()).isFalse();
  }

  @Test
  void migrateTenant_surfacesMigrationFailureWithVersion() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    when(tenantDirectory.findById(acme.id())).thenReturn(acme);

    assertThatThrownBy(() -> orchestrator.migrateTenant(acme.id(), brokenSecondMigration()))
        .isInstanceOf(MigrationApplyException.class)
        .satisfies(e -> assertThat(((MigrationApplyException) e).getVersion()).isEqualTo("2"));
    assertThat(appliedVersions(acme)).containsExactly("1");
  }

  @Test
  void migrateTenant_concurrentRunsOnOneTenantApplyEachMigrationOnce() throws Exception {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    when(tenantDirectory.findById(acme.id())).thenReturn(acme);
    MigrationSet migrations = tableMigrations(3);
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(2);
    try {
      List<CompletableFuture<TenantMigrationResult>> runs = new ArrayList<>();
      for (int i = 0; i < 2; i++) {
        runs.add(
            CompletableFuture.supplyAsync(
                () -> {
                  awaitQuietly(start);
                  return orchestrator.migrateTenant(acme.id(), migrations);
                },
                pool));
      }
      start.countDown();

      int applied = 0;
      for (CompletableFuture<TenantMigrationResult> run : runs) {
        applied += run.get(60, TimeUnit.SECONDS).newlyApplied().size();
      }

      assertThat(applied).isEqualTo(3);
      assertThat(appliedVersions(acme)).containsExactly("1", "2", "3");
      assertThat(database.count(acme.schemaName(), "flyway_schema_history")).isEqualTo(3);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void status_reportsAppliedPendingAndMissingSchemas() {
    TenantDescriptor acme = TestDatabase.tenant("acme");
    TenantDescriptor globex = TestDatabase.tenant("globex");
    when(tenantDirectory.listAll()).thenReturn(List.of(acme, globex));
    orchestrator.migrateSchema(acme.toContext(), tableMigrations(2));
    MigrationSet three = tableMigrations(3);

    MigrationStatus status = orchestrator.status(three);

    assertThat(status.locations()).isEqualTo(three.locations());
    assertThat(status.sharedSchema().applied()).isNotEmpty();
    assertThat(status.sharedSchema().pending()).isEmpty();
    MigrationStatus.TenantSchemaStatus acmeStatus = status.tenants().get(0);
    assertThat(acmeStatus.schemaPresent()).isTrue();
    assertThat(acmeStatus.applied()).containsExactly("1", "2");
    assertThat(acmeStatus.pending()).containsExactly("3");
    MigrationStatus.TenantSchemaStatus globexStatus = status.tenants().get(1);
    assertThat(globexStatus.schemaPresent()).isFalse();
    assertThat(globexStatus.error()).isNull();
    assertThat(globexStatus.pending()).containsExactly("1", "2", "3");
    assertThat(status.tenantsWithPendingMigrations()).isEqualTo(2);
    assertThat(router.schemaExists(globex.schemaName())).isFalse();
  }

  @Test
  void bundledScriptsCreateTenantTables() {
    TenantDescriptor acme = TestDatabase.tenant("acme");

    orchestrator.migrateSchema(acme.toContext(), TestDatabase.tenantMigrations());

    assertThat(database.count(acme.schemaName(), "roles")).isZero();
    assertThat(database.count(acme.schemaName(), "settings")).isZero();
    assertThat(database.count(acme.schemaName(), "sales_channels")).isZero();
    assertThat(database.count(acme.schemaName(), "flyway_schema_history")).isEqualTo(3);
    assertThat(database.count(SchemaName.SHARED, "tenants")).isZero();
  }

  private List<String> appliedVersions(TenantDescriptor tenant) {
    try (SchemaSession session = router.openSession(tenant.toContext())) {
      return tenantMigrator.inspect(session, tableMigrations(3)).applied();
    }
  }

  private static TenantMigrationResult resultFor(BatchReport report, TenantDescriptor tenant) {
    return report.succeeded().stream()
        .filter(result -> result.tenantId().equals(tenant.id()))
        .findFirst()
        .orElseThrow();
  }

  /** {@code V1..V<count>}, each creating table {@code t<version>}. */
  private static MigrationSet tableMigrations(int count) {
    List<String> locations = new ArrayList<>();
    for (int version = 1; version <= count; version++) {
      locations.add("classpath:db/test-migration/v" + version);
    }
    return MigrationSet.fromLocations(locations);
  }

  private static MigrationSet brokenSecondMigration() {
    return MigrationSet.fromLocations(
        "classpath:db/test-migration/v1", "classpath:db/test-migration/broken");
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
