package io.b2mash.b2b.tenantcore.multitenancy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TenantTest {

  @Test
  void newTenantIsPendingWithDerivedSchema() {
    var tenant = new Tenant("Acme Retail", "Acme-Retail", "ops@acme.test");

    assertThat(tenant.getSlug()).isEqualTo("acme-retail");
    assertThat(tenant.getSchemaName()).isEqualTo("tenant_acme_retail");
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.PENDING);
    assertThat(tenant.getStatus().isMigrationEligible()).isTrue();
    assertThat(tenant.getCreatedAt()).isNotNull();
    assertThat(tenant.isDeleted()).isFalse();
  }

  @Test
  void suspendedAndDeactivatedTenantsAreNotMigrationEligible() {
    var tenant = new Tenant("Acme", "acme", null);
    tenant.activate();
    assertThat(tenant.getStatus().isMigrationEligible()).isTrue();

    tenant.suspend();
    assertThat(tenant.getStatus().isMigrationEligible()).isFalse();

    tenant.deactivate();
    assertThat(tenant.getStatus()).isEqualTo(TenantStatus.DEACTIVATED);
    assertThat(tenant.getStatus().isMigrationEligible()).isFalse();
  }

  @Test
  void deactivatedTenantCannotBeActivatedOrSuspended() {
    var tenant = new Tenant("Acme", "acme", null);
    tenant.deactivate();

    assertThatThrownBy(tenant::activate).isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(tenant::suspend).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void markDeletedSetsSoftDeleteMarker() {
    var tenant = new Tenant("Acme", "acme", null);
    tenant.markDeleted();

    assertThat(tenant.isDeleted()).isTrue();
    assertThat(tenant.getDeletedAt()).isNotNull();
  }

  @Test
  void invalidSlugIsRejected() {
    assertThatThrownBy(() -> new Tenant("Bad", "bad slug!", null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
