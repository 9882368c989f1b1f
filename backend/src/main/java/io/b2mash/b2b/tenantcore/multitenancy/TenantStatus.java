package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.Set;

public enum TenantStatus {
  PENDING,
  ACTIVE,
  SUSPENDED,
  DEACTIVATED;

  /** Statuses whose schemas are kept in sync by migration batches. */
  public static final Set<TenantStatus> MIGRATION_ELIGIBLE = Set.of(PENDING, ACTIVE);

  public boolean isMigrationEligible() {
    return MIGRATION_ELIGIBLE.contains(this);
  }
}
