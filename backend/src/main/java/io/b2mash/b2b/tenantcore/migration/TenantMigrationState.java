package io.b2mash.b2b.tenantcore.migration;

import java.util.List;

/** Applied and pending versions of one schema, as seen without changing anything. */
public record TenantMigrationState(List<String> applied, List<String> pending) {

  public boolean isUpToDate() {
    return pending.isEmpty();
  }
}
