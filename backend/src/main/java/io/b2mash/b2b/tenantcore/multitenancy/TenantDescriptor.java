package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.UUID;

/** Read-only view of a directory entry handed to batch work. */
public record TenantDescriptor(UUID id, SchemaName schemaName, String slug, TenantStatus status) {

  public TenantContext toContext() {
    return new TenantContext(id, schemaName, slug);
  }
}
