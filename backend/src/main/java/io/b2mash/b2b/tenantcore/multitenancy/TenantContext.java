package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.UUID;

/**
 * The tenant a unit of work acts for. Immutable; bound per unit of work through {@link
 * TenantScope} or passed explicitly to {@link SchemaRouter#openSession(TenantContext)}.
 */
public record TenantContext(UUID tenantId, SchemaName schemaName, String slug) {

  public TenantContext {
    if (tenantId == null) {
      throw new IllegalArgumentException("Tenant id must not be null");
    }
    if (schemaName == null || schemaName.isShared()) {
      throw new IllegalArgumentException("Tenant context requires a tenant schema: " + schemaName);
    }
    if (slug == null || slug.isBlank()) {
      throw new IllegalArgumentException("Tenant slug must not be blank");
    }
  }
}
