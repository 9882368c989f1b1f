package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;

/**
 * A named structural change applied outside the ordered migration set. Implementations must be
 * idempotent: {@link #apply} uses guarded DDL so that running it on an already patched schema, or
 * concurrently with another run, changes nothing.
 */
public interface SchemaPatch {

  String id();

  String description();

  /** Whether the session's schema already has the patched structure. */
  boolean isApplied(SchemaSession session);

  void apply(SchemaSession session);
}
