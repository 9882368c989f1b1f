package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SchemaNameGenerator {

  private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]{0,54}$");

  private SchemaNameGenerator() {}

  /** Derives {@code tenant_<slug>} with hyphens mapped to underscores. */
  public static SchemaName fromSlug(String slug) {
    if (slug == null || slug.isBlank()) {
      throw new IllegalArgumentException("Tenant slug must not be null or blank");
    }
    String normalized = slug.trim().toLowerCase(Locale.ROOT);
    if (!SLUG_PATTERN.matcher(normalized).matches()) {
      throw new IllegalArgumentException("Invalid tenant slug: " + slug);
    }
    return SchemaName.of(SchemaName.TENANT_PREFIX + normalized.replace('-', '_'));
  }

  /** Recovers the slug-like suffix of a tenant schema name, used when only the schema is known. */
  public static String slugOf(SchemaName schemaName) {
    if (schemaName.isShared()) {
      throw new IllegalArgumentException("The shared schema has no tenant slug");
    }
    return schemaName.value().substring(SchemaName.TENANT_PREFIX.length()).replace('_', '-');
  }
}
