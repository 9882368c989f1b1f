package io.b2mash.b2b.tenantcore.multitenancy;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.regex.Pattern;

/**
 * A validated database schema identifier. Only the shared schema ({@code public}) and tenant
 * schemas ({@code tenant_*}) are representable, so any {@code SchemaName} can be quoted into DDL
 * without further checks.
 */
public record SchemaName(String value) {

  private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

  public static final String TENANT_PREFIX = "tenant_";
  // Declared after IDENTIFIER, which the constructor needs during class initialisation
  public static final SchemaName SHARED = new SchemaName("public");

  public SchemaName {
    if (value == null || !IDENTIFIER.matcher(value).matches()) {
      throw new IllegalArgumentException("Invalid schema name: " + value);
    }
    if (!"public".equals(value) && !value.startsWith(TENANT_PREFIX)) {
      throw new IllegalArgumentException(
          "Schema name must be 'public' or start with '" + TENANT_PREFIX + "': " + value);
    }
  }

  public static SchemaName of(String value) {
    return new SchemaName(value);
  }

  public boolean isShared() {
    return SHARED.value.equals(value);
  }

  public boolean isTenantSchema() {
    return !isShared();
  }

  /** Double-quoted form for use in SQL text. */
  public String quoted() {
    return "\"" + value + "\"";
  }

  public QualifiedName qualify(String table) {
    return new QualifiedName(this, table);
  }

  @Override
  @JsonValue
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
