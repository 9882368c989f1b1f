package io.b2mash.b2b.tenantcore.multitenancy;

import java.util.regex.Pattern;

/** A table (or other relation) name qualified with its schema. */
public record QualifiedName(SchemaName schema, String name) {

  private static final Pattern RELATION = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

  public QualifiedName {
    if (schema == null) {
      throw new IllegalArgumentException("Schema must not be null");
    }
    if (name == null || !RELATION.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid relation name: " + name);
    }
  }

  public String toSql() {
    return schema.quoted() + ".\"" + name + "\"";
  }

  @Override
  public String toString() {
    return schema.value() + "." + name;
  }
}
