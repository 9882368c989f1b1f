package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.QualifiedName;
import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** Adds any of a table's columns that are missing, using {@code ADD COLUMN IF NOT EXISTS}. */
public class AddColumnsPatch implements SchemaPatch {

  private static final Pattern COLUMN_NAME = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

  /** A column name and its SQL type with constraints, e.g. {@code VARCHAR(255) NOT NULL}. */
  public record Column(String name, String definition) {

    public Column {
      if (name == null || !COLUMN_NAME.matcher(name).matches()) {
        throw new IllegalArgumentException("Invalid column name: " + name);
      }
      if (definition == null || definition.isBlank() || definition.contains(";")) {
        throw new IllegalArgumentException("Invalid definition for column " + name);
      }
    }
  }

  private final String id;
  private final String description;
  private final String table;
  private final List<Column> columns;

  public AddColumnsPatch(String id, String description, String table, List<Column> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("Patch " + id + " adds no columns");
    }
    this.id = id;
    this.description = description;
    this.table = table;
    this.columns = List.copyOf(columns);
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String description() {
    return description;
  }

  public List<Column> columns() {
    return columns;
  }

  @Override
  public boolean isApplied(SchemaSession session) {
    Set<String> existing = existingColumns(session);
    return columns.stream().allMatch(column -> existing.contains(column.name()));
  }

  @Override
  public void apply(SchemaSession session) {
    QualifiedName target = session.qualify(table);
    Set<String> existing = existingColumns(session);
    for (Column column : columns) {
      if (existing.contains(column.name())) {
        continue;
      }
      session
          .sql(
              "ALTER TABLE "
                  + target.toSql()
                  + " ADD COLUMN IF NOT EXISTS \""
                  + column.name()
                  + "\" "
                  + column.definition())
          .update();
    }
  }

  private Set<String> existingColumns(SchemaSession session) {
    return new HashSet<>(
        session
            .sql(
                "SELECT column_name FROM information_schema.columns"
                    + " WHERE table_schema = :schema AND table_name = :table")
            .param("schema", session.schema().value())
            .param("table", table)
            .query(String.class)
            .list());
  }
}
