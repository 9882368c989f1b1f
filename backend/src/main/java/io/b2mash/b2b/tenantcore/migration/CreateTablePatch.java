package io.b2mash.b2b.tenantcore.migration;

import io.b2mash.b2b.tenantcore.multitenancy.SchemaSession;

/** Creates a table with {@code CREATE TABLE IF NOT EXISTS} when it is missing. */
public class CreateTablePatch implements SchemaPatch {

  private final String id;
  private final String description;
  private final String table;
  private final String columnsDdl;

  /**
   * @param columnsDdl the body between the parentheses of {@code CREATE TABLE}, e.g. {@code id
   *     UUID PRIMARY KEY, name VARCHAR(100) NOT NULL}
   */
  public CreateTablePatch(String id, String description, String table, String columnsDdl) {
    if (columnsDdl == null || columnsDdl.isBlank() || columnsDdl.contains(";")) {
      throw new IllegalArgumentException("Invalid table definition for patch " + id);
    }
    this.id = id;
    this.description = description;
    this.table = table;
    this.columnsDdl = columnsDdl;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String description() {
    return description;
  }

  @Override
  public boolean isApplied(SchemaSession session) {
    Integer count =
        session
            .sql(
                "SELECT COUNT(*) FROM information_schema.tables"
                    + " WHERE table_schema = :schema AND table_name = :table")
            .param("schema", session.schema().value())
            .param("table", table)
            .query(Integer.class)
            .single();
    return count != null && count > 0;
  }

  @Override
  public void apply(SchemaSession session) {
    String target = session.qualify(table).toSql();
    session.sql("CREATE TABLE IF NOT EXISTS " + target + " (" + columnsDdl + ")").update();
  }
}
