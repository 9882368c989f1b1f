package io.b2mash.b2b.tenantcore.multitenancy;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.support.SQLExceptionSubclassTranslator;

/**
 * Hands out {@link SchemaSession}s confined to one schema over a shared connection pool.
 *
 * <p>Every checkout issues the active-schema directive and reads it back before the session is
 * returned. Nothing about the active schema is assumed from a previous checkout of the same pooled
 * connection.
 */
public class SchemaRouter {

  private static final Logger log = LoggerFactory.getLogger(SchemaRouter.class);

  private static final String SCHEMA_EXISTS_SQL =
      "SELECT COUNT(*) FROM information_schema.schemata WHERE schema_name = ?";

  private static final SQLExceptionSubclassTranslator TRANSLATOR =
      new SQLExceptionSubclassTranslator();

  private final DataSource dataSource;

  public SchemaRouter(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /** Opens a session for the tenant bound to the current unit of work. */
  public SchemaSession openSession() {
    return openSession(TenantScope.require());
  }

  public SchemaSession openSession(TenantContext tenant) {
    if (tenant == null) {
      throw new ContextMisuseException("A tenant context is required to open a tenant session");
    }
    return open(tenant.schemaName(), tenant);
  }

  /** Opens a session on the shared schema. Needs no tenant context. */
  public SchemaSession openSharedSession() {
    return open(SchemaName.SHARED, null);
  }

  public boolean schemaExists(SchemaName schema) {
    Connection connection = acquire(schema);
    try {
      return schemaExists(connection, schema);
    } catch (SQLException e) {
      throw translate("check schema " + schema, e);
    } finally {
      release(connection);
    }
  }

  /** Creates the schema if it does not exist yet. */
  public void ensureSchema(SchemaName schema) {
    Connection connection = acquire(schema);
    try (Statement stmt = connection.createStatement()) {
      // SchemaName only admits validated identifiers, safe to concatenate
      stmt.execute("CREATE SCHEMA IF NOT EXISTS " + schema.quoted());
      log.debug("Ensured schema {} exists", schema);
    } catch (SQLException e) {
      if (createdConcurrently(connection, schema)) {
        log.debug("Schema {} was created concurrently", schema);
        return;
      }
      throw translate("create schema " + schema, e);
    } finally {
      release(connection);
    }
  }

  // Concurrent CREATE SCHEMA IF NOT EXISTS can still fail on the catalog's unique index
  private static boolean createdConcurrently(Connection connection, SchemaName schema) {
    try {
      return schemaExists(connection, schema);
    } catch (SQLException e) {
      log.debug("Could not re-check schema {} after a failed create", schema, e);
      return false;
    }
  }

  private SchemaSession open(SchemaName schema, TenantContext tenant) {
    Connection connection = acquire(schema);
    try {
      if (schema.isTenantSchema() && !schemaExists(connection, schema)) {
        throw new SchemaNotFoundException(schema);
      }
      applySchema(connection, schema);
    } catch (SQLException e) {
      // Release connection on setup failure to prevent pool leak
      release(connection);
      throw translate("route session to " + schema, e);
    } catch (RuntimeException e) {
      release(connection);
      throw e;
    }
    return new SchemaSession(connection, schema, tenant);
  }

  static void applySchema(Connection connection, SchemaName schema) throws SQLException {
    connection.setSchema(schema.value());
    String active = connection.getSchema();
    if (!schema.value().equals(active)) {
      throw new SchemaNotFoundException(
          schema, "Active schema is '" + active + "' after routing to " + schema);
    }
  }

  static DataAccessException translate(String task, SQLException e) {
    DataAccessException translated = TRANSLATOR.translate(task, null, e);
    return translated != null ? translated : new UncategorizedSQLException(task, null, e);
  }

  private static boolean schemaExists(Connection connection, SchemaName schema)
      throws SQLException {
    try (PreparedStatement stmt = connection.prepareStatement(SCHEMA_EXISTS_SQL)) {
      stmt.setString(1, schema.value());
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() && rs.getInt(1) > 0;
      }
    }
  }

  private Connection acquire(SchemaName schema) {
    try {
      return dataSource.getConnection();
    } catch (SQLException e) {
      throw new DataAccessResourceFailureException(
          "Unable to acquire connection for schema " + schema, e);
    }
  }

  private void release(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      log.warn("Failed to release connection", e);
    }
  }
}
