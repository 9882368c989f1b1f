package io.b2mash.b2b.tenantcore.multitenancy;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Data access over one pooled connection confined to one schema. Obtained from {@link
 * SchemaRouter}; must be closed, which resets the connection to the shared schema and returns it to
 * the pool.
 *
 * <p>Not thread-safe. A session belongs to the unit of work that opened it.
 */
public class SchemaSession implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(SchemaSession.class);

  private final Connection connection;
  private final SchemaName schema;
  private final TenantContext tenant;
  private final SessionStatementGuard guard;
  private final SingleConnectionDataSource sessionDataSource;
  private final JdbcClient jdbcClient;
  private final TransactionTemplate transactionTemplate;
  private boolean closed;

  SchemaSession(Connection connection, SchemaName schema, TenantContext tenant) {
    this.connection = connection;
    this.schema = schema;
    this.tenant = tenant;
    this.guard = new SessionStatementGuard(schema);
    this.sessionDataSource = new SingleConnectionDataSource(connection, true);
    this.jdbcClient = JdbcClient.create(sessionDataSource);
    this.transactionTemplate =
        new TransactionTemplate(new DataSourceTransactionManager(sessionDataSource));
  }

  public SchemaName schema() {
    return schema;
  }

  /** The tenant this session was opened for; empty for shared-schema sessions. */
  public Optional<TenantContext> tenant() {
    return Optional.ofNullable(tenant);
  }

  /** Starts a statement on this session's connection. */
  public JdbcClient.StatementSpec sql(String sql) {
    ensureOpen();
    guard.check(sql);
    return jdbcClient.sql(sql);
  }

  /**
   * Runs {@code work} in one transaction on this session's connection. Statements issued through
   * {@link #sql} inside the callback join the transaction.
   */
  public <T> T inTransaction(Function<SchemaSession, T> work) {
    ensureOpen();
    return transactionTemplate.execute(status -> work.apply(this));
  }

  public void runInTransaction(Consumer<SchemaSession> work) {
    inTransaction(
        session -> {
          work.accept(session);
          return null;
        });
  }

  /**
   * Hands {@code work} a data source whose every connection is this session's connection, for
   * tools such as Flyway that issue their own statements. Those statements bypass the session's
   * guard, so the schema is asserted again once {@code work} returns.
   */
  public <T> T withDataSource(Function<DataSource, T> work) {
    ensureOpen();
    T result;
    try {
      result = work.apply(sessionDataSource);
    } catch (RuntimeException e) {
      try {
        reassertSchema();
      } catch (RuntimeException reassertFailure) {
        e.addSuppressed(reassertFailure);
      }
      throw e;
    }
    reassertSchema();
    return result;
  }

  public QualifiedName qualify(String table) {
    return schema.qualify(table);
  }

  /**
   * Issues the active-schema directive again and verifies it took effect. Used before work that
   * must not trust anything done to the connection since it was opened.
   */
  public void reassertSchema() {
    ensureOpen();
    try {
      SchemaRouter.applySchema(connection, schema);
    } catch (SQLException e) {
      throw SchemaRouter.translate("reassert schema " + schema, e);
    }
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (!connection.isClosed() && !SchemaName.SHARED.value().equals(connection.getSchema())) {
        connection.setSchema(SchemaName.SHARED.value());
      }
    } catch (SQLException e) {
      log.warn("Failed to reset schema {} to shared on release", schema, e);
    } finally {
      try {
        connection.close();
      } catch (SQLException e) {
        log.warn("Failed to release connection for schema {}", schema, e);
      }
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new ContextMisuseException("Session for schema " + schema + " is already closed");
    }
  }
}
