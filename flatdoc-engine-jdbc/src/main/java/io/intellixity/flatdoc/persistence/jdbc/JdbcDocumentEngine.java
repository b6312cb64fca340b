package io.intellixity.flatdoc.persistence.jdbc;

import io.intellixity.flatdoc.persistence.dmlast.DmlPlanner;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.exec.EngineSettings;
import io.intellixity.flatdoc.persistence.exec.Propagation;
import io.intellixity.flatdoc.persistence.exec.TxHandle;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.flatdoc.persistence.jdbc.dml.JdbcDmlPlanner;
import io.intellixity.flatdoc.persistence.spi.exec.AbstractDocumentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class JdbcDocumentEngine extends AbstractDocumentEngine<SqlStatement, JdbcHandle> {
  private static final Logger log = LoggerFactory.getLogger(JdbcDocumentEngine.class);
  private final JdbcStatementExecutor exec;

  public JdbcDocumentEngine(JdbcHandle handle,
                            JdbcDialect dialect,
                            DmlPlanner dmlPlanner,
                            EngineSettings settings,
                            Propagation defaultPropagation) {
    this(handle, dialect, dmlPlanner, settings, defaultPropagation,
        new JdbcNameMappingStore(Objects.requireNonNull(handle, "handle"), dialect,
            (settings == null ? EngineSettings.defaults() : settings).mappingTable()));
  }

  private JdbcDocumentEngine(JdbcHandle handle,
                             JdbcDialect dialect,
                             DmlPlanner dmlPlanner,
                             EngineSettings settings,
                             Propagation defaultPropagation,
                             JdbcNameMappingStore mappingStore) {
    super(dialect, handle, Objects.requireNonNull(dmlPlanner, "dmlPlanner"), mappingStore, settings, defaultPropagation);
    this.exec = new JdbcStatementExecutor(handle, dialect);
    mappingStore.useConnection(() -> mappingJoinsTransaction() ? connection(currentTxOrNull()) : null);
    log.info("flatdoc.engine started handleId={} dialect={} schema={} mappingTable={} knownColumns={}",
        handle.id(), dialect.id(), handle.schema(), settings().mappingTable(), names().size());
  }

  public JdbcDocumentEngine(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, new JdbcDmlPlanner(), EngineSettings.defaults(), Propagation.REQUIRED);
  }

  /** Convenience constructor: wraps a raw DataSource into a handle using the connection's default schema. */
  public JdbcDocumentEngine(DataSource ds, JdbcDialect dialect) {
    this(new JdbcHandle("jdbc", ds, null), dialect);
  }

  @Override
  protected TxHandle begin() {
    Connection c = null;
    try {
      c = exec.open();
      c.setAutoCommit(false);
      return new JdbcTxHandle(c);
    } catch (SQLException e) {
      closeQuietly(c, e);
      throw exec.failure("BEGIN", null, e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      j.conn().commit();
    } catch (SQLException e) {
      StorageFailureException failure = exec.failure("COMMIT", null, e);
      try {
        j.conn().rollback();
      } catch (SQLException re) {
        failure.addSuppressed(re);
      }
      throw failure;
    } finally {
      release(j);
    }
  }

  @Override
  protected void rollback(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      j.conn().rollback();
    } catch (SQLException e) {
      throw exec.failure("ROLLBACK", null, e);
    } finally {
      release(j);
    }
  }

  @Override
  protected List<Map<String, String>> executeQuery(TxHandle txOrNull, String op, String table, SqlStatement stmt) {
    return exec.query(connection(txOrNull), op, table, stmt);
  }

  @Override
  protected long executeUpdate(TxHandle txOrNull, String op, String table, SqlStatement stmt) {
    return exec.update(connection(txOrNull), op, table, stmt);
  }

  private static Connection connection(TxHandle txOrNull) {
    return (txOrNull == null) ? null : ((JdbcTxHandle) txOrNull).conn();
  }

  private void release(JdbcTxHandle j) {
    Connection c = j.conn();
    try {
      c.setAutoCommit(true);
    } catch (SQLException e) {
      log.warn("flatdoc.jdbc_release_failed handleId={} step=autoCommit sqlState={} message={}",
          handle().id(), e.getSQLState(), e.getMessage());
    }
    try {
      c.close();
    } catch (SQLException e) {
      log.warn("flatdoc.jdbc_release_failed handleId={} step=close sqlState={} message={}",
          handle().id(), e.getSQLState(), e.getMessage());
    }
  }

  private static void closeQuietly(Connection c, SQLException primary) {
    if (c == null) return;
    try {
      c.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  public record JdbcTxHandle(Connection conn) implements TxHandle {}
}
