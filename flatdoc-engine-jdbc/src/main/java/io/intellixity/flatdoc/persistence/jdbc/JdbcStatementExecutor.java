package io.intellixity.flatdoc.persistence.jdbc;

import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs {@link SqlStatement}s on a handle's connections.\n
 *
 * With a transaction connection the statement runs on it; without one a connection is borrowed (auto-commit)
 * and closed afterwards. {@link SQLException}s become {@link StorageFailureException}s, flagged retryable when
 * the dialect classifies them as a schema race.\n
 */
public final class JdbcStatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcStatementExecutor.class);

  private final JdbcHandle handle;
  private final JdbcDialect dialect;

  public JdbcStatementExecutor(JdbcHandle handle, JdbcDialect dialect) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** Borrow a connection with the handle's schema applied. */
  public Connection open() throws SQLException {
    Connection c = handle.client().getConnection();
    if (handle.schema() != null) {
      try {
        c.setSchema(handle.schema());
      } catch (SQLException e) {
        c.close();
        throw e;
      }
    }
    return c;
  }

  public List<Map<String, String>> query(Connection txConnOrNull, String op, String table, SqlStatement ss) {
    requireKind(ss, ExecKind.QUERY, op);
    try {
      Connection c = (txConnOrNull == null) ? open() : txConnOrNull;
      try {
        String jdbcSql = prepareSql(ss);
        long start = System.nanoTime();
        debugSql(op, table, ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            List<Map<String, String>> out = new JdbcRowAdapter(rs).readAll();
            debugDone(op, table, out.size(), System.nanoTime() - start);
            return out;
          }
        }
      } finally {
        if (txConnOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw failure(op, table, e);
    }
  }

  public long update(Connection txConnOrNull, String op, String table, SqlStatement ss) {
    requireKind(ss, ExecKind.UPDATE, op);
    try {
      Connection c = (txConnOrNull == null) ? open() : txConnOrNull;
      try {
        String jdbcSql = prepareSql(ss);
        long start = System.nanoTime();
        debugSql(op, table, ss, jdbcSql);
        try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
          bindAll(ps, ss);
          long n = ps.executeUpdate();
          debugDone(op, table, n, System.nanoTime() - start);
          return n;
        }
      } finally {
        if (txConnOrNull == null) c.close();
      }
    } catch (SQLException e) {
      throw failure(op, table, e);
    }
  }

  /** Wrap and log a driver failure. */
  public StorageFailureException failure(String op, String table, SQLException e) {
    boolean race = dialect.isSchemaRace(e);
    log.warn("flatdoc.jdbc_failed op={} table={} sqlState={} errorCode={} schemaRace={} handleId={} message={}",
        op, table, e.getSQLState(), e.getErrorCode(), race, handle.id(), e.getMessage());
    return new StorageFailureException(op, table, race, e.getMessage(), e);
  }

  private static String prepareSql(SqlStatement ss) {
    int params = SqlParamCompiler.paramCount(ss.sql());
    if (params != ss.binds().size()) {
      throw new IllegalStateException("Statement has " + params + " params but " + ss.binds().size() +
          " binds: " + ss.sql());
    }
    return SqlParamCompiler.toJdbcSql(ss.sql());
  }

  private static void requireKind(SqlStatement ss, ExecKind expected, String op) {
    if (ss.execKind() != expected) {
      throw new IllegalArgumentException("Invalid execKind=" + ss.execKind() + " for op=" + op + "; expected " + expected);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) {
      ps.setString(i + 1, ss.binds().get(i));
    }
  }

  private void debugSql(String op, String table, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("flatdoc.jdbc op={} execKind={} table={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), table, ss.binds().size(), handle.id(), handle.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (String b : ss.binds()) {
        log.trace("flatdoc.jdbc bind index={} valueLen={}", idx++, b.length());
      }
    }
  }

  private static void debugDone(String op, String table, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("flatdoc.jdbc_done op={} table={} durationMs={} result={}",
        op, table, durationNanos / 1_000_000.0, result);
  }
}
