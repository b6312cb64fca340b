package io.intellixity.flatdoc.persistence.jdbc;

import io.intellixity.flatdoc.persistence.dmlast.ColumnBind;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst.ColumnDef;
import io.intellixity.flatdoc.persistence.dmlast.InsertAst;
import io.intellixity.flatdoc.persistence.dmlast.SelectAst;
import io.intellixity.flatdoc.persistence.dmlast.UpsertAst;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.flatdoc.persistence.naming.NameMappingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link NameMappingStore} over one reserved table {@code (hashed_name PRIMARY KEY, original_name UNIQUE)}.\n
 *
 * Statements run auto-committed on their own connection, so a recorded mapping survives a rollback of the
 * write that introduced it. The engine may hand over a transaction connection instead
 * ({@link #useConnection(Supplier)}); lookups and inserts then run on it and commit or roll back with it.
 * Inserts are {@code ON CONFLICT DO NOTHING} followed by a read-back, which makes the
 * first writer win under concurrency.\n
 */
public final class JdbcNameMappingStore implements NameMappingStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcNameMappingStore.class);
  public static final String HASHED_NAME = "hashed_name";
  public static final String ORIGINAL_NAME = "original_name";
  private static final int CREATE_ATTEMPTS = 3;

  private final JdbcStatementExecutor exec;
  private final JdbcDialect dialect;
  private final String table;
  private volatile boolean tableReady;
  private volatile Supplier<Connection> connection = () -> null;

  public JdbcNameMappingStore(JdbcHandle handle, JdbcDialect dialect, String table) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.table = Objects.requireNonNull(table, "table");
    this.exec = new JdbcStatementExecutor(handle, dialect);
  }

  public String table() { return table; }

  /** Source of the connection inserts and lookups run on; a null connection means auto-commit. */
  void useConnection(Supplier<Connection> connection) {
    this.connection = Objects.requireNonNull(connection, "connection");
  }

  @Override
  public Map<String, String> load() {
    ensureTable();
    List<Map<String, String>> rows = exec.query(null, "MAPPING_LOAD", table,
        dialect.renderSelect(SelectAst.all(table, List.of(), null)));
    Map<String, String> out = new HashMap<>(rows.size() * 2);
    for (Map<String, String> row : rows) out.put(row.get(HASHED_NAME), row.get(ORIGINAL_NAME));
    return out;
  }

  @Override
  public String insertIfAbsent(String hashedName, String originalName) {
    Objects.requireNonNull(hashedName, "hashedName");
    Objects.requireNonNull(originalName, "originalName");
    ensureTable();
    InsertAst ins = new InsertAst(table, List.of(
        new ColumnBind(HASHED_NAME, hashedName),
        new ColumnBind(ORIGINAL_NAME, originalName)));
    long n = exec.update(connection.get(), "MAPPING_INSERT", table, dialect.renderDml(new UpsertAst(ins, List.of(), List.of())));
    if (n > 0) log.debug("flatdoc.naming recorded hashedName={} originalName={}", hashedName, originalName);
    return findOriginal(hashedName);
  }

  @Override
  public String findOriginal(String hashedName) {
    ensureTable();
    List<Map<String, String>> rows = exec.query(connection.get(), "MAPPING_FIND", table,
        dialect.renderSelect(SelectAst.all(table, List.of(new ColumnBind(HASHED_NAME, hashedName)), null)));
    return rows.isEmpty() ? null : rows.get(0).get(ORIGINAL_NAME);
  }

  private void ensureTable() {
    if (tableReady) return;
    synchronized (this) {
      if (tableReady) return;
      CreateTableAst ddl = new CreateTableAst(table,
          List.of(new ColumnDef(HASHED_NAME, true, false), new ColumnDef(ORIGINAL_NAME, true, true)),
          List.of(HASHED_NAME));
      for (int attempt = 1; ; attempt++) {
        try {
          exec.update(null, "CREATE_TABLE", table, dialect.renderDdl(ddl));
          break;
        } catch (StorageFailureException e) {
          // Another process creating the table at the same moment.
          if (!e.retryable() || attempt >= CREATE_ATTEMPTS) throw e;
        }
      }
      tableReady = true;
      log.debug("flatdoc.naming mapping table ready table={}", table);
    }
  }
}
