package io.intellixity.flatdoc.persistence.jdbc.postgres;

import io.intellixity.flatdoc.persistence.dmlast.AddColumnAst;
import io.intellixity.flatdoc.persistence.dmlast.UpsertAst;
import io.intellixity.flatdoc.persistence.jdbc.SqlStatement;
import io.intellixity.flatdoc.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.flatdoc.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.flatdoc.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.flatdoc.persistence.query.OffsetPage;

import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides (introspection, ADD COLUMN IF NOT EXISTS, error classes).\n
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  /** NAMEDATALEN - 1. */
  public static final int MAX_IDENTIFIER_LENGTH = 63;

  private static final String DUPLICATE_TABLE = "42P07";
  private static final String DUPLICATE_COLUMN = "42701";
  private static final String DUPLICATE_OBJECT = "42710";
  private static final String UNIQUE_VIOLATION = "23505";

  private static final String COLUMNS_SQL =
      "SELECT c.column_name AS " + COLUMN_NAME + ", COALESCE(k.ordinal_position, 0) AS " + PK_POSITION +
          " FROM information_schema.columns c" +
          " LEFT JOIN information_schema.table_constraints tc" +
          " ON tc.table_schema = c.table_schema AND tc.table_name = c.table_name" +
          " AND tc.constraint_type = 'PRIMARY KEY'" +
          " LEFT JOIN information_schema.key_column_usage k" +
          " ON k.constraint_schema = tc.constraint_schema AND k.constraint_name = tc.constraint_name" +
          " AND k.table_name = c.table_name AND k.column_name = c.column_name" +
          " WHERE c.table_schema = current_schema() AND c.table_name = :b1" +
          " ORDER BY c.ordinal_position";

  @Override public String id() { return "postgres"; }

  @Override public int maxIdentifierLength() { return MAX_IDENTIFIER_LENGTH; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  public SqlStatement renderColumnsQuery(String table) {
    return new SqlStatement(COLUMNS_SQL, List.of(table), ExecKind.QUERY);
  }

  @Override
  protected String renderAddColumn(AddColumnAst ac) {
    return "ALTER TABLE " + quoteIdent(ac.table()) + " ADD COLUMN IF NOT EXISTS " + quoteIdent(ac.column()) +
        " " + COLUMN_TYPE;
  }

  @Override
  protected SqlStatement applyOffsetPage(SqlStatement base, OffsetPage page) {
    String sql = base.sql() + " LIMIT " + page.limit() + " OFFSET " + page.offset();
    return new SqlStatement(sql, base.binds(), base.execKind());
  }

  @Override
  protected SqlStatement renderUpsert(UpsertAst ups) {
    SqlStatement insertBase = renderInsert(ups.insert(), new RenderCtx());
    return new SqlStatement(insertBase.sql() + onConflictClause(ups), insertBase.binds(), ExecKind.UPDATE);
  }

  /**
   * Concurrent {@code CREATE ... IF NOT EXISTS} can still fail: the catalog insert of the loser hits a unique
   * index on pg_type/pg_class (23505), or the object shows up between the existence check and the create.\n
   */
  @Override
  public boolean isSchemaRace(SQLException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (!(t instanceof SQLException se)) continue;
      String state = se.getSQLState();
      if (DUPLICATE_TABLE.equals(state) || DUPLICATE_COLUMN.equals(state) || DUPLICATE_OBJECT.equals(state)) {
        return true;
      }
      if (UNIQUE_VIOLATION.equals(state)) {
        String msg = (se.getMessage() == null) ? "" : se.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("pg_type") || msg.contains("pg_class")) return true;
      }
    }
    return false;
  }
}
