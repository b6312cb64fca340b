package io.intellixity.flatdoc.persistence.jdbc.sqlite;

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
 * SQLite dialect implementation for JDBC.\n
 *
 * SQLite has no {@code ADD COLUMN IF NOT EXISTS}; a concurrent add surfaces as "duplicate column name" and is
 * reported as a schema race. The database takes one writer at a time, so the engine serializes all writes.\n
 */
public final class SqliteDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  /** SQLite has no hard limit; this keeps table names readable and portable. */
  public static final int MAX_IDENTIFIER_LENGTH = 255;

  private static final String COLUMNS_SQL =
      "SELECT name AS " + COLUMN_NAME + ", pk AS " + PK_POSITION + " FROM pragma_table_info(:b1) ORDER BY cid";

  @Override public String id() { return "sqlite"; }

  @Override public int maxIdentifierLength() { return MAX_IDENTIFIER_LENGTH; }

  @Override public boolean singleWriter() { return true; }

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
  protected SqlStatement applyOffsetPage(SqlStatement base, OffsetPage page) {
    String sql = base.sql() + " LIMIT " + page.limit() + " OFFSET " + page.offset();
    return new SqlStatement(sql, base.binds(), base.execKind());
  }

  @Override
  protected SqlStatement renderUpsert(UpsertAst ups) {
    SqlStatement insertBase = renderInsert(ups.insert(), new RenderCtx());
    return new SqlStatement(insertBase.sql() + onConflictClause(ups), insertBase.binds(), ExecKind.UPDATE);
  }

  @Override
  public boolean isSchemaRace(SQLException e) {
    String msg = (e.getMessage() == null) ? "" : e.getMessage().toLowerCase(Locale.ROOT);
    return msg.contains("duplicate column name") || msg.contains("already exists");
  }
}
