package io.intellixity.flatdoc.persistence.jdbc.dialect;

import io.intellixity.flatdoc.persistence.dmlast.AddColumnAst;
import io.intellixity.flatdoc.persistence.dmlast.ColumnBind;
import io.intellixity.flatdoc.persistence.dmlast.CountAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateIndexAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst.ColumnDef;
import io.intellixity.flatdoc.persistence.dmlast.DdlAst;
import io.intellixity.flatdoc.persistence.dmlast.DeleteAst;
import io.intellixity.flatdoc.persistence.dmlast.DmlAst;
import io.intellixity.flatdoc.persistence.dmlast.InsertAst;
import io.intellixity.flatdoc.persistence.dmlast.SelectAst;
import io.intellixity.flatdoc.persistence.dmlast.UpdateAst;
import io.intellixity.flatdoc.persistence.dmlast.UpsertAst;
import io.intellixity.flatdoc.persistence.jdbc.SqlStatement;
import io.intellixity.flatdoc.persistence.jdbc.SqlStatement.ExecKind;
import io.intellixity.flatdoc.persistence.query.OffsetPage;
import io.intellixity.flatdoc.persistence.query.SortField;

import java.util.ArrayList;
import java.util.List;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - DML: insert/update/delete and {@code ON CONFLICT} upserts from DmlAst\n
 * - DDL: text-column tables, added columns, single-column indexes\n
 * - reads: equality filter + null-defaulted sort with a row-id tie-breaker + paging\n
 *
 * Every value travels as a {@code :bN} bind; identifiers are always quoted. DB-specific dialects override
 * hooks for quoting, paging, column introspection and ADD COLUMN syntax.\n
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final String COLUMN_TYPE = "TEXT";

  protected static final class RenderCtx {
    private int n = 1;
    private final List<String> binds = new ArrayList<>();

    public RenderCtx() {}

    public String add(String value) {
      binds.add(value);
      return ":b" + (n++);
    }

    public List<String> binds() { return binds; }
  }

  @Override
  public final SqlStatement renderDml(DmlAst dml) {
    if (dml instanceof UpsertAst ups) return renderUpsert(ups);
    if (dml instanceof InsertAst ins) return renderInsert(ins, new RenderCtx());
    if (dml instanceof UpdateAst upd) return renderUpdate(upd);
    if (dml instanceof DeleteAst del) return renderDelete(del);
    throw new IllegalArgumentException("Unknown DmlAst: " + dml);
  }

  @Override
  public final SqlStatement renderDdl(DdlAst ddl) {
    if (ddl instanceof CreateTableAst ct) return new SqlStatement(renderCreateTable(ct), List.of(), ExecKind.UPDATE);
    if (ddl instanceof AddColumnAst ac) return new SqlStatement(renderAddColumn(ac), List.of(), ExecKind.UPDATE);
    if (ddl instanceof CreateIndexAst ci) {
      String sql = "CREATE INDEX IF NOT EXISTS " + quoteIdent(ci.name()) +
          " ON " + quoteIdent(ci.table()) + " (" + quoteIdent(ci.column()) + ")";
      return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
    }
    throw new IllegalArgumentException("Unknown DdlAst: " + ddl);
  }

  @Override
  public final SqlStatement renderSelect(SelectAst select) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(quoteIdent(select.table()));
    sql.append(renderWhere(select.where(), ctx));

    List<String> order = new ArrayList<>();
    SortField sort = select.sort();
    if (sort != null) {
      // NULLs sort as the configured default so pages interleave them deterministically.
      String fallback = ctx.add(select.nullSortDefault());
      order.add("COALESCE(" + quoteIdent(sort.field()) + ", " + fallback + ")" + direction(sort.direction()));
    }
    if (select.tieBreaker() != null) order.add(quoteIdent(select.tieBreaker()) + " ASC");
    if (!order.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", order));

    SqlStatement base = new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY);
    return (select.page() == null) ? base : applyOffsetPage(base, select.page());
  }

  @Override
  public final SqlStatement renderCount(CountAst count) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT COUNT(1) AS " + quoteIdent("n") + " FROM " + quoteIdent(count.table()) +
        renderWhere(count.where(), ctx);
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  protected String renderCreateTable(CreateTableAst ct) {
    List<String> parts = new ArrayList<>();
    for (ColumnDef c : ct.columns()) {
      StringBuilder def = new StringBuilder(quoteIdent(c.name())).append(' ').append(COLUMN_TYPE);
      if (c.notNull()) def.append(" NOT NULL");
      if (c.unique()) def.append(" UNIQUE");
      parts.add(def.toString());
    }
    if (!ct.primaryKey().isEmpty()) {
      parts.add("PRIMARY KEY (" + joinIdents(ct.primaryKey()) + ")");
    }
    return "CREATE TABLE IF NOT EXISTS " + quoteIdent(ct.table()) + " (" + String.join(", ", parts) + ")";
  }

  /** Default has no IF NOT EXISTS; dialects that support it override. */
  protected String renderAddColumn(AddColumnAst ac) {
    return "ALTER TABLE " + quoteIdent(ac.table()) + " ADD COLUMN " + quoteIdent(ac.column()) + " " + COLUMN_TYPE;
  }

  /** Paging is dialect syntax (LIMIT/OFFSET, OFFSET/FETCH, ...). */
  protected abstract SqlStatement applyOffsetPage(SqlStatement base, OffsetPage page);

  protected SqlStatement renderInsert(InsertAst ins, RenderCtx ctx) {
    if (ins.columns().isEmpty()) throw new IllegalArgumentException("Insert has no columns");
    List<String> cols = new ArrayList<>();
    List<String> ph = new ArrayList<>();
    for (ColumnBind cb : ins.columns()) {
      cols.add(quoteIdent(cb.column()));
      ph.add(ctx.add(cb.value()));
    }
    String sql = "INSERT INTO " + quoteIdent(ins.table()) +
        " (" + String.join(", ", cols) + ") VALUES (" + String.join(", ", ph) + ")";
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderUpdate(UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) {
      sets.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.value()));
    }
    for (String c : upd.clears()) sets.add(quoteIdent(c) + " = NULL");
    String sql = "UPDATE " + quoteIdent(upd.table()) + " SET " + String.join(", ", sets) +
        renderWhere(upd.where(), ctx);
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  protected SqlStatement renderDelete(DeleteAst del) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + quoteIdent(del.table()) + renderWhere(del.where(), ctx);
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  /** DB-specific upsert. */
  protected abstract SqlStatement renderUpsert(UpsertAst ups);

  /**
   * {@code ON CONFLICT} clause shared by dialects with PostgreSQL-style upserts: {@code DO NOTHING} when there
   * are no update columns, otherwise every update column takes the value from {@code EXCLUDED}.\n
   */
  protected String onConflictClause(UpsertAst ups) {
    StringBuilder sql = new StringBuilder(" ON CONFLICT");
    if (!ups.conflictColumns().isEmpty()) {
      sql.append(" (").append(joinIdents(ups.conflictColumns())).append(")");
    }
    if (ups.updateColumns().isEmpty()) return sql.append(" DO NOTHING").toString();
    if (ups.conflictColumns().isEmpty()) throw new IllegalArgumentException("Upsert with updates has no conflict columns");
    sql.append(" DO UPDATE SET ");
    sql.append(String.join(", ", ups.updateColumns().stream()
        .map(c -> quoteIdent(c) + " = EXCLUDED." + quoteIdent(c))
        .toList()));
    return sql.toString();
  }

  protected String renderWhere(List<ColumnBind> where, RenderCtx ctx) {
    if (where == null || where.isEmpty()) return "";
    List<String> terms = new ArrayList<>(where.size());
    for (ColumnBind cb : where) {
      terms.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.value()));
    }
    return " WHERE " + String.join(" AND ", terms);
  }

  protected String joinIdents(List<String> idents) {
    return String.join(", ", idents.stream().map(this::quoteIdent).toList());
  }

  private static String direction(SortField.Direction d) {
    return (d == SortField.Direction.DESC) ? " DESC" : " ASC";
  }

  protected abstract String quoteIdent(String ident);
}
