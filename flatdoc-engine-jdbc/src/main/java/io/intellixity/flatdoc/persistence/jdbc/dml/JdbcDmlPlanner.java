package io.intellixity.flatdoc.persistence.jdbc.dml;

import io.intellixity.flatdoc.persistence.dmlast.ColumnBind;
import io.intellixity.flatdoc.persistence.dmlast.DeleteAst;
import io.intellixity.flatdoc.persistence.dmlast.DmlPlanner;
import io.intellixity.flatdoc.persistence.dmlast.InsertAst;
import io.intellixity.flatdoc.persistence.dmlast.UpdateAst;
import io.intellixity.flatdoc.persistence.dmlast.UpsertAst;
import io.intellixity.flatdoc.persistence.document.FlatDocument;
import io.intellixity.flatdoc.persistence.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** JDBC-family DML planner (flat document to column binds). No DB-specific defaults. */
public final class JdbcDmlPlanner implements DmlPlanner {

  @Override
  public InsertAst planInsert(String table, String rowId, FlatDocument doc) {
    Objects.requireNonNull(rowId, "rowId");
    List<ColumnBind> cols = new ArrayList<>(doc.values().size() + 1);
    cols.add(new ColumnBind(TableSchema.ROW_ID, rowId));
    cols.addAll(binds(doc));
    return new InsertAst(requireTable(table), cols);
  }

  @Override
  public UpsertAst planUpsert(TableSchema schema, String rowId, FlatDocument doc) {
    List<String> conflictCols = schema.declaredPrimaryKey();
    if (conflictCols.isEmpty()) {
      throw new IllegalArgumentException("Upsert needs a declared primary key: " + schema.table());
    }
    InsertAst ins = planInsert(schema.table(), rowId, doc);

    // Replace semantics: every stored data column is rewritten, so columns missing from doc become NULL.
    List<String> updateCols = new ArrayList<>();
    for (String c : schema.dataColumns()) {
      if (!conflictCols.contains(c)) updateCols.add(c);
    }
    return new UpsertAst(ins, conflictCols, updateCols);
  }

  @Override
  public UpdateAst planUpdate(String table, FlatDocument sets, List<String> clears, List<ColumnBind> where) {
    if (sets.isEmpty()) throw new IllegalArgumentException("Update has no SET columns: " + table);
    requireWhere(table, where);
    for (String c : clears) {
      if (sets.values().containsKey(c)) throw new IllegalArgumentException("Column both set and cleared: " + c);
    }
    return new UpdateAst(requireTable(table), binds(sets), clears, where);
  }

  @Override
  public DeleteAst planDelete(String table, List<ColumnBind> where) {
    requireWhere(table, where);
    return new DeleteAst(requireTable(table), where);
  }

  private static List<ColumnBind> binds(FlatDocument doc) {
    List<ColumnBind> out = new ArrayList<>(doc.values().size());
    for (Map.Entry<String, String> e : doc.values().entrySet()) {
      out.add(new ColumnBind(e.getKey(), e.getValue()));
    }
    return out;
  }

  private static String requireTable(String t) {
    if (t == null || t.isBlank()) throw new IllegalArgumentException("DML has no table");
    return t;
  }

  // Unfiltered writes are never planned; every update/delete targets rows by condition or row id.
  private static void requireWhere(String table, List<ColumnBind> where) {
    if (where == null || where.isEmpty()) {
      throw new IllegalArgumentException("Refusing unfiltered write on table: " + table);
    }
  }
}
