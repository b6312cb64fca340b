package io.intellixity.flatdoc.persistence.dmlast;

import io.intellixity.flatdoc.persistence.document.FlatDocument;
import io.intellixity.flatdoc.persistence.schema.TableSchema;

import java.util.List;

/** Backend-family planner that maps flattened documents into backend-agnostic DML ASTs. */
public interface DmlPlanner {
  /** Plain insert of a new row under {@code rowId}. */
  InsertAst planInsert(String table, String rowId, FlatDocument doc);

  /**
   * Insert keyed on the table's declared primary key that replaces the whole row on conflict while keeping the
   * stored row id. Columns of {@code schema} absent from {@code doc} become NULL.\n
   */
  UpsertAst planUpsert(TableSchema schema, String rowId, FlatDocument doc);

  /** Set {@code sets} and NULL out {@code clears} on every row matching {@code where}. */
  UpdateAst planUpdate(String table, FlatDocument sets, List<String> clears, List<ColumnBind> where);

  default UpdateAst planUpdate(String table, FlatDocument sets, List<ColumnBind> where) {
    return planUpdate(table, sets, List.of(), where);
  }

  DeleteAst planDelete(String table, List<ColumnBind> where);
}
