package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;

/**
 * @param clears columns set to NULL by the same statement
 */
public record UpdateAst(
    String table,
    List<ColumnBind> sets,
    List<String> clears,
    List<ColumnBind> where
) implements DmlAst {
  public UpdateAst {
    sets = sets == null ? List.of() : List.copyOf(sets);
    clears = clears == null ? List.of() : List.copyOf(clears);
    where = where == null ? List.of() : List.copyOf(where);
  }

  public UpdateAst(String table, List<ColumnBind> sets, List<ColumnBind> where) {
    this(table, sets, List.of(), where);
  }
}
