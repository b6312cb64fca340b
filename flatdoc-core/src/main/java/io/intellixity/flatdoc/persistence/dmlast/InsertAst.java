package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;

public record InsertAst(
    String table,
    List<ColumnBind> columns
) implements DmlAst {
  public InsertAst {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
