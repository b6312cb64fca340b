package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;

public record DeleteAst(
    String table,
    List<ColumnBind> where
) implements DmlAst {
  public DeleteAst {
    where = where == null ? List.of() : List.copyOf(where);
  }
}
