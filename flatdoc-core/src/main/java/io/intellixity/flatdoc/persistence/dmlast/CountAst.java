package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;

public record CountAst(String table, List<ColumnBind> where) {
  public CountAst {
    where = where == null ? List.of() : List.copyOf(where);
  }
}
