package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;
import java.util.Objects;

/** {@code CREATE TABLE IF NOT EXISTS} with text columns and a table-level primary key. */
public record CreateTableAst(
    String table,
    List<ColumnDef> columns,
    List<String> primaryKey
) implements DdlAst {
  public CreateTableAst {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
    if (columns.isEmpty()) throw new IllegalArgumentException("CreateTable has no columns");
  }

  public record ColumnDef(String name, boolean notNull, boolean unique) {
    public ColumnDef {
      Objects.requireNonNull(name, "name");
    }

    public static ColumnDef nullable(String name) {
      return new ColumnDef(name, false, false);
    }
  }
}
