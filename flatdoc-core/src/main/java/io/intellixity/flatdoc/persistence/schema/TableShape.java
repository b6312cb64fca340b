package io.intellixity.flatdoc.persistence.schema;

import java.util.List;
import java.util.Objects;

/** Columns a write needs, with the primary-key and index flags derived from their flat keys. */
public record TableShape(
    String table,
    List<String> columns,
    List<String> primaryKey,
    List<String> indexed
) {
  public TableShape {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
    indexed = indexed == null ? List.of() : List.copyOf(indexed);
  }
}
