package io.intellixity.flatdoc.persistence.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Introspected state of a collection table.\n
 *
 * Every collection table has the reserved {@value #ROW_ID} column. It is the primary key when no
 * {@code _pri} column was declared at creation, and a NOT NULL UNIQUE column otherwise.\n
 */
public record TableSchema(String table, Set<String> columns, List<String> primaryKey) {
  public static final String ROW_ID = "row_id";

  public TableSchema {
    Objects.requireNonNull(table, "table");
    columns = Collections.unmodifiableSet(new LinkedHashSet<>(columns == null ? Set.of() : columns));
    primaryKey = primaryKey == null ? List.of() : List.copyOf(primaryKey);
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /** Primary-key columns derived from {@code _pri} keys; empty when {@value #ROW_ID} is the key. */
  public List<String> declaredPrimaryKey() {
    List<String> out = new ArrayList<>(primaryKey);
    out.remove(ROW_ID);
    return out;
  }

  /** All columns except {@value #ROW_ID}. */
  public List<String> dataColumns() {
    List<String> out = new ArrayList<>(columns);
    out.remove(ROW_ID);
    return out;
  }

  public TableSchema withColumns(List<String> added) {
    Set<String> all = new LinkedHashSet<>(columns);
    all.addAll(added);
    return new TableSchema(table, all, primaryKey);
  }
}
