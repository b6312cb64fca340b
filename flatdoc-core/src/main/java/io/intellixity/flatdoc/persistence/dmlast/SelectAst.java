package io.intellixity.flatdoc.persistence.dmlast;

import io.intellixity.flatdoc.persistence.query.OffsetPage;
import io.intellixity.flatdoc.persistence.query.SortField;

import java.util.List;
import java.util.Objects;

/**
 * Row read over one table.\n
 *
 * @param where           equality conjunction, empty for all rows
 * @param sort            column to order by, or null; rows are always finally ordered by {@code tieBreaker}
 * @param nullSortDefault value a NULL in the sort column sorts as
 * @param tieBreaker      unique column giving a total order, or null for unordered reads
 * @param page            offset/limit, or null for all rows
 */
public record SelectAst(
    String table,
    List<ColumnBind> where,
    SortField sort,
    String nullSortDefault,
    String tieBreaker,
    OffsetPage page
) {
  public SelectAst {
    Objects.requireNonNull(table, "table");
    where = where == null ? List.of() : List.copyOf(where);
    if (sort != null) Objects.requireNonNull(nullSortDefault, "nullSortDefault");
  }

  public static SelectAst all(String table, List<ColumnBind> where, String tieBreaker) {
    return new SelectAst(table, where, null, null, tieBreaker, null);
  }
}
