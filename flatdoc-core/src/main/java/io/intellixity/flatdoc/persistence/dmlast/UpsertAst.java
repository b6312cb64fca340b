package io.intellixity.flatdoc.persistence.dmlast;

import java.util.List;

/**
 * Insert that resolves a key conflict.\n
 *
 * Empty {@code updateColumns} means the conflicting insert is skipped (DO NOTHING). Empty
 * {@code conflictColumns} means any unique constraint counts as the conflict target.\n
 */
public record UpsertAst(
    InsertAst insert,
    List<String> conflictColumns,
    List<String> updateColumns
) implements DmlAst {
  public UpsertAst {
    conflictColumns = conflictColumns == null ? List.of() : List.copyOf(conflictColumns);
    updateColumns = updateColumns == null ? List.of() : List.copyOf(updateColumns);
  }
}
