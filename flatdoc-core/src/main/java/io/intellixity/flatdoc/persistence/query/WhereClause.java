package io.intellixity.flatdoc.persistence.query;

import java.util.List;

/** Conjunction of equality conditions. */
public record WhereClause(List<Condition> conditions) {
  public WhereClause {
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  public static WhereClause of(Condition... conditions) {
    return new WhereClause(List.of(conditions));
  }
}
