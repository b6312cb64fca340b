package io.intellixity.flatdoc.persistence.dmlast;

import java.util.Objects;

/** A column paired with the text value bound for it. */
public record ColumnBind(String column, String value) {
  public ColumnBind {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(value, "value");
  }
}
