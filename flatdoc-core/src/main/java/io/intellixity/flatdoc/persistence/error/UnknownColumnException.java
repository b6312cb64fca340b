package io.intellixity.flatdoc.persistence.error;

/** No flat key is recorded for the column identifier. */
public final class UnknownColumnException extends FlatdocException {
  private final String columnId;

  public UnknownColumnException(String columnId) {
    super("No flat key recorded for column '" + columnId + "'");
    this.columnId = columnId;
  }

  public String columnId() { return columnId; }
}
