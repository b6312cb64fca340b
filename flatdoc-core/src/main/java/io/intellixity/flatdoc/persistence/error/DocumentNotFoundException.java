package io.intellixity.flatdoc.persistence.error;

public final class DocumentNotFoundException extends FlatdocException {
  private final String collection;
  private final String rowId;

  public DocumentNotFoundException(String collection, String rowId) {
    super("No document with row_id '" + rowId + "' in collection '" + collection + "'");
    this.collection = collection;
    this.rowId = rowId;
  }

  public String collection() { return collection; }
  public String rowId() { return rowId; }
}
