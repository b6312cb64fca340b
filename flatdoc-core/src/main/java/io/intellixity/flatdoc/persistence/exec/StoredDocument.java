package io.intellixity.flatdoc.persistence.exec;

import java.util.Map;
import java.util.Objects;

/** A reconstructed document and the row id it is stored under. */
public record StoredDocument(String rowId, Map<String, Object> document) {
  public StoredDocument {
    Objects.requireNonNull(rowId, "rowId");
    Objects.requireNonNull(document, "document");
  }
}
