package io.intellixity.flatdoc.persistence.document;

import io.intellixity.flatdoc.persistence.schema.TableShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of flattening one document.\n
 *
 * @param values   column identifier to stored text
 * @param flatKeys column identifier to the flat key it encodes
 */
public record FlatDocument(Map<String, String> values, Map<String, String> flatKeys) {
  public FlatDocument {
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    flatKeys = Collections.unmodifiableMap(new LinkedHashMap<>(flatKeys));
  }

  public boolean isEmpty() { return values.isEmpty(); }

  public List<String> columns() { return List.copyOf(values.keySet()); }

  public List<String> primaryKeyColumns() {
    List<String> out = new ArrayList<>();
    for (var e : flatKeys.entrySet()) {
      if (KeyConventions.isPrimaryKey(e.getValue())) out.add(e.getKey());
    }
    return out;
  }

  public List<String> indexColumns() {
    List<String> out = new ArrayList<>();
    for (var e : flatKeys.entrySet()) {
      if (KeyConventions.isIndexed(e.getValue())) out.add(e.getKey());
    }
    return out;
  }

  /** Desired table shape for a write of this document into {@code table}. */
  public TableShape shape(String table) {
    return new TableShape(table, columns(), primaryKeyColumns(), indexColumns());
  }
}
