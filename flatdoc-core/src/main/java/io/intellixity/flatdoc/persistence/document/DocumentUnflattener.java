package io.intellixity.flatdoc.persistence.document;

import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.error.UnknownColumnException;
import io.intellixity.flatdoc.persistence.naming.ColumnNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rebuilds nested documents from flat rows.\n
 *
 * Input rows map column identifiers to text and must already be free of NULL values. Columns without a
 * recorded flat key are kept under their identifier as an opaque top-level key.\n
 */
public final class DocumentUnflattener {
  private static final Logger log = LoggerFactory.getLogger(DocumentUnflattener.class);

  private final ColumnNames names;

  public DocumentUnflattener(ColumnNames names) {
    this.names = Objects.requireNonNull(names, "names");
  }

  public List<Map<String, Object>> unflattenAll(List<Map<String, String>> rows) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) out.add(unflatten(row));
    return out;
  }

  public Map<String, Object> unflatten(Map<String, String> row) {
    Objects.requireNonNull(row, "row");
    TreeMap<String, String> byKey = new TreeMap<>();
    for (var e : row.entrySet()) {
      if (e.getValue() == null) continue;
      byKey.put(flatKeyOf(e.getKey()), e.getValue());
    }

    Map<String, Object> root = new LinkedHashMap<>();
    for (var e : byKey.entrySet()) {
      assign(root, e.getKey(), e.getValue());
    }
    return root;
  }

  private String flatKeyOf(String column) {
    try {
      return names.decode(column);
    } catch (UnknownColumnException e) {
      log.warn("flatdoc.unflatten unmapped column={}; returning it as an opaque key", column);
      return column;
    }
  }

  @SuppressWarnings("unchecked")
  private static void assign(Map<String, Object> root, String flatKey, String value) {
    List<String> segments = FlatKeys.segments(flatKey);
    Map<String, Object> node = root;
    for (int i = 0; i < segments.size() - 1; i++) {
      String seg = segments.get(i);
      Object child = node.get(seg);
      if (child == null) {
        Map<String, Object> created = new LinkedHashMap<>();
        node.put(seg, created);
        node = created;
      } else if (child instanceof Map<?, ?> m) {
        node = (Map<String, Object>) m;
      } else {
        throw new SchemaConflictException("Flat key '" + flatKey + "' nests under '" +
            FlatKeys.join(segments.subList(0, i + 1)) + "', which holds a scalar");
      }
    }
    String leaf = segments.get(segments.size() - 1);
    Object existing = node.get(leaf);
    if (existing != null) {
      throw new SchemaConflictException("Flat key '" + flatKey + "' would overwrite an existing " +
          (existing instanceof Map ? "object" : "value"));
    }
    node.put(leaf, value);
  }
}
