package io.intellixity.flatdoc.persistence.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.naming.ColumnNames;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Depth-first flattening of a nested document into column identifier to text pairs.\n
 *
 * Rules:\n
 * - Keys containing {@code /} are treated as already-joined paths, so {@code {"a/b": 1}} and
 *   {@code {"a": {"b": 1}}} produce the same flat key.\n
 * - Null values and empty nested objects produce no column.\n
 * - Scalars become text: strings verbatim, booleans {@code true}/{@code false}, numbers in plain decimal form.\n
 * - The same flat key reached twice keeps the value visited last.\n
 * - A flat key that is also the ancestor of another flat key is a {@link SchemaConflictException}.\n
 */
public final class DocumentFlattener {
  private final ColumnNames names;
  private final ArrayPolicy arrayPolicy;
  private final ObjectMapper json;

  public DocumentFlattener(ColumnNames names, ArrayPolicy arrayPolicy, ObjectMapper json) {
    this.names = Objects.requireNonNull(names, "names");
    this.arrayPolicy = (arrayPolicy == null) ? ArrayPolicy.REJECT : arrayPolicy;
    this.json = Objects.requireNonNull(json, "json");
  }

  public DocumentFlattener(ColumnNames names, ArrayPolicy arrayPolicy) {
    this(names, arrayPolicy, new ObjectMapper());
  }

  /** Flatten and record every new flat key with the name registry. */
  public FlatDocument flatten(Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    NavigableMap<String, String> byKey = new TreeMap<>();
    walk(document, new ArrayList<>(), byKey);
    requireNoPrefixConflicts(byKey);

    Map<String, String> values = new LinkedHashMap<>();
    Map<String, String> flatKeys = new LinkedHashMap<>();
    for (var e : byKey.entrySet()) {
      String column = names.register(e.getKey());
      values.put(column, e.getValue());
      flatKeys.put(column, e.getKey());
    }
    return new FlatDocument(values, flatKeys);
  }

  private void walk(Map<?, ?> node, List<String> path, Map<String, String> out) {
    for (var e : node.entrySet()) {
      if (!(e.getKey() instanceof String key)) {
        throw new InvalidArgumentException("Document keys must be strings, got: " + e.getKey());
      }
      List<String> segments = FlatKeys.segments(key);
      path.addAll(segments);
      try {
        Object v = e.getValue();
        if (v instanceof Map<?, ?> child) {
          walk(child, path, out);
        } else if (v != null) {
          out.put(FlatKeys.join(path), scalarText(FlatKeys.join(path), v));
        }
      } finally {
        for (int i = 0; i < segments.size(); i++) path.remove(path.size() - 1);
      }
    }
  }

  private String scalarText(String flatKey, Object v) {
    if (v instanceof CharSequence cs) return cs.toString();
    if (v instanceof Boolean b) return b.toString();
    if (v instanceof Character c) return c.toString();
    if (v instanceof Enum<?> en) return en.name();
    if (v instanceof BigDecimal bd) return bd.toPlainString();
    if (v instanceof BigInteger || v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
      return v.toString();
    }
    if (v instanceof Double || v instanceof Float) {
      double d = ((Number) v).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        throw new InvalidArgumentException("Non-finite number at key '" + flatKey + "'");
      }
      return new BigDecimal(v.toString()).toPlainString();
    }
    if (v instanceof Collection<?> || v.getClass().isArray()) return arrayText(flatKey, v);
    throw new InvalidArgumentException("Unsupported value type " + v.getClass().getName() + " at key '" + flatKey + "'");
  }

  private String arrayText(String flatKey, Object v) {
    if (arrayPolicy == ArrayPolicy.REJECT) {
      throw new InvalidArgumentException("Array values are not supported (key '" + flatKey + "')");
    }
    try {
      return json.writeValueAsString(v);
    } catch (JsonProcessingException e) {
      throw new InvalidArgumentException("Array at key '" + flatKey + "' is not serializable as JSON", e);
    }
  }

  private static void requireNoPrefixConflicts(NavigableMap<String, String> byKey) {
    // Every key sorting between "a" and "a/..." starts with "a".
    for (String key : byKey.keySet()) {
      for (String later : byKey.tailMap(key, false).keySet()) {
        if (!later.startsWith(key)) break;
        if (FlatKeys.isStrictPrefix(key, later)) {
          throw new SchemaConflictException("Key '" + key + "' holds a scalar but '" + later + "' nests under it");
        }
      }
    }
  }
}
