package io.intellixity.flatdoc.persistence.schema;

import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;

import java.util.regex.Pattern;

/**
 * Collection path to table name.\n
 *
 * A path is one or more {@code /}-separated segments, each matching {@code [a-z0-9]+(_[a-z0-9]+)*}. The table
 * name joins the segments with {@code __}. A segment can never contain {@code __}, so two different paths
 * never yield the same table name.\n
 */
public final class CollectionPaths {
  public static final String SEGMENT_JOINER = "__";
  private static final Pattern SEGMENT = Pattern.compile("[a-z0-9]+(_[a-z0-9]+)*");

  private CollectionPaths() {}

  /**
   * @param maxIdentifierLength the dialect's identifier length limit
   * @param reservedTable       a table name no collection may map to (the name mapping table)
   */
  public static String tableName(String collectionPath, int maxIdentifierLength, String reservedTable) {
    if (collectionPath == null || collectionPath.isEmpty()) {
      throw new InvalidArgumentException("Collection path must be non-empty");
    }
    String[] segments = collectionPath.split("/", -1);
    for (String seg : segments) {
      if (!SEGMENT.matcher(seg).matches()) {
        throw new InvalidArgumentException("Invalid collection path '" + collectionPath + "': segment '" + seg +
            "' must match " + SEGMENT.pattern());
      }
    }
    String table = String.join(SEGMENT_JOINER, segments);
    if (table.length() > maxIdentifierLength) {
      throw new InvalidArgumentException("Collection path '" + collectionPath + "' maps to a table name longer than " +
          maxIdentifierLength + " characters");
    }
    if (table.equals(reservedTable)) {
      throw new InvalidArgumentException("Collection path '" + collectionPath + "' is reserved");
    }
    return table;
  }
}
