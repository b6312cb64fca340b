package io.intellixity.flatdoc.persistence.document;

/**
 * Reserved flat-key suffixes.\n
 *
 * A key ending in {@value #PRIMARY_KEY_SUFFIX} marks its column as part of the collection's primary key; a key
 * ending in {@value #INDEX_SUFFIX} marks it for a secondary index. Both are read only when the column is first
 * introduced to a collection.\n
 */
public final class KeyConventions {
  public static final String PRIMARY_KEY_SUFFIX = "_pri";
  public static final String INDEX_SUFFIX = "_ind";

  private KeyConventions() {}

  public static boolean isPrimaryKey(String flatKey) {
    return flatKey != null && flatKey.endsWith(PRIMARY_KEY_SUFFIX);
  }

  public static boolean isIndexed(String flatKey) {
    return flatKey != null && flatKey.endsWith(INDEX_SUFFIX);
  }
}
