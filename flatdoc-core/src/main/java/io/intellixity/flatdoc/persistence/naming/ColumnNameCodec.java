package io.intellixity.flatdoc.persistence.naming;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Pure flat-key to column-identifier function.\n
 *
 * Identifier form: {@code col_} + the first 128 bits of SHA-256 over the UTF-8 flat key, as 32 lowercase
 * hex characters. The result is always 36 characters of {@code [a-z0-9_]}, so it is safe to interpolate as an
 * identifier in every supported dialect.\n
 */
public final class ColumnNameCodec {
  public static final String COLUMN_PREFIX = "col_";
  public static final String INDEX_PREFIX = "idx_";
  private static final int DIGEST_BYTES = 16;
  private static final HexFormat HEX = HexFormat.of();

  private ColumnNameCodec() {}

  public static String encode(String flatKey) {
    Objects.requireNonNull(flatKey, "flatKey");
    return COLUMN_PREFIX + digestHex(flatKey);
  }

  /** Deterministic index name for a column of a table. */
  public static String indexName(String table, String column) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
    return INDEX_PREFIX + digestHex(table + "/" + column);
  }

  public static boolean isColumnId(String name) {
    if (name == null || name.length() != COLUMN_PREFIX.length() + DIGEST_BYTES * 2) return false;
    if (!name.startsWith(COLUMN_PREFIX)) return false;
    for (int i = COLUMN_PREFIX.length(); i < name.length(); i++) {
      char c = name.charAt(i);
      if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) return false;
    }
    return true;
  }

  private static String digestHex(String s) {
    byte[] full = sha256().digest(s.getBytes(StandardCharsets.UTF_8));
    return HEX.formatHex(full, 0, DIGEST_BYTES);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // Every JRE ships SHA-256.
      throw new IllegalStateException("SHA-256 is not available", e);
    }
  }
}
