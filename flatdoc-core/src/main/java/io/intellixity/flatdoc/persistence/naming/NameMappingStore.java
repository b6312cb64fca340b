package io.intellixity.flatdoc.persistence.naming;

import java.util.Map;

/**
 * Persistent column-identifier to flat-key table.\n
 *
 * Backed by one reserved table {@code (hashed_name PRIMARY KEY, original_name UNIQUE)}. Entries are never
 * updated or deleted once recorded.\n
 */
public interface NameMappingStore {
  /** Read the whole mapping (hashed name to original name). */
  Map<String, String> load();

  /**
   * Record {@code hashedName -> originalName} unless an entry for {@code hashedName} already exists.\n
   *
   * Atomic with respect to concurrent writers. Returns the original name recorded for {@code hashedName}
   * after the call, which differs from {@code originalName} only on a collision.\n
   */
  String insertIfAbsent(String hashedName, String originalName);

  /** Original name recorded for {@code hashedName}, or null. */
  String findOriginal(String hashedName);
}
