package io.intellixity.flatdoc.persistence.document;

import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;

import java.util.ArrayList;
import java.util.List;

/** Flat key syntax: nested key segments joined with {@code /}. */
public final class FlatKeys {
  public static final String SEPARATOR = "/";

  private FlatKeys() {}

  /**
   * Split a key into its segments.\n
   *
   * @throws InvalidArgumentException on a null/blank key or an empty segment ({@code a//b}, {@code /a}, {@code a/})
   */
  public static List<String> segments(String key) {
    if (key == null || key.isEmpty()) throw new InvalidArgumentException("Document key must be non-empty");
    List<String> out = new ArrayList<>();
    int start = 0;
    while (true) {
      int i = key.indexOf(SEPARATOR, start);
      String seg = (i < 0) ? key.substring(start) : key.substring(start, i);
      if (seg.isEmpty()) throw new InvalidArgumentException("Empty path segment in key '" + key + "'");
      out.add(seg);
      if (i < 0) return out;
      start = i + SEPARATOR.length();
    }
  }

  public static String join(List<String> segments) {
    return String.join(SEPARATOR, segments);
  }

  /** Validated flat key as given ({@code details/age_ind}). */
  public static String normalize(String key) {
    return join(segments(key));
  }

  /** True if {@code prefix} names a strict ancestor of {@code key}. */
  public static boolean isStrictPrefix(String prefix, String key) {
    return key.length() > prefix.length()
        && key.startsWith(prefix)
        && key.startsWith(SEPARATOR, prefix.length());
  }
}
