package io.intellixity.flatdoc.persistence.naming;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** Test store: first writer wins, with call counters. */
public final class InMemoryNameMappingStore implements NameMappingStore {
  private final Map<String, String> rows = new ConcurrentHashMap<>();
  public final AtomicInteger inserts = new AtomicInteger();
  public final AtomicInteger finds = new AtomicInteger();

  @Override
  public Map<String, String> load() {
    return new HashMap<>(rows);
  }

  @Override
  public String insertIfAbsent(String hashedName, String originalName) {
    inserts.incrementAndGet();
    String prev = rows.putIfAbsent(hashedName, originalName);
    return (prev == null) ? originalName : prev;
  }

  @Override
  public String findOriginal(String hashedName) {
    finds.incrementAndGet();
    return rows.get(hashedName);
  }

  /** Simulates another process recording a pair behind the cache's back. */
  public void put(String hashedName, String originalName) {
    rows.put(hashedName, originalName);
  }
}
