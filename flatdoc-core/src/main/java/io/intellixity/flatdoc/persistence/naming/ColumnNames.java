package io.intellixity.flatdoc.persistence.naming;

import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.error.UnknownColumnException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Session-owned name registry: {@link ColumnNameCodec} plus a write-through cache over a {@link NameMappingStore}.\n
 *
 * One instance per engine. The cache is loaded at construction and only learns a pair after the store has
 * confirmed it, so the cache never holds a mapping the store does not. When the store write is part of a
 * transaction, the engine defers publishing the pair until commit through {@link #publishWith(Consumer)}.\n
 */
public final class ColumnNames {
  private static final Logger log = LoggerFactory.getLogger(ColumnNames.class);

  private final NameMappingStore store;
  private final Map<String, String> byColumn = new ConcurrentHashMap<>();
  private final Object registerLock = new Object();
  private volatile Consumer<Runnable> publisher = Runnable::run;

  public ColumnNames(NameMappingStore store) {
    this.store = Objects.requireNonNull(store, "store");
    reload();
  }

  /** Route cache updates for pairs read from or written to the store; the default applies them at once. */
  public void publishWith(Consumer<Runnable> publisher) {
    this.publisher = Objects.requireNonNull(publisher, "publisher");
  }

  /** Pure encoding; does not record anything. */
  public String encode(String flatKey) {
    return ColumnNameCodec.encode(flatKey);
  }

  /**
   * Encode {@code flatKey} and make sure its mapping is persisted.\n
   *
   * @throws SchemaConflictException if the identifier is already recorded for a different flat key
   */
  public String register(String flatKey) {
    String column = ColumnNameCodec.encode(flatKey);
    String known = byColumn.get(column);
    if (known != null) {
      requireSame(column, known, flatKey);
      return column;
    }
    synchronized (registerLock) {
      known = byColumn.get(column);
      if (known != null) {
        requireSame(column, known, flatKey);
        return column;
      }
      String recorded = store.insertIfAbsent(column, flatKey);
      requireSame(column, recorded, flatKey);
      publisher.accept(() -> byColumn.putIfAbsent(column, recorded));
      log.debug("flatdoc.naming registered column={} flatKey={}", column, flatKey);
      return column;
    }
  }

  /**
   * Flat key recorded for {@code column}. Misses fall through to the store once, since another process may
   * have recorded the pair after this instance loaded.\n
   *
   * @throws UnknownColumnException if no mapping exists
   */
  public String decode(String column) {
    Objects.requireNonNull(column, "column");
    String known = byColumn.get(column);
    if (known != null) return known;
    String recorded = store.findOriginal(column);
    if (recorded == null) throw new UnknownColumnException(column);
    publisher.accept(() -> byColumn.putIfAbsent(column, recorded));
    return recorded;
  }

  /** Replace the cache with the store's current content. */
  public void reload() {
    Map<String, String> loaded = store.load();
    synchronized (registerLock) {
      byColumn.clear();
      byColumn.putAll(loaded);
    }
    log.debug("flatdoc.naming loaded mappings={}", loaded.size());
  }

  public int size() { return byColumn.size(); }

  private static void requireSame(String column, String recorded, String flatKey) {
    if (recorded == null) {
      throw new StorageFailureException("register", null, false,
          "mapping store returned no entry for column '" + column + "' after insert", null);
    }
    if (!recorded.equals(flatKey)) {
      throw new SchemaConflictException("Column '" + column + "' is already recorded for flat key '" + recorded +
          "'; cannot map it to '" + flatKey + "'");
    }
  }
}
