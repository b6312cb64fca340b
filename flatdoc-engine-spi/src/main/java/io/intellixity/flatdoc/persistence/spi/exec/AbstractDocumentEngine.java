package io.intellixity.flatdoc.persistence.spi.exec;

import io.intellixity.flatdoc.persistence.dmlast.ColumnBind;
import io.intellixity.flatdoc.persistence.dmlast.CountAst;
import io.intellixity.flatdoc.persistence.dmlast.DmlPlanner;
import io.intellixity.flatdoc.persistence.dmlast.SelectAst;
import io.intellixity.flatdoc.persistence.document.DocumentFlattener;
import io.intellixity.flatdoc.persistence.document.DocumentUnflattener;
import io.intellixity.flatdoc.persistence.document.FlatDocument;
import io.intellixity.flatdoc.persistence.document.FlatKeys;
import io.intellixity.flatdoc.persistence.error.DocumentNotFoundException;
import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.error.UnknownColumnException;
import io.intellixity.flatdoc.persistence.exec.DocumentEngine;
import io.intellixity.flatdoc.persistence.exec.EngineSettings;
import io.intellixity.flatdoc.persistence.exec.Propagation;
import io.intellixity.flatdoc.persistence.exec.StoredDocument;
import io.intellixity.flatdoc.persistence.exec.TxHandle;
import io.intellixity.flatdoc.persistence.exec.handle.EngineHandle;
import io.intellixity.flatdoc.persistence.naming.ColumnNames;
import io.intellixity.flatdoc.persistence.naming.NameMappingStore;
import io.intellixity.flatdoc.persistence.query.Condition;
import io.intellixity.flatdoc.persistence.query.OffsetPage;
import io.intellixity.flatdoc.persistence.query.SortField;
import io.intellixity.flatdoc.persistence.query.WhereClause;
import io.intellixity.flatdoc.persistence.query.WhereConditionParser;
import io.intellixity.flatdoc.persistence.schema.CollectionPaths;
import io.intellixity.flatdoc.persistence.schema.TableSchema;
import io.intellixity.flatdoc.persistence.spi.schema.SchemaManager;
import io.intellixity.flatdoc.persistence.spi.sql.Dialect;
import io.intellixity.flatdoc.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for document operations.\n
 *
 * Responsibilities:\n
 * - Transaction scoping via {@link #inTx(Propagation, java.util.function.Supplier)}\n
 * - Flattening/unflattening through the engine-owned {@link ColumnNames}\n
 * - Schema evolution via {@link SchemaManager} before every write\n
 * - Build native statements using {@link Dialect} and {@link DmlPlanner}\n
 * - Write serialization per table (or engine-wide for single-writer backends) and retry of writes that lost a
 *   schema race\n
 * - Delegate execution to backend-specific hooks\n
 */
public abstract class AbstractDocumentEngine<S extends NativeStatement, H extends EngineHandle<?>>
    implements DocumentEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractDocumentEngine.class);

  private final H handle;
  private final Dialect<S> dialect;
  private final DmlPlanner dmlPlanner;
  private final EngineSettings settings;
  private final Propagation defaultPropagation;
  private final ColumnNames names;
  private final DocumentFlattener flattener;
  private final DocumentUnflattener unflattener;
  private final SchemaManager<S> schema;
  private final Map<String, ReentrantLock> tableLocks = new ConcurrentHashMap<>();
  private final ReentrantLock engineWriteLock = new ReentrantLock();

  /**
   * Engine-scoped transaction slot.\n
   *
   * We must not accidentally reuse a transaction created by a different engine instance running
   * in the same thread. So we bind (engineMarker, tx) together and only reuse if marker matches.\n
   */
  private static final ThreadLocal<TxSlot> TX = new ThreadLocal<>();
  private final Object txMarker = new Object();

  private record TxSlot(Object marker, TxHandle tx, List<Runnable> afterCommit) {}

  protected AbstractDocumentEngine(Dialect<S> dialect,
                                   H handle,
                                   DmlPlanner dmlPlanner,
                                   NameMappingStore mappingStore,
                                   EngineSettings settings,
                                   Propagation defaultPropagation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.dmlPlanner = Objects.requireNonNull(dmlPlanner, "dmlPlanner");
    this.settings = (settings == null) ? EngineSettings.defaults() : settings;
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
    this.names = new ColumnNames(Objects.requireNonNull(mappingStore, "mappingStore"));
    this.flattener = new DocumentFlattener(names, this.settings.arrayPolicy());
    this.unflattener = new DocumentUnflattener(names);
    this.schema = new SchemaManager<>(dialect, new SchemaManager.SchemaOps<>() {
      @Override
      public List<Map<String, String>> query(String op, String table, S stmt) {
        return executeQuery(currentTxOrNull(), op, table, stmt);
      }

      @Override
      public void execute(String op, String table, S stmt) {
        executeUpdate(currentTxOrNull(), op, table, stmt);
      }
    });
    this.names.publishWith(publish -> {
      if (mappingJoinsTransaction()) afterCommit(publish);
      else publish.run();
    });
  }

  /** Backend-specific transaction begin (write operations may auto-create tx via {@link #inTx(Supplier)}). */
  protected abstract TxHandle begin();

  /** Backend-specific transaction commit (paired with {@link #begin()}); releases the transaction either way. */
  protected abstract void commit(TxHandle tx);

  /** Backend-specific transaction rollback (paired with {@link #begin()}). */
  protected abstract void rollback(TxHandle tx);

  @Override
  public final Propagation defaultPropagation() {
    return defaultPropagation;
  }

  /**
   * Default propagation used by write operations when the caller did not explicitly wrap the work in
   * {@link DocumentEngine#inTx(Propagation, Supplier)}.
   */
  protected Propagation defaultWritePropagation() { return defaultPropagation; }

  /**
   * True when name mappings recorded now must be written on the caller's transaction. Single-writer backends
   * cannot take a second write connection while that transaction holds the write lock.\n
   */
  protected final boolean mappingJoinsTransaction() {
    return dialect.singleWriter() && currentTxOrNull() != null;
  }

  /** Run {@code action} once the current transaction of this engine commits, or right away without one. */
  protected final void afterCommit(Runnable action) {
    Objects.requireNonNull(action, "action");
    TxSlot slot = TX.get();
    if (slot == null || slot.marker != this.txMarker) {
      action.run();
      return;
    }
    slot.afterCommit.add(action);
  }

  protected final TxHandle currentTxOrNull() {
    TxSlot slot = TX.get();
    return (slot != null && slot.marker == this.txMarker) ? slot.tx : null;
  }

  @Override
  public <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation, work);
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW -> runInNewTx(work);
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
      case NESTED -> (existing != null) ? work.get() : runInNewTx(work);
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxSlot previous = TX.get();
    TxHandle tx = begin();
    TxSlot slot = new TxSlot(this.txMarker, tx, new ArrayList<>());
    TX.set(slot);
    boolean workDone = false;
    try {
      T result = work.get();
      workDone = true;
      commit(tx);
      slot.afterCommit.forEach(Runnable::run);
      return result;
    } catch (RuntimeException | Error t) {
      if (!workDone) rollbackAfter(tx, t);
      throw t;
    } finally {
      if (previous == null) TX.remove();
      else TX.set(previous);
    }
  }

  private void rollbackAfter(TxHandle tx, Throwable failure) {
    try {
      rollback(tx);
    } catch (RuntimeException re) {
      failure.addSuppressed(re);
    }
  }

  protected final Dialect<S> dialect() { return dialect; }
  @Override
  public final H handle() { return handle; }
  protected final DmlPlanner dmlPlanner() { return dmlPlanner; }
  protected final EngineSettings settings() { return settings; }
  protected final ColumnNames names() { return names; }
  protected final SchemaManager<S> schemaManager() { return schema; }

  /** Table backing {@code collection}; rejects invalid or reserved paths. */
  protected final String tableName(String collection) {
    return CollectionPaths.tableName(collection, dialect.maxIdentifierLength(), settings.mappingTable());
  }

  // --- Reads (no auto-tx creation) ---

  @Override
  public final StoredDocument getById(String collection, String rowId) {
    Objects.requireNonNull(rowId, "rowId");
    String table = tableName(collection);
    TableSchema ts = schema.describe(table);
    if (ts == null) throw new DocumentNotFoundException(collection, rowId);
    List<StoredDocument> rows = select(SelectAst.all(table, List.of(rowIdBind(rowId)), null));
    if (rows.isEmpty()) throw new DocumentNotFoundException(collection, rowId);
    return rows.get(0);
  }

  @Override
  public final List<StoredDocument> listAll(String collection) {
    String table = tableName(collection);
    if (schema.describe(table) == null) return List.of();
    return select(SelectAst.all(table, List.of(), TableSchema.ROW_ID));
  }

  @Override
  public final List<StoredDocument> find(String collection, String whereCondition) {
    WhereClause where = WhereConditionParser.parse(whereCondition);
    String table = tableName(collection);
    TableSchema ts = schema.describe(table);
    if (ts == null) return List.of();
    List<ColumnBind> binds = whereBinds(ts, where);
    if (binds == null) return List.of();
    return select(SelectAst.all(table, binds, TableSchema.ROW_ID));
  }

  @Override
  public final List<StoredDocument> queryPaginated(String collection, String orderByKey, SortField.Direction direction,
                                                   int page, int pageSize) {
    OffsetPage p = OffsetPage.ofPage(page, pageSize);
    if (orderByKey == null || orderByKey.isBlank()) throw new InvalidArgumentException("orderByKey must be non-empty");
    String key = FlatKeys.normalize(orderByKey);
    String table = tableName(collection);
    TableSchema ts = schema.describe(table);
    if (ts == null) return List.of();

    String column = names.encode(key);
    SortField sort = ts.hasColumn(column) ? new SortField(column, direction) : null;
    return select(new SelectAst(table, List.of(), sort, settings.nullSortDefault(), TableSchema.ROW_ID, p));
  }

  @Override
  public final long count(String collection) {
    String table = tableName(collection);
    if (schema.describe(table) == null) return 0;
    List<Map<String, String>> rows = executeQuery(currentTxOrNull(), "COUNT", table,
        dialect.renderCount(new CountAst(table, List.of())));
    if (rows.isEmpty()) return 0;
    String v = rows.get(0).values().iterator().next();
    return Long.parseLong(v);
  }

  private List<StoredDocument> select(SelectAst ast) {
    List<Map<String, String>> rows = executeQuery(currentTxOrNull(), "SELECT", ast.table(), dialect.renderSelect(ast));
    List<StoredDocument> out = new ArrayList<>(rows.size());
    for (Map<String, String> row : rows) {
      Map<String, String> values = new LinkedHashMap<>(row);
      String rowId = values.remove(TableSchema.ROW_ID);
      out.add(new StoredDocument(rowId, unflattener.unflatten(values)));
    }
    return out;
  }

  // --- Writes (auto-tx creation) ---

  @Override
  public final String insertOrReplace(String collection, Map<String, ?> document) {
    Objects.requireNonNull(document, "document");
    String table = tableName(collection);
    return underWriteLock(table, () -> {
      FlatDocument doc = flattener.flatten(document);
      return withSchemaRetry("insertOrReplace", collection, table, () -> inTx(defaultWritePropagation(), () -> {
        TableSchema ts = schema.ensureTable(doc.shape(table));
        String rowId = UUID.randomUUID().toString();
        if (ts.declaredPrimaryKey().isEmpty()) {
          executeUpdate(currentTxOrNull(), "INSERT", table, dialect.renderDml(dmlPlanner.planInsert(table, rowId, doc)));
          return rowId;
        }
        List<ColumnBind> key = primaryKeyBinds(collection, ts, doc);
        executeUpdate(currentTxOrNull(), "UPSERT", table, dialect.renderDml(dmlPlanner.planUpsert(ts, rowId, doc)));
        List<Map<String, String>> stored = executeQuery(currentTxOrNull(), "SELECT", table,
            dialect.renderSelect(SelectAst.all(table, key, null)));
        if (stored.isEmpty()) {
          throw new StorageFailureException("UPSERT", table, false, "row not visible after upsert", null);
        }
        return stored.get(0).get(TableSchema.ROW_ID);
      }));
    });
  }

  @Override
  public final long update(String collection, Map<String, ?> partialDocument, String whereCondition) {
    Objects.requireNonNull(partialDocument, "partialDocument");
    WhereClause where = WhereConditionParser.parse(whereCondition);
    return updateWhere("update", collection, partialDocument, ts -> whereBinds(ts, where));
  }

  @Override
  public final long updateById(String collection, String rowId, Map<String, ?> partialDocument) {
    Objects.requireNonNull(rowId, "rowId");
    Objects.requireNonNull(partialDocument, "partialDocument");
    return updateWhere("updateById", collection, partialDocument, ts -> List.of(rowIdBind(rowId)));
  }

  @Override
  public final long delete(String collection, String whereCondition) {
    WhereClause where = WhereConditionParser.parse(whereCondition);
    return deleteWhere("delete", collection, ts -> whereBinds(ts, where));
  }

  @Override
  public final long deleteById(String collection, String rowId) {
    Objects.requireNonNull(rowId, "rowId");
    return deleteWhere("deleteById", collection, ts -> List.of(rowIdBind(rowId)));
  }

  private long updateWhere(String op, String collection, Map<String, ?> partialDocument,
                           Function<TableSchema, List<ColumnBind>> whereFor) {
    String table = tableName(collection);
    return underWriteLock(table, () -> {
      FlatDocument doc = flattener.flatten(partialDocument);
      if (doc.isEmpty()) {
        throw new InvalidArgumentException("Update for collection '" + collection + "' has no values to set");
      }
      return withSchemaRetry(op, collection, table, () -> inTx(defaultWritePropagation(), () -> {
        TableSchema ts = schema.describe(table);
        if (ts == null) return 0L;
        List<ColumnBind> where = whereFor.apply(ts);
        if (where == null) return 0L;
        List<String> clears = replacedColumns(collection, ts, doc);
        schema.evolve(ts, doc.shape(table));
        return executeUpdate(currentTxOrNull(), "UPDATE", table,
            dialect.renderDml(dmlPlanner.planUpdate(table, doc, clears, where)));
      }));
    });
  }

  private long deleteWhere(String op, String collection, Function<TableSchema, List<ColumnBind>> whereFor) {
    String table = tableName(collection);
    return underWriteLock(table, () -> withSchemaRetry(op, collection, table,
        () -> inTx(defaultWritePropagation(), () -> {
          TableSchema ts = schema.describe(table);
          if (ts == null) return 0L;
          List<ColumnBind> where = whereFor.apply(ts);
          if (where == null) return 0L;
          return executeUpdate(currentTxOrNull(), "DELETE", table,
              dialect.renderDml(dmlPlanner.planDelete(table, where)));
        })));
  }

  /** Column binds for {@code where}, or null when a referenced key has no column (so no row can match). */
  private List<ColumnBind> whereBinds(TableSchema ts, WhereClause where) {
    List<ColumnBind> out = new ArrayList<>(where.conditions().size());
    for (Condition c : where.conditions()) {
      String column = names.encode(c.key());
      if (!ts.hasColumn(column)) return null;
      out.add(new ColumnBind(column, c.value()));
    }
    return out;
  }

  /**
   * Existing columns whose flat key nests under, or is an ancestor of, a key the update sets. They are cleared
   * in the same statement so the updated rows stay readable: setting {@code details} replaces the whole
   * {@code details/...} subtree, and setting {@code details/age} replaces a scalar {@code details}.\n
   */
  private List<String> replacedColumns(String collection, TableSchema ts, FlatDocument doc) {
    List<String> out = new ArrayList<>();
    for (String column : ts.dataColumns()) {
      if (doc.values().containsKey(column)) continue;
      String existing;
      try {
        existing = names.decode(column);
      } catch (UnknownColumnException e) {
        // Unmapped columns read back as opaque leaf keys and cannot nest.
        continue;
      }
      for (String key : doc.flatKeys().values()) {
        if (!FlatKeys.isStrictPrefix(key, existing) && !FlatKeys.isStrictPrefix(existing, key)) continue;
        if (ts.declaredPrimaryKey().contains(column)) {
          throw new SchemaConflictException("Update of collection '" + collection + "' sets '" + key +
              "', which would clear primary key field '" + existing + "'");
        }
        out.add(column);
        break;
      }
    }
    return out;
  }

  private List<ColumnBind> primaryKeyBinds(String collection, TableSchema ts, FlatDocument doc) {
    List<ColumnBind> out = new ArrayList<>();
    for (String column : ts.declaredPrimaryKey()) {
      String v = doc.values().get(column);
      if (v == null) {
        throw new InvalidArgumentException("Document for collection '" + collection +
            "' is missing primary key field '" + names.decode(column) + "'");
      }
      out.add(new ColumnBind(column, v));
    }
    return out;
  }

  private static ColumnBind rowIdBind(String rowId) {
    return new ColumnBind(TableSchema.ROW_ID, rowId);
  }

  private <T> T underWriteLock(String table, Supplier<T> work) {
    ReentrantLock lock = dialect.singleWriter()
        ? engineWriteLock
        : tableLocks.computeIfAbsent(table, t -> new ReentrantLock());
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }

  /** Re-run a write that lost a schema race; only possible when this call owns the transaction. */
  private <T> T withSchemaRetry(String op, String collection, String table, Supplier<T> work) {
    int attempt = 0;
    while (true) {
      try {
        return work.get();
      } catch (StorageFailureException e) {
        boolean canRetry = e.retryable() && currentTxOrNull() == null && attempt < settings.schemaRetries();
        if (!canRetry) {
          log.error("flatdoc.write_failed op={} collection={} table={} attempts={} retryable={}",
              op, collection, table, attempt + 1, e.retryable(), e);
          throw e;
        }
        attempt++;
        log.warn("flatdoc.write_retry op={} collection={} table={} attempt={} cause={}",
            op, collection, table, attempt, e.getMessage());
      }
    }
  }

  // --- Backend-specific hooks ---

  /** Run a query; rows map result labels to text with NULL columns left out. */
  protected abstract List<Map<String, String>> executeQuery(TxHandle txOrNull, String op, String table, S stmt);

  /** Run a statement that returns an update count. */
  protected abstract long executeUpdate(TxHandle txOrNull, String op, String table, S stmt);
}
