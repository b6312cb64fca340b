package io.intellixity.flatdoc.persistence.spi.schema;

import io.intellixity.flatdoc.persistence.dmlast.AddColumnAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateIndexAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst;
import io.intellixity.flatdoc.persistence.dmlast.CreateTableAst.ColumnDef;
import io.intellixity.flatdoc.persistence.error.StorageFailureException;
import io.intellixity.flatdoc.persistence.naming.ColumnNameCodec;
import io.intellixity.flatdoc.persistence.schema.TableSchema;
import io.intellixity.flatdoc.persistence.schema.TableShape;
import io.intellixity.flatdoc.persistence.spi.sql.Dialect;
import io.intellixity.flatdoc.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Lazily creates and grows collection tables.\n
 *
 * - Tables are created with one TEXT column per flat-key column plus {@value TableSchema#ROW_ID}.\n
 * - Existing tables only ever gain nullable TEXT columns; nothing is altered or dropped.\n
 * - Primary key membership is decided at creation. Index flags are read when a column is introduced.\n
 *
 * All DDL is idempotent ({@code IF NOT EXISTS} where the dialect has it), so callers may run
 * {@link #ensureTable(TableShape)} before every write.\n
 */
public final class SchemaManager<S extends NativeStatement> {
  private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

  /** Statement execution supplied by the engine (runs inside the caller's transaction when there is one). */
  public interface SchemaOps<S> {
    List<Map<String, String>> query(String op, String table, S stmt);

    void execute(String op, String table, S stmt);
  }

  private final Dialect<S> dialect;
  private final SchemaOps<S> ops;

  public SchemaManager(Dialect<S> dialect, SchemaOps<S> ops) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.ops = Objects.requireNonNull(ops, "ops");
  }

  /** Current table schema, or null when the table does not exist. */
  public TableSchema describe(String table) {
    List<Map<String, String>> rows = ops.query("COLUMNS", table, dialect.renderColumnsQuery(table));
    if (rows.isEmpty()) return null;
    Set<String> columns = new LinkedHashSet<>();
    TreeMap<Integer, String> pk = new TreeMap<>();
    for (Map<String, String> row : rows) {
      String name = row.get(Dialect.COLUMN_NAME);
      columns.add(name);
      String pos = row.get(Dialect.PK_POSITION);
      int p = (pos == null) ? 0 : Integer.parseInt(pos.trim());
      if (p > 0) pk.put(p, name);
    }
    return new TableSchema(table, columns, new ArrayList<>(pk.values()));
  }

  /** Create the table when missing, otherwise add whatever columns {@code shape} needs. */
  public TableSchema ensureTable(TableShape shape) {
    Objects.requireNonNull(shape, "shape");
    TableSchema existing = describe(shape.table());
    return (existing == null) ? create(shape) : evolve(existing, shape);
  }

  /** Add the columns of {@code shape} that {@code existing} lacks, indexing new {@code _ind} columns. */
  public TableSchema evolve(TableSchema existing, TableShape shape) {
    List<String> missing = new ArrayList<>();
    for (String c : shape.columns()) {
      if (!existing.hasColumn(c)) missing.add(c);
    }
    if (missing.isEmpty()) return existing;

    String table = existing.table();
    List<String> indexed = new ArrayList<>();
    for (String c : missing) {
      ops.execute("ADD_COLUMN", table, dialect.renderDdl(new AddColumnAst(table, c)));
      if (shape.indexed().contains(c)) {
        createIndex(table, c);
        indexed.add(c);
      }
    }
    log.info("flatdoc.schema columns_added table={} columns={} indexed={}", table, missing, indexed);
    return existing.withColumns(missing);
  }

  private TableSchema create(TableShape shape) {
    String table = shape.table();
    List<String> pk = shape.primaryKey();
    boolean rowIdIsKey = pk.isEmpty();

    List<ColumnDef> defs = new ArrayList<>();
    defs.add(new ColumnDef(TableSchema.ROW_ID, true, !rowIdIsKey));
    for (String c : shape.columns()) {
      defs.add(pk.contains(c) ? new ColumnDef(c, true, false) : ColumnDef.nullable(c));
    }
    List<String> key = rowIdIsKey ? List.of(TableSchema.ROW_ID) : pk;
    ops.execute("CREATE_TABLE", table, dialect.renderDdl(new CreateTableAst(table, defs, key)));

    List<String> indexed = new ArrayList<>();
    for (String c : shape.indexed()) {
      if (pk.contains(c)) continue;
      createIndex(table, c);
      indexed.add(c);
    }

    // A concurrent creator may have won with a different shape; report what is actually there.
    TableSchema created = describe(table);
    if (created == null) {
      throw new StorageFailureException("CREATE_TABLE", table, false, "table not visible after CREATE TABLE", null);
    }
    if (!created.columns().containsAll(shape.columns())) created = evolve(created, shape);
    log.info("flatdoc.schema table_created table={} columns={} primaryKey={} indexed={}",
        table, shape.columns().size(), key, indexed);
    return created;
  }

  private void createIndex(String table, String column) {
    String name = ColumnNameCodec.indexName(table, column);
    ops.execute("CREATE_INDEX", table, dialect.renderDdl(new CreateIndexAst(name, table, column)));
  }
}
