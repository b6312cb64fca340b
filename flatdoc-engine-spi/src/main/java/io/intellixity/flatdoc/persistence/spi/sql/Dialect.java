package io.intellixity.flatdoc.persistence.spi.sql;

import io.intellixity.flatdoc.persistence.dmlast.CountAst;
import io.intellixity.flatdoc.persistence.dmlast.DdlAst;
import io.intellixity.flatdoc.persistence.dmlast.DmlAst;
import io.intellixity.flatdoc.persistence.dmlast.SelectAst;

/** Backend-agnostic SPI: renders statement ASTs into native statements. */
public interface Dialect<S extends NativeStatement> {
  /** Result label of the column name in {@link #renderColumnsQuery(String)} rows. */
  String COLUMN_NAME = "name";
  /** Result label of the 1-based primary-key position (0 when not part of the key). */
  String PK_POSITION = "pk";

  String id();

  S renderDml(DmlAst dml);

  S renderDdl(DdlAst ddl);

  S renderSelect(SelectAst select);

  S renderCount(CountAst count);

  /** Query listing a table's columns; returns no rows when the table does not exist. */
  S renderColumnsQuery(String table);

  int maxIdentifierLength();

  /** True when the backend allows one writer at a time, so the engine serializes all writes. */
  default boolean singleWriter() { return false; }
}
