package io.intellixity.flatdoc.persistence.jdbc.dialect;

import io.intellixity.flatdoc.persistence.jdbc.SqlStatement;
import io.intellixity.flatdoc.persistence.spi.sql.Dialect;

import java.sql.SQLException;

/** Dialect for JDBC engines (statement rendering and driver error classification). */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /**
   * True when {@code e} means a concurrent writer changed the schema first (table, column or index already
   * created). Such writes are retried after re-reading the schema.\n
   */
  boolean isSchemaRace(SQLException e);
}
