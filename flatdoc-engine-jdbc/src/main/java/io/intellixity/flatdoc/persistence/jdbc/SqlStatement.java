package io.intellixity.flatdoc.persistence.jdbc;

import io.intellixity.flatdoc.persistence.spi.sql.NativeStatement;

import java.util.List;

/** SQL text with {@code :bN} placeholders and the text values bound to them, in order. */
public record SqlStatement(String sql, List<String> binds, ExecKind execKind) implements NativeStatement {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery() (used for SELECT/COUNT/introspection). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (DML and DDL). */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<String> binds) {
    this(sql, binds, ExecKind.QUERY);
  }
}
