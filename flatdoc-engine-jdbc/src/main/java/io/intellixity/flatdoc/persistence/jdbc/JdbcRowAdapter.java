package io.intellixity.flatdoc.persistence.jdbc;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads result rows as label to text maps, leaving NULL columns out. */
public final class JdbcRowAdapter {
  private final ResultSet rs;
  private List<String> labels;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  /** The current row. */
  public Map<String, String> read() throws SQLException {
    List<String> ls = labels();
    Map<String, String> row = new LinkedHashMap<>(ls.size() * 2);
    for (int i = 0; i < ls.size(); i++) {
      String v = rs.getString(i + 1);
      if (v != null) row.put(ls.get(i), v);
    }
    return row;
  }

  /** All remaining rows. */
  public List<Map<String, String>> readAll() throws SQLException {
    List<Map<String, String>> out = new ArrayList<>();
    while (rs.next()) out.add(read());
    return out;
  }

  private List<String> labels() throws SQLException {
    if (labels == null) {
      ResultSetMetaData md = rs.getMetaData();
      List<String> ls = new ArrayList<>(md.getColumnCount());
      for (int i = 1; i <= md.getColumnCount(); i++) ls.add(md.getColumnLabel(i));
      labels = ls;
    }
    return labels;
  }
}
