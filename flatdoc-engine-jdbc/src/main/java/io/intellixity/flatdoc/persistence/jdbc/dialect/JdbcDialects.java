package io.intellixity.flatdoc.persistence.jdbc.dialect;

import io.intellixity.flatdoc.persistence.util.FlatdocFactoriesLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Resolves {@link JdbcDialect}s registered in {@code META-INF/flatdoc.factories}. */
public final class JdbcDialects {
  private JdbcDialects() {}

  public static JdbcDialect byId(String id) {
    Objects.requireNonNull(id, "id");
    String wanted = id.trim().toLowerCase(Locale.ROOT);
    return FlatdocFactoriesLoader.first(JdbcDialect.class, d -> d.id().equals(wanted))
        .orElseThrow(() -> new IllegalArgumentException(
            "No JdbcDialect registered with id '" + id + "' (available: " + available() + ")"));
  }

  public static List<String> available() {
    List<String> ids = new ArrayList<>();
    for (JdbcDialect d : FlatdocFactoriesLoader.load(JdbcDialect.class)) ids.add(d.id());
    return ids;
  }
}
