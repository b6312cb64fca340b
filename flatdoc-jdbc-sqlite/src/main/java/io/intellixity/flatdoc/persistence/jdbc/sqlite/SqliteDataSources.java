package io.intellixity.flatdoc.persistence.jdbc.sqlite;

import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Objects;

/** File-backed SQLite data sources configured for a document engine. */
public final class SqliteDataSources {
  /** How long a connection waits on a locked database before failing with SQLITE_BUSY. */
  public static final int DEFAULT_BUSY_TIMEOUT_MS = 10_000;

  private SqliteDataSources() {}

  public static DataSource file(Path dbFile) {
    return file(dbFile, DEFAULT_BUSY_TIMEOUT_MS);
  }

  /**
   * WAL journal so readers do not block the writer; every {@code getConnection()} opens a new connection
   * to the same file.\n
   */
  public static DataSource file(Path dbFile, int busyTimeoutMs) {
    Objects.requireNonNull(dbFile, "dbFile");
    SQLiteConfig config = new SQLiteConfig();
    config.setJournalMode(SQLiteConfig.JournalMode.WAL);
    config.setBusyTimeout(busyTimeoutMs);
    SQLiteDataSource ds = new SQLiteDataSource(config);
    ds.setUrl("jdbc:sqlite:" + dbFile.toAbsolutePath());
    return ds;
  }
}
