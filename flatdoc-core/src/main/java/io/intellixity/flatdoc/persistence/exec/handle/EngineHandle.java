package io.intellixity.flatdoc.persistence.exec.handle;

/**
 * Resolved runtime handle for a backend engine family.\n
 *
 * Example:\n
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema\n
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an engine (DataSource, ...). */
  TClient client();

  /** Namespace (schema/database) for this handle, or null for the backend default. */
  String namespace();
}
