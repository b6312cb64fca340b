package io.intellixity.flatdoc.persistence.error;

/**
 * Failure reported by the underlying store.\n
 *
 * {@link #retryable()} is true when the backend classified the failure as a schema race
 * (a concurrent writer created the same table, column or index first).\n
 */
public final class StorageFailureException extends FlatdocException {
  private final String operation;
  private final String table;
  private final boolean retryable;

  public StorageFailureException(String operation, String table, boolean retryable, String message, Throwable cause) {
    super("Storage failure during " + operation + (table == null ? "" : " on table '" + table + "'") + ": " + message, cause);
    this.operation = operation;
    this.table = table;
    this.retryable = retryable;
  }

  public String operation() { return operation; }
  public String table() { return table; }
  public boolean retryable() { return retryable; }
}
