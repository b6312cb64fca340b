package io.intellixity.flatdoc.persistence.error;

/** Column identifier collision, or a flat key that is both a scalar and a nested object. Never retried. */
public final class SchemaConflictException extends FlatdocException {
  public SchemaConflictException(String message) {
    super(message);
  }
}
