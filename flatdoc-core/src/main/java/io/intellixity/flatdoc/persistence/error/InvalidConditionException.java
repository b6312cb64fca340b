package io.intellixity.flatdoc.persistence.error;

/**
 * Raised when a where-condition string is not of the form {@code key = value [AND key = value ...]}.
 * <p>
 * Thrown before any statement runs, so it never leaves a partial effect.
 */
public final class InvalidConditionException extends FlatdocException {
  public InvalidConditionException(String message) {
    super(message);
  }
}
