package io.intellixity.flatdoc.persistence.error;

/** Malformed collection path, document shape or pagination parameter. */
public final class InvalidArgumentException extends FlatdocException {
  public InvalidArgumentException(String message) {
    super(message);
  }

  public InvalidArgumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
