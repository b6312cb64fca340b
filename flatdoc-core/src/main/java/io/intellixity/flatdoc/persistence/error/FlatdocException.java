package io.intellixity.flatdoc.persistence.error;

/**
 * Root of the engine's typed failures.\n
 *
 * Every public engine operation either returns normally or throws one subclass of this type.\n
 */
public class FlatdocException extends RuntimeException {
  public FlatdocException(String message) {
    super(message);
  }

  public FlatdocException(String message, Throwable cause) {
    super(message, cause);
  }
}
