package io.intellixity.flatdoc.persistence.query;

import java.util.Objects;

/** Equality between the value stored under a flat key and a text literal. */
public record Condition(String key, String value) {
  public Condition {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
  }
}
