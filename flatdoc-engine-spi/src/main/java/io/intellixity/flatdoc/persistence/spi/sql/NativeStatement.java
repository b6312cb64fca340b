package io.intellixity.flatdoc.persistence.spi.sql;

/** Backend-native rendered statement (SQL text plus binds, ...). */
public interface NativeStatement {
}
