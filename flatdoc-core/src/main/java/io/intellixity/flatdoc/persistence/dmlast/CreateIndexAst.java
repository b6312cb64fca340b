package io.intellixity.flatdoc.persistence.dmlast;

/** {@code CREATE INDEX IF NOT EXISTS} over a single column. */
public record CreateIndexAst(String name, String table, String column) implements DdlAst {
}
