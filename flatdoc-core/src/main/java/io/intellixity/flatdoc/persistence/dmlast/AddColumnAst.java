package io.intellixity.flatdoc.persistence.dmlast;

/** Adds one nullable text column. */
public record AddColumnAst(String table, String column) implements DdlAst {
}
