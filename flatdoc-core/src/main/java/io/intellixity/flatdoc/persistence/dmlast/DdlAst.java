package io.intellixity.flatdoc.persistence.dmlast;

/** Marker for backend-agnostic schema statements. */
public interface DdlAst {
}
