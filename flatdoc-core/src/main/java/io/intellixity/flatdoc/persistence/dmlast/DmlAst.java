package io.intellixity.flatdoc.persistence.dmlast;

/** Marker for backend-agnostic data statements. */
public interface DmlAst {
}
