package io.intellixity.flatdoc.persistence.exec;

/** Backend transaction token produced by an engine's begin hook. */
public interface TxHandle {
}
