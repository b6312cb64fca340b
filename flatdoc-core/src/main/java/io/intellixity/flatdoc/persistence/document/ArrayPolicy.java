package io.intellixity.flatdoc.persistence.document;

/** What the flattener does with list/array values. */
public enum ArrayPolicy {
  /** Reject the document with an invalid-argument error. */
  REJECT,

  /** Store the array as its compact JSON text; reads return that text unparsed. */
  JSON_TEXT
}
