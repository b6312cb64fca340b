package io.intellixity.flatdoc.persistence.exec;

import io.intellixity.flatdoc.persistence.exec.handle.EngineHandle;
import io.intellixity.flatdoc.persistence.query.SortField;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Schema-on-write document store over one backend.\n
 *
 * Collections are {@code /}-separated paths; documents are nested maps of text, number and boolean scalars.
 * Keys in documents and conditions are original flat keys ({@code details/address/city}); column naming is
 * internal.\n
 */
public interface DocumentEngine<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Default transaction propagation for this engine instance (used by {@link #inTx(Supplier)}). */
  Propagation defaultPropagation();

  /** Run work within a transaction boundary using the given propagation behavior. */
  <T> T inTx(Propagation propagation, Supplier<T> work);

  /** Run work using this engine instance's {@link #defaultPropagation()}.\n */
  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }

  /**
   * Store a document, creating or growing the collection table as needed.\n
   *
   * With a declared primary key an existing row with the same key is replaced and keeps its row id.\n
   *
   * @return the row id of the stored row
   */
  String insertOrReplace(String collection, Map<String, ?> document);

  StoredDocument getById(String collection, String rowId);

  List<StoredDocument> listAll(String collection);

  /** Documents matching {@code whereCondition} ({@code key = value [AND key = value ...]}). */
  List<StoredDocument> find(String collection, String whereCondition);

  /**
   * One page of documents ordered by {@code orderByKey}. Rows without that key sort as the configured null
   * default; ties are broken by row id.\n
   *
   * Values are stored as text and compared as text, so numbers order lexically: {@code "25"} sorts before
   * {@code "9"}. Zero-pad numeric values at write time when numeric order matters.\n
   *
   * @param page 1-based
   */
  List<StoredDocument> queryPaginated(String collection, String orderByKey, SortField.Direction direction,
                                      int page, int pageSize);

  long count(String collection);

  /** Set the partial document's values on every row matching {@code whereCondition}. */
  long update(String collection, Map<String, ?> partialDocument, String whereCondition);

  long updateById(String collection, String rowId, Map<String, ?> partialDocument);

  long delete(String collection, String whereCondition);

  long deleteById(String collection, String rowId);
}
