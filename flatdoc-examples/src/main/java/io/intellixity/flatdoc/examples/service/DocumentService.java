package io.intellixity.flatdoc.examples.service;

import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.exec.DocumentEngine;
import io.intellixity.flatdoc.persistence.exec.StoredDocument;
import io.intellixity.flatdoc.persistence.query.SortField;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
public final class DocumentService {
  public static final int DEFAULT_PAGE_SIZE = 20;

  private final DocumentEngine<?> engine;

  public DocumentService(DocumentEngine<?> engine) {
    this.engine = engine;
  }

  public String store(String collection, Map<String, Object> document) {
    return engine.insertOrReplace(collection, document);
  }

  public StoredDocument get(String collection, String rowId) {
    return engine.getById(collection, rowId);
  }

  /** All documents, or one page when {@code orderBy} or a page is requested. */
  public List<StoredDocument> list(String collection, String orderBy, String direction, Integer page, Integer size) {
    boolean paged = orderBy != null || page != null || size != null;
    if (!paged) return engine.listAll(collection);
    if (orderBy == null || orderBy.isBlank()) {
      throw new InvalidArgumentException("orderBy is required for paginated reads");
    }
    return engine.queryPaginated(collection, orderBy, direction(direction),
        page == null ? 1 : page, size == null ? DEFAULT_PAGE_SIZE : size);
  }

  public List<StoredDocument> search(String collection, String where) {
    return engine.find(collection, where);
  }

  public long count(String collection) {
    return engine.count(collection);
  }

  public long update(String collection, String where, Map<String, Object> partial) {
    return engine.update(collection, partial, where);
  }

  public long updateById(String collection, String rowId, Map<String, Object> partial) {
    return engine.updateById(collection, rowId, partial);
  }

  public long delete(String collection, String where) {
    return engine.delete(collection, where);
  }

  public long deleteById(String collection, String rowId) {
    return engine.deleteById(collection, rowId);
  }

  static SortField.Direction direction(String raw) {
    if (raw == null || raw.isBlank()) return SortField.Direction.ASC;
    try {
      return SortField.Direction.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("direction must be asc or desc, got '" + raw + "'", e);
    }
  }
}
