package io.intellixity.flatdoc.persistence.query;

import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;

public record OffsetPage(long offset, int limit) {
  public OffsetPage {
    if (limit <= 0) throw new InvalidArgumentException("limit must be > 0");
    if (offset < 0) throw new InvalidArgumentException("offset must be >= 0");
  }

  /** 1-based page number and page size to offset/limit. */
  public static OffsetPage ofPage(int page, int pageSize) {
    if (page < 1) throw new InvalidArgumentException("page must be >= 1, got " + page);
    if (pageSize < 1) throw new InvalidArgumentException("pageSize must be >= 1, got " + pageSize);
    return new OffsetPage((long) (page - 1) * pageSize, pageSize);
  }
}
