package io.intellixity.docstore.query;

import io.intellixity.docstore.exceptions.ValidationException;

/** Offset paging: skip {@code skip} matches, then return at most {@code limit}. */
public record Page(int skip, int limit) {
  public static final int DEFAULT_LIMIT = 100;
  public static final int UNLIMITED = Integer.MAX_VALUE;

  public Page {
    if (limit < 0) throw new ValidationException("limit must be >= 0");
    if (skip < 0) throw new ValidationException("skip must be >= 0");
  }

  public static Page first() { return new Page(0, DEFAULT_LIMIT); }

  public static Page all() { return new Page(0, UNLIMITED); }

  public boolean unlimited() { return limit == UNLIMITED; }
}
