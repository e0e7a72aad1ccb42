package io.intellixity.docstore.query;

import io.intellixity.docstore.exceptions.ValidationException;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  /** Positive means ascending, negative descending. */
  public static SortField of(String field, int direction) {
    if (direction == 0) throw new ValidationException("Sort direction for '" + field + "' must be positive or negative");
    return new SortField(field, direction > 0 ? Direction.ASC : Direction.DESC);
  }

  public enum Direction { ASC, DESC }
}
