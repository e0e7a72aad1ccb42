package io.intellixity.docstore.model;

import io.intellixity.docstore.exceptions.ValidationException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tag of a normalized document value.
 * <p>
 * Values are plain Java objects after {@link Values#normalize(Object)}; the kind is derived from their runtime class.
 * The ordinal order is the cross-kind ordering used when sorting mixed values, except that {@link #INTEGER} and
 * {@link #FLOAT} compare numerically with each other.
 */
public enum ValueKind {
  NULL,
  INTEGER,
  FLOAT,
  STRING,
  MAP,
  SEQUENCE,
  BOOLEAN,
  TIMESTAMP;

  public boolean numeric() {
    return this == INTEGER || this == FLOAT;
  }

  /** Kind of an already-normalized value. */
  public static ValueKind of(Object normalized) {
    if (normalized == null) return NULL;
    if (normalized instanceof Boolean) return BOOLEAN;
    if (normalized instanceof Long) return INTEGER;
    if (normalized instanceof Double) return FLOAT;
    if (normalized instanceof String) return STRING;
    if (normalized instanceof Instant) return TIMESTAMP;
    if (normalized instanceof Map<?, ?>) return MAP;
    if (normalized instanceof List<?>) return SEQUENCE;
    throw new ValidationException("Not a normalized document value: " + normalized.getClass().getName());
  }
}
