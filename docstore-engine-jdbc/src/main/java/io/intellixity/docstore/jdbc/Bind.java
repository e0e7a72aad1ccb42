package io.intellixity.docstore.jdbc;

import io.intellixity.docstore.jdbc.schema.ColumnType;

/** A positional statement parameter: a normalized value and the column type it is bound as. */
public record Bind(Object value, ColumnType type) {
  public Bind {
    type = (type == null) ? ColumnType.TEXT : type;
  }
}
