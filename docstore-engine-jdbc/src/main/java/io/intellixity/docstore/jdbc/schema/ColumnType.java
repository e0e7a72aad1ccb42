package io.intellixity.docstore.jdbc.schema;

import io.intellixity.docstore.model.ValueKind;

import java.sql.Types;
import java.util.Locale;

/** Relational column types a collection's values are mapped to. */
public enum ColumnType {
  INTEGER,
  NUMERIC,
  BOOLEAN,
  TIMESTAMP,
  /** Nested mappings and sequences, stored as JSON text. */
  JSON,
  TEXT;

  /** Column type for a normalized value seen on a collection's first write. */
  public static ColumnType infer(Object normalized) {
    return switch (ValueKind.of(normalized)) {
      case INTEGER -> INTEGER;
      case FLOAT -> NUMERIC;
      case BOOLEAN -> BOOLEAN;
      case TIMESTAMP -> TIMESTAMP;
      case MAP, SEQUENCE -> JSON;
      default -> TEXT;
    };
  }

  /** Maps driver metadata ({@code DATA_TYPE}, {@code TYPE_NAME}) back to a column type. */
  public static ColumnType fromJdbc(int jdbcType, String typeName) {
    String tn = (typeName == null) ? "" : typeName.toLowerCase(Locale.ROOT);
    return switch (jdbcType) {
      case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT -> INTEGER;
      case Types.NUMERIC, Types.DECIMAL, Types.DOUBLE, Types.FLOAT, Types.REAL -> NUMERIC;
      case Types.BOOLEAN -> BOOLEAN;
      case Types.BIT -> tn.startsWith("bool") || tn.equals("bit") ? BOOLEAN : TEXT;
      case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> TIMESTAMP;
      default -> (tn.equals("json") || tn.equals("jsonb")) ? JSON : TEXT;
    };
  }

  /** True if a normalized value can be stored in (or compared against) a column of this type. */
  public boolean accepts(Object normalized) {
    if (normalized == null) return true;
    ValueKind k = ValueKind.of(normalized);
    return switch (this) {
      case INTEGER -> k == ValueKind.INTEGER;
      case NUMERIC -> k.numeric();
      case BOOLEAN -> k == ValueKind.BOOLEAN;
      case TIMESTAMP -> k == ValueKind.TIMESTAMP;
      case JSON -> k == ValueKind.MAP || k == ValueKind.SEQUENCE;
      case TEXT -> k == ValueKind.STRING;
    };
  }
}
