package io.intellixity.docstore.jdbc.schema;

import io.intellixity.docstore.model.Values;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed column layout of a collection's table.
 *
 * @param namespace   database schema holding the table; null for the connection's current schema
 * @param name        table name (the collection name)
 * @param idType      type of the identity column
 * @param generatedId true when the identity is assigned by the database
 * @param columns     value columns (excludes id and the timestamp columns), in declaration order
 */
public record TableSchema(String namespace, String name, ColumnType idType, boolean generatedId,
                          Map<String, ColumnType> columns) {
  public TableSchema {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(idType, "idType");
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns == null ? Map.of() : columns));
  }

  /**
   * Infers a table from the first document written to a collection: one column per field, typed by the field's value.
   * The identity column is generated by the database unless the caller supplied an id.
   */
  public static TableSchema infer(String namespace, String name, Map<String, Object> fields, boolean callerSuppliedId) {
    Map<String, ColumnType> cols = new LinkedHashMap<>();
    for (var e : fields.entrySet()) cols.put(e.getKey(), ColumnType.infer(e.getValue()));
    return callerSuppliedId
        ? new TableSchema(namespace, name, ColumnType.TEXT, false, cols)
        : new TableSchema(namespace, name, ColumnType.INTEGER, true, cols);
  }

  /** Column type of a field, including the reserved id/timestamp columns; null if the table has no such column. */
  public ColumnType typeOf(String field) {
    return switch (field) {
      case Values.ID -> idType;
      case Values.CREATED_AT, Values.UPDATED_AT -> ColumnType.TIMESTAMP;
      default -> columns.get(field);
    };
  }
}
