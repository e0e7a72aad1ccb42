package io.intellixity.docstore.jdbc.dialect;

import io.intellixity.docstore.jdbc.Bind;
import io.intellixity.docstore.jdbc.SqlStatement;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.jdbc.schema.TableSchema;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.SortField;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Dialect for JDBC engines: statement rendering plus value binding/reading.
 * <p>
 * Rendering never interpolates values; every value becomes a {@link Bind} behind a {@code ?} placeholder.
 * Conditions, assignments and insert values passed in are already validated against the table's columns.
 */
public interface JdbcDialect {
  String id();

  String quoteIdent(String ident);

  SqlStatement renderCreateTable(TableSchema table);

  /**
   * @param id     explicit id value, or null when the database assigns it
   * @param values value columns to write
   */
  SqlStatement renderInsert(TableSchema table, Object id, Map<String, Object> values,
                            Instant createdAt, Instant updatedAt);

  /** Equality conjunction; a null value matches SQL NULL. */
  SqlStatement renderSelect(TableSchema table, Map<String, Object> conditions, List<SortField> sort, Page page);

  SqlStatement renderCount(TableSchema table, Map<String, Object> conditions);

  /** Sets {@code values} and advances {@code updated_at} to {@code now} without ever moving it backwards. */
  SqlStatement renderUpdate(TableSchema table, Object id, Map<String, Object> values, Instant now);

  SqlStatement renderDelete(TableSchema table, Object id);

  void bind(PreparedStatement ps, int position, Bind bind) throws SQLException;

  Object read(ResultSet rs, int column, ColumnType type) throws SQLException;

  ColumnType columnTypeOf(int jdbcType, String typeName);
}
