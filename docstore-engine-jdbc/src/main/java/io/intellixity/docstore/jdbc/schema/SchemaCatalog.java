package io.intellixity.docstore.jdbc.schema;

import io.intellixity.docstore.jdbc.dialect.JdbcDialect;
import io.intellixity.docstore.model.Values;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Table layouts known to a JDBC engine.
 * <p>
 * Layouts are read once from {@link DatabaseMetaData} and cached; a collection's layout is fixed after its first write,
 * so entries are only evicted when the write that created the table is rolled back.
 */
public final class SchemaCatalog {
  private final String namespace;
  private final JdbcDialect dialect;
  private final ConcurrentMap<String, TableSchema> tables = new ConcurrentHashMap<>();

  public SchemaCatalog(String namespace, JdbcDialect dialect) {
    this.namespace = namespace;
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  /** Configured namespace, or null for the connection's current schema. */
  public String namespace() { return namespace; }

  /** Returns the table's layout, or null if the table does not exist. */
  public TableSchema find(Connection c, String table) throws SQLException {
    TableSchema cached = tables.get(table);
    if (cached != null) return cached;
    TableSchema loaded = load(c, table);
    if (loaded != null) tables.putIfAbsent(table, loaded);
    return loaded;
  }

  public void register(TableSchema schema) {
    tables.put(schema.name(), schema);
  }

  public void evict(String table) {
    tables.remove(table);
  }

  /** Base tables of the namespace, sorted by name. */
  public List<String> tableNames(Connection c) throws SQLException {
    List<String> out = new ArrayList<>();
    try (ResultSet rs = c.getMetaData().getTables(c.getCatalog(), schemaOf(c), "%", new String[]{"TABLE"})) {
      while (rs.next()) out.add(rs.getString("TABLE_NAME"));
    }
    out.sort(null);
    return out;
  }

  private TableSchema load(Connection c, String table) throws SQLException {
    Map<String, ColumnType> cols = new LinkedHashMap<>();
    ColumnType idType = null;
    boolean generatedId = false;
    DatabaseMetaData md = c.getMetaData();
    // metadata patterns treat '_' and '%' as wildcards; keep exact matches only
    try (ResultSet rs = md.getColumns(c.getCatalog(), schemaOf(c), table, "%")) {
      while (rs.next()) {
        if (!table.equals(rs.getString("TABLE_NAME"))) continue;
        String col = rs.getString("COLUMN_NAME");
        ColumnType type = dialect.columnTypeOf(rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME"));
        if (Values.ID.equals(col)) {
          idType = type;
          generatedId = "YES".equalsIgnoreCase(rs.getString("IS_AUTOINCREMENT")) || isSequenceDefault(rs.getString("COLUMN_DEF"));
        } else if (!Values.CREATED_AT.equals(col) && !Values.UPDATED_AT.equals(col)) {
          cols.put(col, type);
        }
      }
    }
    if (idType == null && cols.isEmpty()) return null;
    return new TableSchema(namespace, table, idType == null ? ColumnType.TEXT : idType, generatedId, cols);
  }

  private String schemaOf(Connection c) throws SQLException {
    return (namespace != null) ? namespace : c.getSchema();
  }

  private static boolean isSequenceDefault(String columnDef) {
    return columnDef != null && columnDef.toLowerCase(Locale.ROOT).startsWith("nextval(");
  }
}
