package io.intellixity.docstore.jdbc;

import io.intellixity.docstore.exceptions.ValidationException;
import io.intellixity.docstore.exec.TxHandle;
import io.intellixity.docstore.jdbc.dialect.JdbcDialect;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.jdbc.schema.SchemaCatalog;
import io.intellixity.docstore.jdbc.schema.TableSchema;
import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.model.ValueKind;
import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortField;
import io.intellixity.docstore.query.SortSpec;
import io.intellixity.docstore.spi.exec.AbstractDocumentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Relational engine: one table per collection, one column per field.
 * <p>
 * A collection's table is inferred from its first document and fixed afterwards; later writes naming fields the
 * table has no column for are rejected. Writes run in a transaction on a dedicated connection; reads borrow a
 * connection in auto-commit mode.
 */
public final class JdbcDocumentEngine extends AbstractDocumentEngine<JdbcHandle> {
  public static final String FAMILY = "jdbc";

  private static final Logger log = LoggerFactory.getLogger(JdbcDocumentEngine.class);

  private final DataSource ds;
  private final JdbcDialect dialect;
  private final SchemaCatalog catalog;

  public JdbcDocumentEngine(JdbcHandle handle, JdbcDialect dialect, Clock clock) {
    super(Objects.requireNonNull(handle, "handle"), clock);
    this.ds = handle.client();
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.catalog = new SchemaCatalog(handle.schema(), dialect);
  }

  public JdbcDocumentEngine(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, null);
  }

  @Override public String family() { return FAMILY; }

  public JdbcDialect dialect() { return dialect; }

  // --- Transactions ---

  @Override
  protected TxHandle begin() {
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
    try {
      c.setAutoCommit(false);
      return new JdbcTxHandle(c, new ArrayList<>());
    } catch (SQLException e) {
      try {
        c.close();
      } catch (SQLException ce) {
        e.addSuppressed(ce);
      }
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void commit(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try { j.conn.commit(); } catch (SQLException e) { throw new RuntimeException(e); }
  }

  @Override
  protected void rollback(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    j.createdTables.forEach(catalog::evict);
    try { j.conn.rollback(); } catch (SQLException e) { throw new RuntimeException(e); }
  }

  @Override
  protected void release(TxHandle tx) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try { j.conn.close(); } catch (SQLException e) { throw new RuntimeException(e); }
  }

  /** Write transaction: the connection plus tables created inside it. */
  public record JdbcTxHandle(Connection conn, List<String> createdTables) implements TxHandle {}

  // --- Hooks ---

  @Override
  protected List<String> doListCollections() {
    try (Connection c = ds.getConnection()) {
      return catalog.tableNames(c);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected String doCreate(TxHandle tx, String collection, NewDocument doc) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      TableSchema table = catalog.find(j.conn, collection);
      if (table == null) table = createTable(j, collection, doc);

      checkWritable(table, doc.fields());
      Object id = null;
      if (doc.id() != null) {
        id = coerceId(table, doc.id());
        if (id == null) {
          throw new ValidationException("Document id '" + doc.id() + "' does not fit collection '" + collection + "'");
        }
      } else if (!table.generatedId()) {
        throw new ValidationException("Collection '" + collection + "' requires an explicit id");
      }

      SqlStatement ss = dialect.renderInsert(table, id, doc.fields(), doc.createdAt(), doc.updatedAt());
      Object key = executeInsert(j.conn, ss);
      if (id != null) return doc.id();
      if (key == null) throw new IllegalStateException("Database returned no id for insert into " + collection);
      return String.valueOf(key);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected Document doGet(String collection, String id) {
    try (Connection c = ds.getConnection()) {
      TableSchema table = catalog.find(c, collection);
      if (table == null) return null;
      Object key = coerceId(table, id);
      if (key == null) return null;
      Map<String, Object> cond = new LinkedHashMap<>();
      cond.put(Values.ID, key);
      List<Document> rows = executeSelect(c, table, dialect.renderSelect(table, cond, List.of(), new Page(0, 1)));
      return rows.isEmpty() ? null : rows.get(0);
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected long doUpdate(TxHandle tx, String collection, String id, Map<String, Object> fields, Instant now) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      TableSchema table = catalog.find(j.conn, collection);
      if (table == null) return 0;
      checkWritable(table, fields);
      Object key = coerceId(table, id);
      if (key == null) return 0;
      return executeUpdate(j.conn, "UPDATE", dialect.renderUpdate(table, key, fields, now));
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected long doDelete(TxHandle tx, String collection, String id) {
    JdbcTxHandle j = (JdbcTxHandle) tx;
    try {
      TableSchema table = catalog.find(j.conn, collection);
      if (table == null) return 0;
      Object key = coerceId(table, id);
      if (key == null) return 0;
      return executeUpdate(j.conn, "DELETE", dialect.renderDelete(table, key));
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected List<Document> doList(String collection, QuerySpec query, SortSpec sort, Page page) {
    try (Connection c = ds.getConnection()) {
      TableSchema table = catalog.find(c, collection);
      if (table == null) return List.of();
      Map<String, Object> cond = conditions(table, query);
      if (cond == null) return List.of();
      List<SortField> order = new ArrayList<>();
      for (SortField sf : sort.fields()) {
        if (table.typeOf(sf.field()) != null) order.add(sf);
      }
      return executeSelect(c, table, dialect.renderSelect(table, cond, order, page));
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected long doCount(String collection, QuerySpec query) {
    try (Connection c = ds.getConnection()) {
      TableSchema table = catalog.find(c, collection);
      if (table == null) return 0;
      Map<String, Object> cond = conditions(table, query);
      if (cond == null) return 0;
      SqlStatement ss = dialect.renderCount(table, cond);
      long start = System.nanoTime();
      debugSql("COUNT", ss);
      try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
        bindAll(ps, ss);
        try (ResultSet rs = ps.executeQuery()) {
          long n = rs.next() ? rs.getLong(1) : 0;
          debugDone("COUNT", ss, n, System.nanoTime() - start);
          return n;
        }
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  public void close() {
    if (ds instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        throw new RuntimeException("Failed to close JDBC data source " + handle().id(), e);
      }
    }
  }

  // --- Schema + values ---

  private TableSchema createTable(JdbcTxHandle j, String collection, NewDocument doc) throws SQLException {
    TableSchema table = TableSchema.infer(catalog.namespace(), collection, doc.fields(), doc.id() != null);
    executeUpdate(j.conn, "CREATE", dialect.renderCreateTable(table));
    catalog.register(table);
    j.createdTables.add(collection);
    log.info("docstore.jdbc created table={} columns={} generatedId={}", collection, table.columns(), table.generatedId());
    return table;
  }

  private static void checkWritable(TableSchema table, Map<String, Object> fields) {
    for (var e : fields.entrySet()) {
      ColumnType type = table.columns().get(e.getKey());
      if (type == null) {
        throw new ValidationException("Collection '" + table.name() + "' has no column for field '" + e.getKey() + "'");
      }
      if (!type.accepts(e.getValue())) {
        throw new ValidationException("Field '" + e.getKey() + "' of collection '" + table.name() + "' expects "
            + type + " but got " + ValueKind.of(e.getValue()));
      }
    }
  }

  /** Id string as a value of the table's id column type; null when it cannot be one. */
  private static Object coerceId(TableSchema table, String id) {
    if (table.idType() == ColumnType.INTEGER) {
      try {
        return Long.parseLong(id.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return id;
  }

  /** Query conditions checked against the table; null when no row can match. */
  private static Map<String, Object> conditions(TableSchema table, QuerySpec query) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : query.conditions().entrySet()) {
      String field = e.getKey();
      Object value = e.getValue();
      ColumnType type = table.typeOf(field);
      if (type == null) return null;
      if (Values.ID.equals(field) && value != null) {
        ValueKind k = ValueKind.of(value);
        if (k == ValueKind.MAP || k == ValueKind.SEQUENCE) return null;
        value = coerceId(table, String.valueOf(value));
        if (value == null) return null;
      } else if (!type.accepts(value)) {
        return null;
      }
      out.put(field, value);
    }
    return out;
  }

  // --- Execution ---

  private Object executeInsert(Connection c, SqlStatement ss) throws SQLException {
    long start = System.nanoTime();
    debugSql("INSERT", ss);
    return switch (ss.execKind()) {
      case QUERY_ONE_VALUE -> {
        try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
          bindAll(ps, ss);
          try (ResultSet rs = ps.executeQuery()) {
            Object v = rs.next() ? rs.getObject(1) : null;
            debugDone("INSERT", ss, "returning", System.nanoTime() - start);
            yield v;
          }
        }
      }
      case UPDATE_GENERATED_KEYS -> {
        try (PreparedStatement ps = c.prepareStatement(ss.sql(), Statement.RETURN_GENERATED_KEYS)) {
          bindAll(ps, ss);
          int n = ps.executeUpdate();
          try (ResultSet rs = ps.getGeneratedKeys()) {
            Object v = (rs != null && rs.next()) ? rs.getObject(1) : null;
            debugDone("INSERT", ss, n, System.nanoTime() - start);
            yield v;
          }
        }
      }
      case UPDATE -> {
        try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
          bindAll(ps, ss);
          int n = ps.executeUpdate();
          debugDone("INSERT", ss, n, System.nanoTime() - start);
          yield null;
        }
      }
      default -> throw new IllegalArgumentException("Invalid execKind=" + ss.execKind() + " for insert");
    };
  }

  private long executeUpdate(Connection c, String op, SqlStatement ss) throws SQLException {
    long start = System.nanoTime();
    debugSql(op, ss);
    try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      long n = ps.executeUpdate();
      debugDone(op, ss, n, System.nanoTime() - start);
      return n;
    }
  }

  private List<Document> executeSelect(Connection c, TableSchema table, SqlStatement ss) throws SQLException {
    long start = System.nanoTime();
    debugSql("SELECT", ss);
    try (PreparedStatement ps = c.prepareStatement(ss.sql())) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<Document> out = new ArrayList<>();
        while (rs.next()) out.add(readRow(rs, table));
        debugDone("SELECT", ss, out.size(), System.nanoTime() - start);
        return out;
      }
    }
  }

  private Document readRow(ResultSet rs, TableSchema table) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    String id = null;
    Instant createdAt = null;
    Instant updatedAt = null;
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 1; i <= md.getColumnCount(); i++) {
      String col = md.getColumnLabel(i);
      ColumnType type = table.typeOf(col);
      if (type == null) type = dialect.columnTypeOf(md.getColumnType(i), md.getColumnTypeName(i));
      Object v = dialect.read(rs, i, type);
      switch (col) {
        case Values.ID -> id = (v == null) ? null : String.valueOf(v);
        case Values.CREATED_AT -> createdAt = (Instant) v;
        case Values.UPDATED_AT -> updatedAt = (Instant) v;
        default -> fields.put(col, v);
      }
    }
    return new Document(id, fields, createdAt, updatedAt);
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    for (int i = 0; i < ss.binds().size(); i++) dialect.bind(ps, i + 1, ss.binds().get(i));
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("docstore.jdbc op={} execKind={} bindCount={} handleId={} schema={} sql={}",
        op, ss.execKind(), ss.binds().size(), h.id(), h.schema(), ss.sql());

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        log.trace("docstore.jdbc bind index={} columnType={} valueType={}",
            idx++, b.type(), v == null ? "null" : v.getClass().getSimpleName());
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("docstore.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
