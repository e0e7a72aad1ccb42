package io.intellixity.docstore.jdbc.dialect;

import io.intellixity.docstore.jdbc.Bind;
import io.intellixity.docstore.jdbc.JsonColumns;
import io.intellixity.docstore.jdbc.SqlStatement;
import io.intellixity.docstore.jdbc.SqlStatement.ExecKind;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.jdbc.schema.TableSchema;
import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.SortField;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JDBC-generic SQL dialect base.
 * <p>
 * Provides common rendering for:
 * <ul>
 *   <li>DDL: {@code CREATE TABLE IF NOT EXISTS} from an inferred {@link TableSchema}</li>
 *   <li>select/count: equality conjunction + ORDER BY + paging</li>
 *   <li>DML: insert/update/delete keyed by the identity column</li>
 * </ul>
 * DB-specific dialects override hooks for quoting, column types, paging, returning and timestamp touching.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return "?";
    }
    public List<Bind> binds() { return binds; }
  }

  // --- DDL ---

  @Override
  public SqlStatement renderCreateTable(TableSchema t) {
    List<String> cols = new ArrayList<>();
    cols.add(quoteIdent(Values.ID) + " "
        + (t.generatedId() ? identityColumnType() : sqlType(t.idType())) + " PRIMARY KEY");
    for (var e : t.columns().entrySet()) cols.add(quoteIdent(e.getKey()) + " " + sqlType(e.getValue()));
    cols.add(quoteIdent(Values.CREATED_AT) + " " + sqlType(ColumnType.TIMESTAMP) + " DEFAULT CURRENT_TIMESTAMP");
    cols.add(quoteIdent(Values.UPDATED_AT) + " " + sqlType(ColumnType.TIMESTAMP) + " DEFAULT CURRENT_TIMESTAMP");
    String sql = "CREATE TABLE IF NOT EXISTS " + tableRef(t) + " (" + String.join(", ", cols) + ")";
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }

  // --- DML ---

  @Override
  public SqlStatement renderInsert(TableSchema t, Object id, Map<String, Object> values,
                                   Instant createdAt, Instant updatedAt) {
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    List<String> params = new ArrayList<>();
    if (id != null) {
      cols.add(quoteIdent(Values.ID));
      params.add(ctx.add(new Bind(id, t.idType())));
    }
    for (var e : values.entrySet()) {
      cols.add(quoteIdent(e.getKey()));
      params.add(ctx.add(new Bind(e.getValue(), t.typeOf(e.getKey()))));
    }
    cols.add(quoteIdent(Values.CREATED_AT));
    params.add(ctx.add(new Bind(createdAt, ColumnType.TIMESTAMP)));
    cols.add(quoteIdent(Values.UPDATED_AT));
    params.add(ctx.add(new Bind(updatedAt, ColumnType.TIMESTAMP)));

    String sql = "INSERT INTO " + tableRef(t) + " (" + String.join(", ", cols) + ") VALUES ("
        + String.join(", ", params) + ")";
    if (id != null) return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
    return new SqlStatement(applyInsertReturning(sql, Values.ID), ctx.binds(), insertExecKind());
  }

  @Override
  public SqlStatement renderUpdate(TableSchema t, Object id, Map<String, Object> values, Instant now) {
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (var e : values.entrySet()) {
      sets.add(quoteIdent(e.getKey()) + " = " + ctx.add(new Bind(e.getValue(), t.typeOf(e.getKey()))));
    }
    sets.add(quoteIdent(Values.UPDATED_AT) + " = " + renderTouch(quoteIdent(Values.UPDATED_AT), now, ctx));
    String where = quoteIdent(Values.ID) + " = " + ctx.add(new Bind(id, t.idType()));
    String sql = "UPDATE " + tableRef(t) + " SET " + String.join(", ", sets) + " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(TableSchema t, Object id) {
    RenderCtx ctx = new RenderCtx();
    String sql = "DELETE FROM " + tableRef(t) + " WHERE " + quoteIdent(Values.ID) + " = "
        + ctx.add(new Bind(id, t.idType()));
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  // --- Queries ---

  @Override
  public SqlStatement renderSelect(TableSchema t, Map<String, Object> conditions, List<SortField> sort, Page page) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableRef(t));
    appendWhere(sql, t, conditions, ctx);

    List<String> order = new ArrayList<>();
    boolean idSorted = false;
    if (sort != null) {
      for (SortField sf : sort) {
        order.add(renderOrderTerm(quoteIdent(sf.field()), sf.direction()));
        idSorted |= Values.ID.equals(sf.field());
      }
    }
    // insertion order among ties
    if (!idSorted) order.add(quoteIdent(Values.ID) + " ASC");
    sql.append(" ORDER BY ").append(String.join(", ", order));

    String paged = (page == null) ? sql.toString() : applyOffsetPage(sql.toString(), page);
    return new SqlStatement(paged, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement renderCount(TableSchema t, Map<String, Object> conditions) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(tableRef(t));
    appendWhere(sql, t, conditions, ctx);
    return new SqlStatement(sql.toString(), ctx.binds(), ExecKind.QUERY);
  }

  protected void appendWhere(StringBuilder sql, TableSchema t, Map<String, Object> conditions, RenderCtx ctx) {
    if (conditions == null || conditions.isEmpty()) return;
    List<String> preds = new ArrayList<>();
    for (var e : conditions.entrySet()) {
      String col = quoteIdent(e.getKey());
      if (e.getValue() == null) {
        preds.add(col + " IS NULL");
      } else {
        preds.add(col + " = " + ctx.add(new Bind(e.getValue(), t.typeOf(e.getKey()))));
      }
    }
    sql.append(" WHERE ").append(String.join(" AND ", preds));
  }

  // --- Binding ---

  @Override
  public void bind(PreparedStatement ps, int position, Bind bind) throws SQLException {
    Object v = bind.value();
    if (v == null) {
      ps.setNull(position, nullSqlType(bind.type()));
      return;
    }
    BigDecimal numeric = (bind.type() == ColumnType.NUMERIC) ? scaledNumeric(v) : null;
    if (bind.type() == ColumnType.JSON) {
      bindJson(ps, position, JsonColumns.write(v));
    } else if (numeric != null) {
      ps.setBigDecimal(position, numeric);
    } else if (v instanceof Long l) {
      ps.setLong(position, l);
    } else if (v instanceof Double d) {
      ps.setDouble(position, d);
    } else if (v instanceof Boolean b) {
      ps.setBoolean(position, b);
    } else if (v instanceof Instant i) {
      ps.setTimestamp(position, Timestamp.from(i));
    } else {
      ps.setString(position, String.valueOf(v));
    }
  }

  @Override
  public Object read(ResultSet rs, int column, ColumnType type) throws SQLException {
    return switch (type) {
      case INTEGER -> {
        long v = rs.getLong(column);
        yield rs.wasNull() ? null : v;
      }
      case NUMERIC -> numericValue(rs.getBigDecimal(column));
      case BOOLEAN -> {
        boolean v = rs.getBoolean(column);
        yield rs.wasNull() ? null : v;
      }
      case TIMESTAMP -> {
        Timestamp v = rs.getTimestamp(column);
        yield v == null ? null : v.toInstant();
      }
      case JSON -> JsonColumns.read(rs.getString(column));
      case TEXT -> rs.getString(column);
    };
  }

  /**
   * NUMERIC parameter keeping the integer/float distinction in its scale: integers bind with scale 0, floats with
   * scale 1 or more. Null for values that have no exact decimal form.
   */
  static BigDecimal scaledNumeric(Object v) {
    if (v instanceof Long l) return BigDecimal.valueOf(l);
    if (v instanceof Double d && Double.isFinite(d)) {
      BigDecimal bd = new BigDecimal(Double.toString(d));
      return (bd.scale() < 1) ? bd.setScale(1) : bd;
    }
    return null;
  }

  /** Reverses {@link #scaledNumeric}: scale 0 values that fit a long read as Long, everything else as Double. */
  static Object numericValue(BigDecimal v) {
    if (v == null) return null;
    if (v.scale() <= 0 && v.toBigInteger().bitLength() < 64) return v.longValue();
    return v.doubleValue();
  }

  @Override
  public ColumnType columnTypeOf(int jdbcType, String typeName) {
    return ColumnType.fromJdbc(jdbcType, typeName);
  }

  // --- Dialect hooks ---

  /** ANSI double-quoted identifier. */
  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  /** Schema-qualified, quoted table reference. */
  protected String tableRef(TableSchema t) {
    return (t.namespace() == null) ? quoteIdent(t.name()) : quoteIdent(t.namespace()) + "." + quoteIdent(t.name());
  }

  /** Column DDL type for a value column. */
  protected String sqlType(ColumnType type) {
    return switch (type) {
      case INTEGER -> "BIGINT";
      case NUMERIC -> "NUMERIC";
      case BOOLEAN -> "BOOLEAN";
      case TIMESTAMP -> "TIMESTAMP";
      case JSON, TEXT -> "TEXT";
    };
  }

  /** Column DDL type of a database-assigned identity. */
  protected String identityColumnType() {
    return "BIGINT GENERATED BY DEFAULT AS IDENTITY";
  }

  protected int nullSqlType(ColumnType type) {
    return switch (type) {
      case INTEGER -> Types.BIGINT;
      case NUMERIC -> Types.NUMERIC;
      case BOOLEAN -> Types.BOOLEAN;
      case TIMESTAMP -> Types.TIMESTAMP;
      case JSON, TEXT -> Types.VARCHAR;
    };
  }

  protected void bindJson(PreparedStatement ps, int position, String json) throws SQLException {
    ps.setString(position, json);
  }

  protected String renderOrderTerm(String column, SortField.Direction direction) {
    return column + (direction == SortField.Direction.DESC ? " DESC" : " ASC");
  }

  /** Right-hand side of {@code updated_at = ...}. */
  protected String renderTouch(String column, Instant now, RenderCtx ctx) {
    String p1 = ctx.add(new Bind(now, ColumnType.TIMESTAMP));
    String p2 = ctx.add(new Bind(now, ColumnType.TIMESTAMP));
    return "CASE WHEN " + column + " IS NULL OR " + column + " < " + p1 + " THEN " + p2 + " ELSE " + column + " END";
  }

  protected String applyOffsetPage(String sql, Page page) {
    StringBuilder out = new StringBuilder(sql);
    if (page.skip() > 0 || !page.unlimited()) out.append(" OFFSET ").append(page.skip()).append(" ROWS");
    if (!page.unlimited()) out.append(" FETCH NEXT ").append(page.limit()).append(" ROWS ONLY");
    return out.toString();
  }

  protected ExecKind insertExecKind() {
    return ExecKind.UPDATE_GENERATED_KEYS;
  }

  protected String applyInsertReturning(String insertSql, String idColumn) {
    return insertSql;
  }
}
