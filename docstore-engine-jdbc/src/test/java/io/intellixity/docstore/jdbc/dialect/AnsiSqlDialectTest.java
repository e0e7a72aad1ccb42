package io.intellixity.docstore.jdbc.dialect;

import io.intellixity.docstore.jdbc.Bind;
import io.intellixity.docstore.jdbc.SqlStatement;
import io.intellixity.docstore.jdbc.SqlStatement.ExecKind;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.jdbc.schema.TableSchema;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.SortField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class AnsiSqlDialectTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final AnsiSqlDialect dialect = new AnsiSqlDialect();

  private static TableSchema orders() {
    Map<String, ColumnType> cols = new LinkedHashMap<>();
    cols.put("status", ColumnType.TEXT);
    cols.put("qty", ColumnType.INTEGER);
    cols.put("meta", ColumnType.JSON);
    return new TableSchema(null, "orders", ColumnType.INTEGER, true, cols);
  }

  @Test
  void createTable_withGeneratedIdentityAndTimestamps() {
    SqlStatement ss = dialect.renderCreateTable(orders());
    assertEquals("CREATE TABLE IF NOT EXISTS \"orders\" ("
        + "\"id\" BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
        + "\"status\" TEXT, \"qty\" BIGINT, \"meta\" TEXT, "
        + "\"created_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
        + "\"updated_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP)", ss.sql());
    assertEquals(ExecKind.UPDATE, ss.execKind());
  }

  @Test
  void createTable_schemaQualifiedWithCallerId() {
    TableSchema t = new TableSchema("app", "tags", ColumnType.TEXT, false, Map.of("label", ColumnType.TEXT));
    assertTrue(dialect.renderCreateTable(t).sql()
        .startsWith("CREATE TABLE IF NOT EXISTS \"app\".\"tags\" (\"id\" TEXT PRIMARY KEY, "));
  }

  @Test
  void insert_bindsEveryValue() {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("status", "NEW");
    values.put("qty", 2L);
    SqlStatement ss = dialect.renderInsert(orders(), null, values, T0, T0);

    assertEquals("INSERT INTO \"orders\" (\"status\", \"qty\", \"created_at\", \"updated_at\") VALUES (?, ?, ?, ?)",
        ss.sql());
    assertEquals(ExecKind.UPDATE_GENERATED_KEYS, ss.execKind());
    assertEquals(new Bind("NEW", ColumnType.TEXT), ss.binds().get(0));
    assertEquals(new Bind(2L, ColumnType.INTEGER), ss.binds().get(1));
    assertEquals(new Bind(T0, ColumnType.TIMESTAMP), ss.binds().get(2));
  }

  @Test
  void insert_withExplicitId_needsNoKeys() {
    SqlStatement ss = dialect.renderInsert(orders(), 9L, Map.of(), T0, T0);
    assertTrue(ss.sql().startsWith("INSERT INTO \"orders\" (\"id\", \"created_at\""));
    assertEquals(ExecKind.UPDATE, ss.execKind());
    assertEquals(9L, ss.binds().get(0).value());
  }

  @Test
  void select_equalityConjunctionWithSortAndPaging() {
    Map<String, Object> cond = new LinkedHashMap<>();
    cond.put("status", "NEW");
    cond.put("qty", null);
    SqlStatement ss = dialect.renderSelect(orders(), cond,
        List.of(SortField.of("qty", -1), SortField.of("status", 1)), new Page(20, 10));

    assertEquals("SELECT * FROM \"orders\" WHERE \"status\" = ? AND \"qty\" IS NULL"
        + " ORDER BY \"qty\" DESC, \"status\" ASC, \"id\" ASC OFFSET 20 ROWS FETCH NEXT 10 ROWS ONLY", ss.sql());
    assertEquals(List.of(new Bind("NEW", ColumnType.TEXT)), ss.binds());
  }

  @Test
  void select_unlimitedHasNoPagingClause() {
    SqlStatement ss = dialect.renderSelect(orders(), Map.of(), List.of(), Page.all());
    assertEquals("SELECT * FROM \"orders\" ORDER BY \"id\" ASC", ss.sql());
  }

  @Test
  void count_neverInterpolatesValues() {
    SqlStatement ss = dialect.renderCount(orders(), Map.of("status", "x' OR '1'='1"));
    assertEquals("SELECT COUNT(*) FROM \"orders\" WHERE \"status\" = ?", ss.sql());
    assertEquals("x' OR '1'='1", ss.binds().get(0).value());
  }

  @Test
  void update_setsValuesAndTouchesUpdatedAtMonotonically() {
    SqlStatement ss = dialect.renderUpdate(orders(), 5L, Map.of("qty", 3L), T0);
    assertEquals("UPDATE \"orders\" SET \"qty\" = ?, \"updated_at\" = CASE WHEN \"updated_at\" IS NULL OR "
        + "\"updated_at\" < ? THEN ? ELSE \"updated_at\" END WHERE \"id\" = ?", ss.sql());
    assertEquals(4, ss.binds().size());
    assertEquals(new Bind(5L, ColumnType.INTEGER), ss.binds().get(3));
  }

  @Test
  void delete_byId() {
    SqlStatement ss = dialect.renderDelete(orders(), 5L);
    assertEquals("DELETE FROM \"orders\" WHERE \"id\" = ?", ss.sql());
  }

  @Test
  void quoteIdent_escapesQuotes() {
    assertEquals("\"we\"\"ird\"", dialect.quoteIdent("we\"ird"));
  }

  @Test
  void numericBind_keepsIntegerAndFloatApartInTheScale() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    dialect.bind(ps, 1, new Bind(2L, ColumnType.NUMERIC));
    dialect.bind(ps, 2, new Bind(2.0, ColumnType.NUMERIC));
    dialect.bind(ps, 3, new Bind(1e20, ColumnType.NUMERIC));

    verify(ps).setBigDecimal(1, new BigDecimal("2"));
    verify(ps).setBigDecimal(2, new BigDecimal("2.0"));
    verify(ps).setBigDecimal(3, new BigDecimal("100000000000000000000.0"));
  }

  @Test
  void numericRead_scaleDecidesTheKind() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    BigDecimal huge = new BigDecimal("123456789012345678901234567890");
    when(rs.getBigDecimal(1)).thenReturn(new BigDecimal("2"), new BigDecimal("2.0"), new BigDecimal("1.5"), huge, null);

    assertEquals(2L, dialect.read(rs, 1, ColumnType.NUMERIC));
    assertEquals(2.0, dialect.read(rs, 1, ColumnType.NUMERIC));
    assertEquals(1.5, dialect.read(rs, 1, ColumnType.NUMERIC));
    assertEquals(huge.doubleValue(), dialect.read(rs, 1, ColumnType.NUMERIC));
    assertNull(dialect.read(rs, 1, ColumnType.NUMERIC));
  }
}
