package io.intellixity.docstore.jdbc.postgres;

import io.intellixity.docstore.jdbc.Bind;
import io.intellixity.docstore.jdbc.SqlStatement;
import io.intellixity.docstore.jdbc.SqlStatement.ExecKind;
import io.intellixity.docstore.jdbc.schema.ColumnType;
import io.intellixity.docstore.jdbc.schema.TableSchema;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.SortField;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

final class PostgresDialectTest {
  private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

  private final PostgresDialect dialect = new PostgresDialect();

  private static TableSchema events() {
    Map<String, ColumnType> cols = new LinkedHashMap<>();
    cols.put("kind", ColumnType.TEXT);
    cols.put("payload", ColumnType.JSON);
    cols.put("weight", ColumnType.NUMERIC);
    return new TableSchema("public", "events", ColumnType.INTEGER, true, cols);
  }

  @Test
  void createTable_usesBigserialAndJsonb() {
    assertEquals("CREATE TABLE IF NOT EXISTS \"public\".\"events\" ("
            + "\"id\" BIGSERIAL PRIMARY KEY, \"kind\" TEXT, \"payload\" JSONB, \"weight\" NUMERIC, "
            + "\"created_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP, \"updated_at\" TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
        dialect.renderCreateTable(events()).sql());
  }

  @Test
  void insert_returnsGeneratedId() {
    SqlStatement ss = dialect.renderInsert(events(), null, Map.of("kind", "click"), T0, T0);
    assertEquals("INSERT INTO \"public\".\"events\" (\"kind\", \"created_at\", \"updated_at\") VALUES (?, ?, ?)"
        + " RETURNING \"id\"", ss.sql());
    assertEquals(ExecKind.QUERY_ONE_VALUE, ss.execKind());
  }

  @Test
  void select_usesLimitOffsetAndNullsLowOrdering() {
    SqlStatement ss = dialect.renderSelect(events(), Map.of("kind", "click"),
        List.of(SortField.of("weight", 1), SortField.of("kind", -1)), new Page(5, 10));
    assertEquals("SELECT * FROM \"public\".\"events\" WHERE \"kind\" = ?"
        + " ORDER BY \"weight\" ASC NULLS FIRST, \"kind\" DESC NULLS LAST, \"id\" ASC LIMIT 10 OFFSET 5", ss.sql());
  }

  @Test
  void select_firstPageOmitsOffset() {
    SqlStatement ss = dialect.renderSelect(events(), Map.of(), List.of(), Page.first());
    assertTrue(ss.sql().endsWith("ORDER BY \"id\" ASC LIMIT 100"));
  }

  @Test
  void update_touchesWithGreatest() {
    SqlStatement ss = dialect.renderUpdate(events(), 3L, Map.of("kind", "view"), T0);
    assertEquals("UPDATE \"public\".\"events\" SET \"kind\" = ?, \"updated_at\" = GREATEST(\"updated_at\", ?)"
        + " WHERE \"id\" = ?", ss.sql());
    assertEquals(new Bind(T0, ColumnType.TIMESTAMP), ss.binds().get(1));
  }

  @Test
  void bind_structuredValueAsJsonb() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    dialect.bind(ps, 2, new Bind(Map.of("x", 1L), ColumnType.JSON));

    ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
    verify(ps).setObject(eq(2), captor.capture());
    PGobject obj = assertInstanceOf(PGobject.class, captor.getValue());
    assertEquals("jsonb", obj.getType());
    assertEquals("{\"x\":1}", obj.getValue());
  }

  @Test
  void bind_nullJsonUsesOtherSqlType() throws SQLException {
    PreparedStatement ps = mock(PreparedStatement.class);
    dialect.bind(ps, 1, new Bind(null, ColumnType.JSON));
    verify(ps).setNull(1, Types.OTHER);
  }
}
