package io.intellixity.docstore.jdbc.schema;

import org.junit.jupiter.api.Test;

import java.sql.Types;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnTypeTest {
  @Test
  void infer_fromFirstValue() {
    assertEquals(ColumnType.INTEGER, ColumnType.infer(1L));
    assertEquals(ColumnType.NUMERIC, ColumnType.infer(1.5));
    assertEquals(ColumnType.BOOLEAN, ColumnType.infer(true));
    assertEquals(ColumnType.TIMESTAMP, ColumnType.infer(Instant.EPOCH));
    assertEquals(ColumnType.JSON, ColumnType.infer(Map.of()));
    assertEquals(ColumnType.JSON, ColumnType.infer(List.of()));
    assertEquals(ColumnType.TEXT, ColumnType.infer("x"));
    assertEquals(ColumnType.TEXT, ColumnType.infer(null));
  }

  @Test
  void fromJdbc_mapsDriverMetadata() {
    assertEquals(ColumnType.INTEGER, ColumnType.fromJdbc(Types.BIGINT, "int8"));
    assertEquals(ColumnType.NUMERIC, ColumnType.fromJdbc(Types.NUMERIC, "numeric"));
    assertEquals(ColumnType.BOOLEAN, ColumnType.fromJdbc(Types.BIT, "bool"));
    assertEquals(ColumnType.TIMESTAMP, ColumnType.fromJdbc(Types.TIMESTAMP, "timestamp"));
    assertEquals(ColumnType.JSON, ColumnType.fromJdbc(Types.OTHER, "jsonb"));
    assertEquals(ColumnType.TEXT, ColumnType.fromJdbc(Types.VARCHAR, "text"));
  }

  @Test
  void accepts_nullAndMatchingKinds() {
    assertTrue(ColumnType.INTEGER.accepts(null));
    assertTrue(ColumnType.NUMERIC.accepts(3L));
    assertFalse(ColumnType.INTEGER.accepts(3.5));
    assertFalse(ColumnType.TEXT.accepts(3L));
    assertFalse(ColumnType.BOOLEAN.accepts("true"));
  }

  @Test
  void tableSchema_inferredIdentityDependsOnCallerId() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("name", "Ada");
    fields.put("age", 36L);

    TableSchema generated = TableSchema.infer(null, "people", fields, false);
    assertTrue(generated.generatedId());
    assertEquals(ColumnType.INTEGER, generated.typeOf("id"));
    assertEquals(List.of("name", "age"), List.copyOf(generated.columns().keySet()));

    TableSchema supplied = TableSchema.infer(null, "people", fields, true);
    assertFalse(supplied.generatedId());
    assertEquals(ColumnType.TEXT, supplied.typeOf("id"));
    assertEquals(ColumnType.TIMESTAMP, supplied.typeOf("updated_at"));
    assertNull(supplied.typeOf("unknown"));
  }
}
