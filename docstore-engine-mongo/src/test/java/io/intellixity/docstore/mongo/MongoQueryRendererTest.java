package io.intellixity.docstore.mongo;

import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortSpec;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoQueryRendererTest {
  @Test
  void filter_equalityPerField() {
    Document d = MongoQueryRenderer.filter(QuerySpec.eq("status", "NEW").and("qty", 2));
    assertEquals("NEW", d.get("status"));
    assertEquals(2L, d.get("qty"));
  }

  @Test
  void filter_nullMatchesExplicitNullOnly() {
    Document d = MongoQueryRenderer.filter(QuerySpec.eq("note", null));
    assertEquals(new Document("$type", "null"), d.get("note"));
  }

  @Test
  void filter_timestampsBecomeDates() {
    Instant t = Instant.parse("2024-01-01T00:00:00Z");
    Document d = MongoQueryRenderer.filter(QuerySpec.eq("due", t));
    assertEquals(Date.from(t), d.get("due"));
  }

  @Test
  void idFilter_hexMatchesObjectIdOrString() {
    String hex = new ObjectId().toHexString();
    Document d = MongoQueryRenderer.idFilter(hex);
    @SuppressWarnings("unchecked")
    List<Document> or = (List<Document>) d.get("$or");
    assertEquals(new ObjectId(hex), or.get(0).get("_id"));
    assertEquals(hex, or.get(1).get("_id"));

    assertEquals(new Document("_id", "order-1"), MongoQueryRenderer.idFilter("order-1"));
  }

  @Test
  void filter_idConditionMapsToNativeId() {
    Document d = MongoQueryRenderer.filter(QuerySpec.eq("id", "order-1").and("status", "NEW"));
    assertEquals("order-1", d.get("_id"));
    assertFalse(d.containsKey("id"));
  }

  @Test
  void sort_keepsKeyOrderAndBreaksTiesById() {
    Document s = MongoQueryRenderer.sort(SortSpec.by("a", 1).then("b", -1));
    assertEquals(List.of("a", "b", "_id"), new ArrayList<>(s.keySet()));
    assertEquals(-1, s.get("b"));
    assertEquals(1, s.get("_id"));
  }
}
