package io.intellixity.docstore.mongo;

import com.mongodb.MongoSocketReadException;
import com.mongodb.ServerAddress;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.docstore.exceptions.BackendOperationException;
import io.intellixity.docstore.query.QuerySpec;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

final class MongoDocumentEngineTest {
  private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

  private MongoClient client;
  private MongoCollection<Document> col;
  private MongoDocumentEngine engine;

  @BeforeEach
  @SuppressWarnings("unchecked")
  void setUp() {
    client = mock(MongoClient.class);
    MongoDatabase db = mock(MongoDatabase.class);
    col = mock(MongoCollection.class);
    when(client.getDatabase("app")).thenReturn(db);
    when(db.getCollection(anyString())).thenReturn(col);
    engine = new MongoDocumentEngine(new MongoHandle("test", client, "app"), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void create_mintsObjectIdAndStampsDates() {
    ObjectId oid = new ObjectId();
    when(col.insertOne(any(Document.class))).thenReturn(InsertOneResult.acknowledged(new BsonObjectId(oid)));

    String id = engine.create("orders", Map.of("status", "NEW", "due", NOW.plusSeconds(60)));

    assertEquals(oid.toHexString(), id);
    ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
    verify(col).insertOne(captor.capture());
    Document stored = captor.getValue();
    assertFalse(stored.containsKey("_id"));
    assertEquals(Date.from(NOW.plusSeconds(60)), stored.get("due"));
    assertEquals(Date.from(NOW), stored.get("created_at"));
    assertEquals(Date.from(NOW), stored.get("updated_at"));
  }

  @Test
  void create_callerIdBecomesStringNativeId() {
    when(col.insertOne(any(Document.class))).thenReturn(InsertOneResult.acknowledged(null));

    assertEquals("order-1", engine.create("orders", Map.of("id", "order-1", "status", "NEW")));
    ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
    verify(col).insertOne(captor.capture());
    assertEquals("order-1", captor.getValue().get("_id"));
    assertFalse(captor.getValue().containsKey("id"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void get_convertsNativeDocument() {
    ObjectId oid = new ObjectId();
    Document stored = new Document("_id", oid)
        .append("status", "NEW")
        .append("qty", 3)
        .append("owner", new Document("name", "Ada"))
        .append("created_at", Date.from(NOW))
        .append("updated_at", Date.from(NOW));
    FindIterable<Document> find = mock(FindIterable.class);
    when(col.find(any(Bson.class))).thenReturn(find);
    when(find.first()).thenReturn(stored);

    io.intellixity.docstore.model.Document d = engine.get("orders", oid.toHexString()).orElseThrow();

    assertEquals(oid.toHexString(), d.id());
    assertEquals(Map.of("status", "NEW", "qty", 3L, "owner", Map.of("name", "Ada")), d.fields());
    assertEquals(NOW, d.createdAt());
  }

  @Test
  void update_setsFieldsAndRaisesUpdatedAtWithMax() {
    when(col.updateOne(any(Bson.class), any(Bson.class))).thenReturn(UpdateResult.acknowledged(1, 0L, null));

    assertEquals(1, engine.update("orders", "order-1", Map.of("status", "PAID")));

    ArgumentCaptor<Bson> update = ArgumentCaptor.forClass(Bson.class);
    verify(col).updateOne(any(Bson.class), update.capture());
    Document u = (Document) update.getValue();
    assertEquals(new Document("status", "PAID"), u.get("$set"));
    assertEquals(new Document("updated_at", Date.from(NOW)), u.get("$max"));
  }

  @Test
  void delete_reportsDeletedCount() {
    when(col.deleteOne(any(Bson.class))).thenReturn(DeleteResult.acknowledged(0));
    assertEquals(0, engine.delete("orders", "missing"));
  }

  @Test
  @SuppressWarnings("unchecked")
  void list_appliesSortSkipAndLimit() {
    FindIterable<Document> find = mock(FindIterable.class);
    MongoCursor<Document> cursor = mock(MongoCursor.class);
    when(col.find(any(Bson.class))).thenReturn(find);
    when(find.sort(any(Bson.class))).thenReturn(find);
    when(find.skip(anyInt())).thenReturn(find);
    when(find.limit(anyInt())).thenReturn(find);
    when(find.iterator()).thenReturn(cursor);
    when(cursor.hasNext()).thenReturn(true, false);
    when(cursor.next()).thenReturn(new Document("_id", "a").append("n", 1));

    var out = engine.list("orders", QuerySpec.eq("n", 1), null, new io.intellixity.docstore.query.Page(2, 5));

    assertEquals(1, out.size());
    assertEquals("a", out.get(0).id());
    verify(find).skip(2);
    verify(find).limit(5);
  }

  @Test
  void driverFailure_isWrapped() {
    when(col.countDocuments(any(Bson.class)))
        .thenThrow(new MongoSocketReadException("connection reset", new ServerAddress()));

    BackendOperationException ex = assertThrows(BackendOperationException.class, () -> engine.count("orders", null));
    assertEquals("mongo", ex.engineFamily());
    assertEquals("count", ex.operation());
  }

  @Test
  void close_closesClient() {
    engine.close();
    verify(client).close();
  }
}
