package io.intellixity.docstore.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoWriteException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;
import io.intellixity.docstore.exceptions.ValidationException;
import io.intellixity.docstore.exec.TxHandle;
import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortSpec;
import io.intellixity.docstore.spi.exec.AbstractDocumentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mongo backend engine using the official MongoDB Java sync driver.
 * <p>
 * Collections are schemaless and created by the server on first insert. Minted ids are native {@link org.bson.types.ObjectId}s
 * exposed as hex strings; caller-supplied ids are stored as string {@code _id}s. Writes are single-document operations
 * and run without a session.
 */
public final class MongoDocumentEngine extends AbstractDocumentEngine<MongoHandle> {
  public static final String FAMILY = "mongo";

  private static final Logger log = LoggerFactory.getLogger(MongoDocumentEngine.class);

  private final MongoClient client;
  private final MongoDatabase db;

  public MongoDocumentEngine(MongoHandle handle, Clock clock) {
    super(Objects.requireNonNull(handle, "handle"), clock);
    this.client = handle.client();
    this.db = handle.client().getDatabase(handle.database());
  }

  public MongoDocumentEngine(MongoHandle handle) {
    this(handle, null);
  }

  @Override public String family() { return FAMILY; }

  @Override
  protected List<String> doListCollections() {
    List<String> out = db.listCollectionNames().into(new ArrayList<>());
    out.sort(null);
    return out;
  }

  @Override
  protected String doCreate(TxHandle tx, String collection, NewDocument doc) {
    org.bson.Document bson = new org.bson.Document();
    if (doc.id() != null) bson.append(MongoQueryRenderer.NATIVE_ID, doc.id());
    for (var e : doc.fields().entrySet()) bson.append(e.getKey(), MongoValues.toBson(e.getValue()));
    bson.append(Values.CREATED_AT, Date.from(doc.createdAt()));
    bson.append(Values.UPDATED_AT, Date.from(doc.updatedAt()));

    InsertOneResult r;
    try {
      r = collection(collection).insertOne(bson);
    } catch (MongoWriteException e) {
      if (ErrorCategory.fromErrorCode(e.getError().getCode()) == ErrorCategory.DUPLICATE_KEY) {
        throw new ValidationException("Document '" + doc.id() + "' already exists in collection '" + collection + "'");
      }
      throw e;
    }
    if (doc.id() != null) return doc.id();
    Object minted = (r.getInsertedId() != null && r.getInsertedId().isObjectId())
        ? r.getInsertedId().asObjectId().getValue()
        : bson.get(MongoQueryRenderer.NATIVE_ID);
    return MongoValues.idString(minted);
  }

  @Override
  protected Document doGet(String collection, String id) {
    org.bson.Document found = collection(collection).find(MongoQueryRenderer.idFilter(id)).first();
    return (found == null) ? null : toDocument(found);
  }

  @Override
  protected long doUpdate(TxHandle tx, String collection, String id, Map<String, Object> fields, Instant now) {
    org.bson.Document update = new org.bson.Document();
    if (!fields.isEmpty()) {
      org.bson.Document set = new org.bson.Document();
      for (var e : fields.entrySet()) set.append(e.getKey(), MongoValues.toBson(e.getValue()));
      update.append("$set", set);
    }
    // $max never moves updated_at backwards
    update.append("$max", new org.bson.Document(Values.UPDATED_AT, Date.from(now)));
    UpdateResult r = collection(collection).updateOne(MongoQueryRenderer.idFilter(id), update);
    return r.getMatchedCount();
  }

  @Override
  protected long doDelete(TxHandle tx, String collection, String id) {
    DeleteResult r = collection(collection).deleteOne(MongoQueryRenderer.idFilter(id));
    return r.getDeletedCount();
  }

  @Override
  protected List<Document> doList(String collection, QuerySpec query, SortSpec sort, Page page) {
    org.bson.Document filter = MongoQueryRenderer.filter(query);
    org.bson.Document order = MongoQueryRenderer.sort(sort);
    if (log.isDebugEnabled()) {
      log.debug("docstore.mongo op=FIND collection={} filterKeys={} sort={} skip={} limit={}",
          collection, filter.keySet(), order, page.skip(), page.unlimited() ? "none" : page.limit());
    }
    FindIterable<org.bson.Document> find = collection(collection).find(filter).sort(order);
    if (page.skip() > 0) find = find.skip(page.skip());
    if (!page.unlimited()) find = find.limit(page.limit());

    List<Document> out = new ArrayList<>();
    for (org.bson.Document d : find) out.add(toDocument(d));
    return out;
  }

  @Override
  protected long doCount(String collection, QuerySpec query) {
    return collection(collection).countDocuments(MongoQueryRenderer.filter(query));
  }

  @Override
  public void close() {
    client.close();
  }

  private MongoCollection<org.bson.Document> collection(String name) {
    return db.getCollection(name);
  }

  private static Document toDocument(org.bson.Document d) {
    Map<String, Object> fields = new LinkedHashMap<>();
    for (var e : d.entrySet()) {
      String k = e.getKey();
      if (MongoQueryRenderer.NATIVE_ID.equals(k) || Values.reserved(k)) continue;
      fields.put(k, MongoValues.fromBson(e.getValue()));
    }
    return new Document(
        MongoValues.idString(d.get(MongoQueryRenderer.NATIVE_ID)),
        fields,
        MongoValues.instant(d.get(Values.CREATED_AT)),
        MongoValues.instant(d.get(Values.UPDATED_AT)));
  }
}
