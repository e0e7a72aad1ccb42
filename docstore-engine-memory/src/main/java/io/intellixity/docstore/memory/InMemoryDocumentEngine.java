package io.intellixity.docstore.memory;

import io.intellixity.docstore.exceptions.ValidationException;
import io.intellixity.docstore.exec.TxHandle;
import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortField;
import io.intellixity.docstore.query.SortSpec;
import io.intellixity.docstore.spi.exec.AbstractDocumentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free engine keeping every collection in process memory.
 * <p>
 * Collections are ordered lists of documents created on first insert; ids are minted from a per-collection counter
 * starting at 1. Filtering and sorting are performed here rather than delegated to a backend.
 * <p>
 * <strong>Not thread-safe.</strong> The collection map and the id counters assume a single writer; callers sharing an
 * instance between threads must provide their own mutual exclusion. Data does not survive the process.
 */
public final class InMemoryDocumentEngine extends AbstractDocumentEngine<InMemoryHandle> {
  public static final String FAMILY = "memory";

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentEngine.class);
  private static final Object ABSENT = new Object();

  private final Map<String, List<StoredDocument>> collections = new LinkedHashMap<>();
  private final Map<String, Long> idCounters = new HashMap<>();

  public InMemoryDocumentEngine() {
    this(new InMemoryHandle(FAMILY), Clock.systemUTC());
  }

  public InMemoryDocumentEngine(InMemoryHandle handle, Clock clock) {
    super(handle, clock);
  }

  @Override
  public String family() { return FAMILY; }

  @Override
  protected List<String> doListCollections() {
    return new ArrayList<>(collections.keySet());
  }

  @Override
  protected String doCreate(TxHandle tx, String collection, NewDocument doc) {
    List<StoredDocument> docs = collections.computeIfAbsent(collection, k -> new ArrayList<>());
    String id = doc.id();
    if (id == null) {
      do {
        id = String.valueOf(idCounters.merge(collection, 1L, Long::sum));
      } while (find(docs, id) != null);
    } else if (find(docs, id) != null) {
      throw new ValidationException("Document '" + id + "' already exists in collection '" + collection + "'");
    }
    docs.add(new StoredDocument(id, Values.copyFields(doc.fields()), doc.createdAt(), doc.updatedAt()));
    log.trace("docstore.memory op=create collection={} id={}", collection, id);
    return id;
  }

  @Override
  protected Document doGet(String collection, String id) {
    StoredDocument d = find(collections.get(collection), id);
    return (d == null) ? null : d.snapshot();
  }

  @Override
  protected long doUpdate(TxHandle tx, String collection, String id, Map<String, Object> fields, Instant now) {
    StoredDocument d = find(collections.get(collection), id);
    if (d == null) return 0;
    for (var e : fields.entrySet()) d.fields.put(e.getKey(), Values.copy(e.getValue()));
    // never move backwards, even if the clock does
    if (now.isAfter(d.updatedAt)) d.updatedAt = now;
    return 1;
  }

  @Override
  protected long doDelete(TxHandle tx, String collection, String id) {
    List<StoredDocument> docs = collections.get(collection);
    if (docs == null) return 0;
    int before = docs.size();
    docs.removeIf(d -> d.id.equals(id));
    return before - docs.size();
  }

  @Override
  protected List<Document> doList(String collection, QuerySpec query, SortSpec sort, Page page) {
    List<StoredDocument> docs = collections.get(collection);
    if (docs == null) return List.of();

    List<StoredDocument> results = filter(docs, query);

    // One stable pass per key, last key first: the first key ends up governing the order.
    List<SortField> keys = sort.fields();
    for (int i = keys.size() - 1; i >= 0; i--) {
      SortField key = keys.get(i);
      Comparator<StoredDocument> cmp = Comparator.comparing(d -> sortValue(d, key.field()), ValueOrdering.INSTANCE);
      results.sort(key.direction() == SortField.Direction.DESC ? cmp.reversed() : cmp);
    }

    int from = Math.min(page.skip(), results.size());
    int to = (int) Math.min((long) from + page.limit(), results.size());
    List<Document> out = new ArrayList<>(to - from);
    for (StoredDocument d : results.subList(from, to)) out.add(d.snapshot());
    return out;
  }

  @Override
  protected long doCount(String collection, QuerySpec query) {
    List<StoredDocument> docs = collections.get(collection);
    if (docs == null) return 0;
    if (query.isEmpty()) return docs.size();
    return filter(docs, query).size();
  }

  @Override
  public void close() {
    // nothing to release; contents are kept until the instance is dropped
  }

  private static List<StoredDocument> filter(List<StoredDocument> docs, QuerySpec query) {
    List<StoredDocument> out = new ArrayList<>();
    for (StoredDocument d : docs) {
      if (matches(d, query)) out.add(d);
    }
    return out;
  }

  private static boolean matches(StoredDocument d, QuerySpec query) {
    for (var c : query.conditions().entrySet()) {
      Object actual = lookup(d, c.getKey());
      if (actual == ABSENT || !ValueOrdering.equal(actual, c.getValue())) return false;
    }
    return true;
  }

  private static Object sortValue(StoredDocument d, String field) {
    Object v = lookup(d, field);
    return (v == ABSENT) ? null : v;
  }

  private static Object lookup(StoredDocument d, String field) {
    return switch (field) {
      case Values.ID -> d.id;
      case Values.CREATED_AT -> d.createdAt;
      case Values.UPDATED_AT -> d.updatedAt;
      default -> d.fields.containsKey(field) ? d.fields.get(field) : ABSENT;
    };
  }

  private static StoredDocument find(List<StoredDocument> docs, String id) {
    if (docs == null) return null;
    for (StoredDocument d : docs) {
      if (d.id.equals(id)) return d;
    }
    return null;
  }

  private static final class StoredDocument {
    final String id;
    final Map<String, Object> fields;
    final Instant createdAt;
    Instant updatedAt;

    StoredDocument(String id, Map<String, Object> fields, Instant createdAt, Instant updatedAt) {
      this.id = id;
      this.fields = fields;
      this.createdAt = createdAt;
      this.updatedAt = updatedAt;
    }

    Document snapshot() {
      return new Document(id, fields, createdAt, updatedAt);
    }
  }
}
