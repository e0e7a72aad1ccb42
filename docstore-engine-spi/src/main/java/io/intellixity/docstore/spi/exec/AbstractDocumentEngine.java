package io.intellixity.docstore.spi.exec;

import io.intellixity.docstore.exceptions.BackendOperationException;
import io.intellixity.docstore.exceptions.DocStoreException;
import io.intellixity.docstore.exceptions.ValidationException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.exec.TxHandle;
import io.intellixity.docstore.exec.handle.EngineHandle;
import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.model.Values;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Template-method orchestrator for document operations.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>argument validation and value normalization (callers' structures are never aliased)</li>
 *   <li>write transactions via {@link #inTx(Function)} and the {@link #begin()}/{@link #commit(TxHandle)}/
 *       {@link #rollback(TxHandle)} hooks</li>
 *   <li>translation of unexpected backend failures into {@link BackendOperationException}</li>
 * </ul>
 * Backends implement the {@code do*} hooks and receive already-validated, normalized input.
 */
public abstract class AbstractDocumentEngine<H extends EngineHandle<?>> implements DocumentEngine {
  private static final Logger log = LoggerFactory.getLogger(AbstractDocumentEngine.class);

  private final H handle;
  private final Clock clock;

  protected AbstractDocumentEngine(H handle, Clock clock) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.clock = (clock == null) ? Clock.systemUTC() : clock;
  }

  public final H handle() { return handle; }

  protected final Instant now() { return clock.instant(); }

  /** Backend-specific transaction begin; default engines are not transactional. */
  protected TxHandle begin() { return TxHandle.NONE; }

  protected void commit(TxHandle tx) {}

  protected void rollback(TxHandle tx) {}

  /** Frees the transaction's resources; runs after commit or rollback, whichever happened. */
  protected void release(TxHandle tx) {}

  /** Runs write work inside a backend transaction: commit on success, rollback on any failure, including a failed commit. */
  protected final <T> T inTx(Function<TxHandle, T> work) {
    TxHandle tx = begin();
    Throwable failure = null;
    try {
      T result = work.apply(tx);
      commit(tx);
      return result;
    } catch (RuntimeException | Error e) {
      failure = e;
      try {
        rollback(tx);
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      throw e;
    } finally {
      try {
        release(tx);
      } catch (RuntimeException re) {
        if (failure == null) throw re;
        failure.addSuppressed(re);
      }
    }
  }

  // --- Contract ---

  @Override
  public final List<String> listCollections() {
    return guard("listCollections", "*", this::doListCollections);
  }

  @Override
  public final String create(String collection, Map<String, ?> fields) {
    requireCollection(collection);
    if (fields == null || fields.isEmpty()) throw new ValidationException("Document data is required");
    Map<String, Object> normalized = Values.normalizeFields(fields);
    String id = takeId(normalized);
    Instant now = now();
    Instant createdAt = takeTimestamp(normalized, Values.CREATED_AT, now);
    Instant updatedAt = takeTimestamp(normalized, Values.UPDATED_AT, now);
    NewDocument doc = new NewDocument(id, normalized, createdAt, updatedAt);
    return guard("create", collection, () -> inTx(tx -> doCreate(tx, collection, doc)));
  }

  @Override
  public final Optional<Document> get(String collection, String id) {
    requireCollection(collection);
    requireId(id);
    return guard("get", collection, () -> Optional.ofNullable(doGet(collection, id)));
  }

  @Override
  public final long update(String collection, String id, Map<String, ?> fields) {
    requireCollection(collection);
    requireId(id);
    Map<String, Object> normalized = Values.normalizeFields(fields);
    for (String name : normalized.keySet()) {
      if (Values.reserved(name)) throw new ValidationException("Field '" + name + "' cannot be updated");
    }
    Instant now = now();
    return guard("update", collection, () -> inTx(tx -> doUpdate(tx, collection, id, normalized, now)));
  }

  @Override
  public final long delete(String collection, String id) {
    requireCollection(collection);
    requireId(id);
    return guard("delete", collection, () -> inTx(tx -> doDelete(tx, collection, id)));
  }

  @Override
  public final List<Document> list(String collection, QuerySpec query, SortSpec sort, Page page) {
    requireCollection(collection);
    QuerySpec q = (query == null) ? QuerySpec.all() : query;
    SortSpec s = (sort == null) ? SortSpec.none() : sort;
    Page p = (page == null) ? Page.first() : page;
    if (p.limit() == 0) return List.of();
    return guard("list", collection, () -> doList(collection, q, s, p));
  }

  @Override
  public final long count(String collection, QuerySpec query) {
    requireCollection(collection);
    QuerySpec q = (query == null) ? QuerySpec.all() : query;
    return guard("count", collection, () -> doCount(collection, q));
  }

  // --- Backend-specific hooks ---

  protected abstract List<String> doListCollections();

  protected abstract String doCreate(TxHandle tx, String collection, NewDocument doc);

  /** Returns null when absent. */
  protected abstract Document doGet(String collection, String id);

  protected abstract long doUpdate(TxHandle tx, String collection, String id, Map<String, Object> fields, Instant now);

  protected abstract long doDelete(TxHandle tx, String collection, String id);

  protected abstract List<Document> doList(String collection, QuerySpec query, SortSpec sort, Page page);

  protected abstract long doCount(String collection, QuerySpec query);

  // --- Helpers ---

  /** Runs an operation, keeping taxonomy exceptions as-is and wrapping anything else. */
  protected final <T> T guard(String operation, String collection, Supplier<T> work) {
    long start = System.nanoTime();
    try {
      T result = work.get();
      if (log.isDebugEnabled()) {
        log.debug("docstore.engine op={} family={} collection={} durationMs={}",
            operation, family(), collection, (System.nanoTime() - start) / 1_000_000.0);
      }
      return result;
    } catch (DocStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BackendOperationException(family(), operation, collection, e);
    }
  }

  private static void requireCollection(String collection) {
    if (collection == null || collection.isBlank()) throw new ValidationException("Collection name is required");
  }

  private static void requireId(String id) {
    if (id == null || id.isBlank()) throw new ValidationException("Document id is required");
  }

  private static String takeId(Map<String, Object> fields) {
    if (!fields.containsKey(Values.ID)) return null;
    Object v = fields.remove(Values.ID);
    if (v == null) return null;
    if (v instanceof Map<?, ?> || v instanceof List<?>) {
      throw new ValidationException("Document id must be a scalar value");
    }
    String id = (v instanceof Instant i) ? i.toString() : String.valueOf(v);
    if (id.isBlank()) throw new ValidationException("Document id must be non-blank");
    return id;
  }

  private static Instant takeTimestamp(Map<String, Object> fields, String name, Instant fallback) {
    if (!fields.containsKey(name)) return fallback;
    Object v = fields.remove(name);
    if (v == null) return fallback;
    if (v instanceof Instant i) return i;
    throw new ValidationException("Field '" + name + "' must be a timestamp");
  }

  /**
   * Validated input of {@link #doCreate}: {@code id} is null when the engine must mint one, {@code fields} excludes
   * the reserved entries.
   */
  public record NewDocument(String id, Map<String, Object> fields, Instant createdAt, Instant updatedAt) {
    public NewDocument {
      fields = new LinkedHashMap<>(fields);
    }
  }
}
