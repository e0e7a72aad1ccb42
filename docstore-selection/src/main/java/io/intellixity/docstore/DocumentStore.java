package io.intellixity.docstore;

import io.intellixity.docstore.exceptions.DocumentNotFoundException;
import io.intellixity.docstore.exceptions.ValidationException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortSpec;
import io.intellixity.docstore.selection.EngineSelector;
import io.intellixity.docstore.selection.StoreSettings;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-facing document store.
 * <p>
 * Operations behave identically whichever engine is bound. The first call selects the engine; {@link #close()} releases
 * it and the next call selects again.
 *
 * <pre>{@code
 * try (DocumentStore store = DocumentStore.fromEnvironment()) {
 *   String id = store.createDocument("orders", Map.of("status", "NEW", "total", 12.5));
 *   List<Document> open = store.listDocuments("orders", QuerySpec.eq("status", "NEW"), SortSpec.by("total", -1));
 * }
 * }</pre>
 */
public final class DocumentStore implements AutoCloseable {
  /** Pass as {@code limit} to list every match. */
  public static final int UNLIMITED = Page.UNLIMITED;
  public static final int DEFAULT_LIMIT = Page.DEFAULT_LIMIT;

  private final EngineSelector selector;

  public DocumentStore(StoreSettings settings) {
    this(EngineSelector.forSettings(settings));
  }

  public DocumentStore(EngineSelector selector) {
    this.selector = Objects.requireNonNull(selector, "selector");
  }

  public static DocumentStore fromEnvironment() {
    return new DocumentStore(StoreSettings.fromEnvironment());
  }

  public List<String> listCollections() {
    return engine().listCollections();
  }

  public String createDocument(String collection, Map<String, ?> fields) {
    return engine().create(collection, fields);
  }

  /** @throws DocumentNotFoundException if no document has this id */
  public Document getDocument(String collection, String id) {
    return engine().get(collection, id).orElseThrow(() -> new DocumentNotFoundException(collection, id));
  }

  /** Returns 1 if the document existed, 0 otherwise. */
  public long updateDocument(String collection, String id, Map<String, ?> fields) {
    return engine().update(collection, id, fields);
  }

  /** Returns 1 if the document existed, 0 otherwise. */
  public long deleteDocument(String collection, String id) {
    return engine().delete(collection, id);
  }

  public List<Document> listDocuments(String collection) {
    return listDocuments(collection, QuerySpec.all(), SortSpec.none(), DEFAULT_LIMIT, 0);
  }

  public List<Document> listDocuments(String collection, QuerySpec query) {
    return listDocuments(collection, query, SortSpec.none(), DEFAULT_LIMIT, 0);
  }

  public List<Document> listDocuments(String collection, QuerySpec query, SortSpec sort) {
    return listDocuments(collection, query, sort, DEFAULT_LIMIT, 0);
  }

  /**
   * Matches of {@code query}, ordered by {@code sort}, skipping {@code skip} then returning at most {@code limit}.
   *
   * @throws ValidationException if {@code limit} or {@code skip} is negative
   */
  public List<Document> listDocuments(String collection, QuerySpec query, SortSpec sort, int limit, int skip) {
    Page page = new Page(skip, limit);
    return engine().list(collection, query, sort, page);
  }

  public long countDocuments(String collection) {
    return countDocuments(collection, QuerySpec.all());
  }

  public long countDocuments(String collection, QuerySpec query) {
    return engine().count(collection, query);
  }

  /** Family of the bound engine ({@code jdbc}, {@code mongo} or {@code memory}); binds one if needed. */
  public String engineName() {
    return engine().family();
  }

  @Override
  public void close() {
    selector.close();
  }

  private DocumentEngine engine() {
    return selector.get();
  }
}
