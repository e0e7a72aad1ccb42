package io.intellixity.docstore.exec;

import io.intellixity.docstore.model.Document;
import io.intellixity.docstore.query.Page;
import io.intellixity.docstore.query.QuerySpec;
import io.intellixity.docstore.query.SortSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform CRUD-and-query contract implemented by every storage engine.
 * <p>
 * All operations are synchronous. Failures surface as {@link io.intellixity.docstore.exceptions.DocStoreException}
 * subclasses.
 */
public interface DocumentEngine extends AutoCloseable {
  /** Engine family name: {@code jdbc}, {@code mongo} or {@code memory}. */
  String family();

  List<String> listCollections();

  /** Stores a new document and returns its id. */
  String create(String collection, Map<String, ?> fields);

  Optional<Document> get(String collection, String id);

  /** Merges {@code fields} into the document; returns 1 if it existed, 0 otherwise. */
  long update(String collection, String id, Map<String, ?> fields);

  /** Returns the number of removed documents (0 or 1). */
  long delete(String collection, String id);

  List<Document> list(String collection, QuerySpec query, SortSpec sort, Page page);

  long count(String collection, QuerySpec query);

  /** Releases backend resources. Engines must tolerate repeated calls. */
  @Override
  void close();
}
