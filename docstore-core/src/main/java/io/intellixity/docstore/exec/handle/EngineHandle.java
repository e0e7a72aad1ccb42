package io.intellixity.docstore.exec.handle;

/**
 * Resolved runtime handle for a backend engine family.
 * <p>
 * Example:
 * <ul>
 *   <li>JDBC: client() is javax.sql.DataSource, namespace() is schema</li>
 *   <li>Mongo: client() is MongoClient, namespace() is database</li>
 * </ul>
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client used by an engine (DataSource, MongoClient, etc.); null for the in-memory engine. */
  TClient client();

  /** Namespace (schema/database) for this handle, or null. */
  String namespace();
}
