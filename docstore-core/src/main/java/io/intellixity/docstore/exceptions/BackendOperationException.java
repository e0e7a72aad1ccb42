package io.intellixity.docstore.exceptions;

/**
 * A bound engine failed while executing an operation (statement failure, transport failure).
 * <p>
 * Relational writes are rolled back before this is raised.
 */
public final class BackendOperationException extends DocStoreException {
  private final String engineFamily;
  private final String operation;
  private final String collection;

  public BackendOperationException(String engineFamily, String operation, String collection, Throwable cause) {
    super(engineFamily + " " + operation + " failed on collection '" + collection + "': "
        + (cause == null ? "unknown error" : cause.getMessage()), cause);
    this.engineFamily = engineFamily;
    this.operation = operation;
    this.collection = collection;
  }

  public String engineFamily() { return engineFamily; }
  public String operation() { return operation; }
  public String collection() { return collection; }
}
