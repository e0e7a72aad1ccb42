package io.intellixity.docstore.exceptions;

/**
 * Root of the document store failure taxonomy.
 * <p>
 * Every failure a caller can observe from a store operation is one of the concrete subclasses, so callers can
 * distinguish bad input, a missing document, an unavailable backend and a failed backend operation.
 */
public abstract class DocStoreException extends RuntimeException {
  protected DocStoreException(String message) {
    super(message);
  }

  protected DocStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
