package io.intellixity.docstore.exceptions;

/** Raised when caller input is missing or malformed (empty collection name, empty document, unsupported value). */
public final class ValidationException extends DocStoreException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
