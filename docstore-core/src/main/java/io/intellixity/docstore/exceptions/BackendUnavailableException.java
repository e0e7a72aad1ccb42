package io.intellixity.docstore.exceptions;

/**
 * An engine's connection descriptor is configured but connecting to it failed.
 * <p>
 * Raised by engine probes during selection; the selector recovers by falling through to the next engine.
 */
public final class BackendUnavailableException extends DocStoreException {
  private final String engineFamily;

  public BackendUnavailableException(String engineFamily, String message, Throwable cause) {
    super(engineFamily + " backend unavailable: " + message, cause);
    this.engineFamily = engineFamily;
  }

  public String engineFamily() { return engineFamily; }
}
