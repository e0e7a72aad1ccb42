package io.intellixity.docstore.selection;

import io.intellixity.docstore.exceptions.BackendUnavailableException;
import io.intellixity.docstore.exec.DocumentEngine;

/** Checks whether one engine family is usable and, if so, connects it. */
public interface EngineProbe {
  /** Engine family this probe connects: {@code jdbc}, {@code mongo} or {@code memory}. */
  String family();

  /** True when the engine's connection descriptor is present. Unconfigured probes are skipped. */
  boolean configured();

  /**
   * Connects and verifies the engine.
   *
   * @throws BackendUnavailableException if the descriptor is present but connecting fails
   */
  DocumentEngine connect();
}
