package io.intellixity.docstore.selection;

import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.memory.InMemoryDocumentEngine;

/** Last-resort probe: always configured, always connects. */
public final class InMemoryEngineProbe implements EngineProbe {
  @Override public String family() { return InMemoryDocumentEngine.FAMILY; }

  @Override public boolean configured() { return true; }

  @Override public DocumentEngine connect() { return new InMemoryDocumentEngine(); }
}
