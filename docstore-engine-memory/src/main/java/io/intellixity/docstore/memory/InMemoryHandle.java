package io.intellixity.docstore.memory;

import io.intellixity.docstore.exec.handle.EngineHandle;

import java.util.Objects;

/** Handle for the process-local engine; there is no native client. */
public final class InMemoryHandle implements EngineHandle<Void> {
  private final String id;

  public InMemoryHandle(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  @Override public String id() { return id; }
  @Override public Void client() { return null; }
  @Override public String namespace() { return null; }
}
