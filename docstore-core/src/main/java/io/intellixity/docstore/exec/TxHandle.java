package io.intellixity.docstore.exec;

/** Backend-specific transaction token passed between an engine's begin/commit/rollback hooks. */
public interface TxHandle {
  /** Token for engines that do not run writes in a backend transaction. */
  TxHandle NONE = new TxHandle() {
    @Override public String toString() { return "TxHandle.NONE"; }
  };
}
