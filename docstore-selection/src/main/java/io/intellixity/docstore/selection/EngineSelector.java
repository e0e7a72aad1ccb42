package io.intellixity.docstore.selection;

import io.intellixity.docstore.exceptions.BackendUnavailableException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.memory.InMemoryDocumentEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Lazily binds one {@link DocumentEngine} and reuses it until {@link #close()}.
 * <p>
 * Selection probes engines strictly in priority order:
 * <ul>
 *   <li>relational, if its descriptor is configured</li>
 *   <li>document store, if its descriptor is configured</li>
 *   <li>in-memory, unconditionally (logged as a warning: data does not survive a restart)</li>
 * </ul>
 * A failing probe is logged and skipped. After {@code close()} the next {@link #get()} probes again.
 */
public final class EngineSelector implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EngineSelector.class);

  public enum State { UNINITIALIZED, PROBING, BOUND, CLOSED }

  private final List<EngineProbe> probes;
  private final EngineProbe fallback;

  private State state = State.UNINITIALIZED;
  private DocumentEngine engine;

  /**
   * @param probes   configured-or-not probes in priority order
   * @param fallback probe used when every other probe is unconfigured or unavailable
   */
  public EngineSelector(List<EngineProbe> probes, EngineProbe fallback) {
    this.probes = List.copyOf(Objects.requireNonNull(probes, "probes"));
    this.fallback = Objects.requireNonNull(fallback, "fallback");
  }

  /** Standard priority chain for the given settings: relational, then Mongo, then in-memory. */
  public static EngineSelector forSettings(StoreSettings settings) {
    StoreSettings s = (settings == null) ? StoreSettings.none() : settings;
    List<EngineProbe> chain = new ArrayList<>();
    chain.add(new JdbcEngineProbe(s.relational()));
    chain.add(new MongoEngineProbe(s.mongo()));
    return new EngineSelector(chain, new InMemoryEngineProbe());
  }

  /** Bound engine, selecting one first if none is bound. */
  public synchronized DocumentEngine get() {
    if (state == State.BOUND) return engine;
    state = State.PROBING;
    try {
      engine = select();
      state = State.BOUND;
      return engine;
    } catch (RuntimeException e) {
      state = State.UNINITIALIZED;
      throw e;
    }
  }

  public synchronized State state() {
    return state;
  }

  /** Closes the bound engine (if any); the next {@link #get()} re-probes. */
  @Override
  public synchronized void close() {
    DocumentEngine bound = engine;
    engine = null;
    state = State.CLOSED;
    if (bound != null) {
      log.info("docstore.selection closing engine={}", bound.family());
      bound.close();
    }
  }

  private DocumentEngine select() {
    for (EngineProbe probe : probes) {
      if (!probe.configured()) {
        log.debug("docstore.selection engine={} not configured; skipping", probe.family());
        continue;
      }
      try {
        DocumentEngine e = probe.connect();
        log.info("docstore.selection bound engine={}", e.family());
        return e;
      } catch (BackendUnavailableException e) {
        log.error("docstore.selection engine={} unavailable; trying next", probe.family(), e);
      }
    }
    DocumentEngine e = fallback.connect();
    if (InMemoryDocumentEngine.FAMILY.equals(e.family())) {
      log.warn("docstore.selection bound engine={}; no persistent backend is available and data is ephemeral", e.family());
    } else {
      log.info("docstore.selection bound engine={}", e.family());
    }
    return e;
  }
}
