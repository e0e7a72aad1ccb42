package io.intellixity.docstore.selection;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.intellixity.docstore.exceptions.BackendUnavailableException;
import io.intellixity.docstore.exec.DocumentEngine;
import io.intellixity.docstore.memory.InMemoryDocumentEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class EngineSelectorTest {
  private final Logger logger = (Logger) LoggerFactory.getLogger(EngineSelector.class);
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

  /** Probe with a fixed outcome, counting connection attempts. */
  private static final class StubProbe implements EngineProbe {
    private final String family;
    private final boolean configured;
    private final DocumentEngine engine;
    final AtomicInteger attempts = new AtomicInteger();

    StubProbe(String family, boolean configured, DocumentEngine engine) {
      this.family = family;
      this.configured = configured;
      this.engine = engine;
    }

    @Override public String family() { return family; }
    @Override public boolean configured() { return configured; }

    @Override public DocumentEngine connect() {
      attempts.incrementAndGet();
      if (engine == null) throw new BackendUnavailableException(family, "connection refused", null);
      return engine;
    }
  }

  private static DocumentEngine engineOf(String family) {
    DocumentEngine e = mock(DocumentEngine.class);
    when(e.family()).thenReturn(family);
    return e;
  }

  @BeforeEach
  void attachAppender() {
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
  }

  private long warnings() {
    return appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count();
  }

  @Test
  void nothingConfigured_bindsInMemoryAndWarnsOnce() {
    EngineSelector selector = EngineSelector.forSettings(StoreSettings.none());

    DocumentEngine first = selector.get();
    DocumentEngine second = selector.get();
    selector.get().create("c", Map.of("a", 1));

    assertEquals(InMemoryDocumentEngine.FAMILY, first.family());
    assertSame(first, second);
    assertEquals(EngineSelector.State.BOUND, selector.state());
    assertEquals(1, warnings());
  }

  @Test
  void relationalPreferredWhenAvailable() {
    StubProbe jdbc = new StubProbe("jdbc", true, engineOf("jdbc"));
    StubProbe mongo = new StubProbe("mongo", true, engineOf("mongo"));
    EngineSelector selector = new EngineSelector(List.of(jdbc, mongo), new InMemoryEngineProbe());

    assertEquals("jdbc", selector.get().family());
    assertEquals(0, mongo.attempts.get());
    assertEquals(0, warnings());
  }

  @Test
  void unconfiguredProbesAreSkipped() {
    StubProbe jdbc = new StubProbe("jdbc", false, engineOf("jdbc"));
    StubProbe mongo = new StubProbe("mongo", true, engineOf("mongo"));
    EngineSelector selector = new EngineSelector(List.of(jdbc, mongo), new InMemoryEngineProbe());

    assertEquals("mongo", selector.get().family());
    assertEquals(0, jdbc.attempts.get());
  }

  @Test
  void probeFailure_isLoggedAndFallsThrough() {
    StubProbe jdbc = new StubProbe("jdbc", true, null);
    StubProbe mongo = new StubProbe("mongo", true, null);
    EngineSelector selector = new EngineSelector(List.of(jdbc, mongo), new InMemoryEngineProbe());

    assertEquals(InMemoryDocumentEngine.FAMILY, selector.get().family());
    assertEquals(2, appender.list.stream().filter(e -> e.getLevel() == Level.ERROR).count());
    assertEquals(1, warnings());
  }

  @Test
  void close_releasesEngineAndNextAccessReprobes() {
    DocumentEngine bound = engineOf("jdbc");
    StubProbe jdbc = new StubProbe("jdbc", true, bound);
    EngineSelector selector = new EngineSelector(List.of(jdbc), new InMemoryEngineProbe());

    selector.get();
    selector.close();

    verify(bound).close();
    assertEquals(EngineSelector.State.CLOSED, selector.state());

    selector.get();
    assertEquals(2, jdbc.attempts.get());
    assertEquals(EngineSelector.State.BOUND, selector.state());
  }

  @Test
  void close_thenFallbackWarnsAgain() {
    EngineSelector selector = EngineSelector.forSettings(null);
    DocumentEngine first = selector.get();
    selector.close();
    DocumentEngine second = selector.get();

    assertNotSame(first, second);
    assertEquals(2, warnings());
  }

  @Test
  void closeBeforeUse_isHarmless() {
    EngineSelector selector = EngineSelector.forSettings(StoreSettings.none());
    assertEquals(EngineSelector.State.UNINITIALIZED, selector.state());
    selector.close();
    assertEquals(EngineSelector.State.CLOSED, selector.state());
  }
}
