package io.intellixity.flatdoc.persistence.spi.exec;

import io.intellixity.flatdoc.persistence.dmlast.*;
import io.intellixity.flatdoc.persistence.document.FlatDocument;
import io.intellixity.flatdoc.persistence.exec.Propagation;
import io.intellixity.flatdoc.persistence.exec.TxHandle;
import io.intellixity.flatdoc.persistence.exec.handle.EngineHandle;
import io.intellixity.flatdoc.persistence.naming.NameMappingStore;
import io.intellixity.flatdoc.persistence.schema.TableSchema;
import io.intellixity.flatdoc.persistence.spi.sql.Dialect;
import io.intellixity.flatdoc.persistence.spi.sql.NativeStatement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractDocumentEngineDefaultPropagationTest {

  private record Stmt() implements NativeStatement {}

  private static final class NoopDialect implements Dialect<Stmt> {
    @Override public String id() { return "test"; }
    @Override public Stmt renderDml(DmlAst dml) { throw new UnsupportedOperationException(); }
    @Override public Stmt renderDdl(DdlAst ddl) { throw new UnsupportedOperationException(); }
    @Override public Stmt renderSelect(SelectAst select) { throw new UnsupportedOperationException(); }
    @Override public Stmt renderCount(CountAst count) { throw new UnsupportedOperationException(); }
    @Override public Stmt renderColumnsQuery(String table) { throw new UnsupportedOperationException(); }
    @Override public int maxIdentifierLength() { return 63; }
  }

  private static final class NoopPlanner implements DmlPlanner {
    @Override public InsertAst planInsert(String table, String rowId, FlatDocument doc) { throw new UnsupportedOperationException(); }
    @Override public UpsertAst planUpsert(TableSchema schema, String rowId, FlatDocument doc) { throw new UnsupportedOperationException(); }
    @Override public UpdateAst planUpdate(String table, FlatDocument sets, List<String> clears, List<ColumnBind> where) { throw new UnsupportedOperationException(); }
    @Override public DeleteAst planDelete(String table, List<ColumnBind> where) { throw new UnsupportedOperationException(); }
  }

  private static final class EmptyStore implements NameMappingStore {
    @Override public Map<String, String> load() { return Map.of(); }
    @Override public String insertIfAbsent(String hashedName, String originalName) { return originalName; }
    @Override public String findOriginal(String hashedName) { return null; }
  }

  private record NoopHandle() implements EngineHandle<Object> {
    @Override public String id() { return "noop"; }
    @Override public Object client() { return new Object(); }
    @Override public String namespace() { return "schema"; }
  }

  private static final class CountingEngine extends AbstractDocumentEngine<Stmt, NoopHandle> {
    private final AtomicInteger begins = new AtomicInteger();
    private final List<String> events = new ArrayList<>();

    CountingEngine(Propagation defaultPropagation) {
      super(new NoopDialect(), new NoopHandle(), new NoopPlanner(), new EmptyStore(), null, defaultPropagation);
    }

    int beginCount() { return begins.get(); }

    TxHandle current() { return currentTxOrNull(); }

    @Override protected TxHandle begin() {
      int n = begins.incrementAndGet();
      events.add("begin" + n);
      return new TxHandle() {};
    }
    @Override protected void commit(TxHandle tx) { events.add("commit"); }
    @Override protected void rollback(TxHandle tx) { events.add("rollback"); }

    @Override protected List<Map<String, String>> executeQuery(TxHandle txOrNull, String op, String table, Stmt stmt) { throw new UnsupportedOperationException(); }
    @Override protected long executeUpdate(TxHandle txOrNull, String op, String table, Stmt stmt) { throw new UnsupportedOperationException(); }
  }

  @Test
  void inTxSupplier_usesEngineDefaultPropagation_requiredStartsTx() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    String out = e.inTx(() -> "ok");
    assertEquals("ok", out);
    assertEquals(1, e.beginCount());
  }

  @Test
  void inTxSupplier_usesEngineDefaultPropagation_supportsDoesNotStartTx() {
    CountingEngine e = new CountingEngine(Propagation.SUPPORTS);
    String out = e.inTx(() -> "ok");
    assertEquals("ok", out);
    assertEquals(0, e.beginCount());
  }

  @Test
  void required_joinsExistingTx() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    e.inTx(() -> e.inTx(Propagation.REQUIRED, () -> "inner"));
    assertEquals(1, e.beginCount());
    assertEquals(List.of("begin1", "commit"), e.events);
  }

  @Test
  void requiresNew_suspendsAndRestoresOuterTx() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    e.inTx(() -> {
      TxHandle outer = e.current();
      e.inTx(Propagation.REQUIRES_NEW, () -> {
        assertNotSame(outer, e.current());
        return null;
      });
      assertSame(outer, e.current());
      return null;
    });
    assertNull(e.current());
    assertEquals(List.of("begin1", "begin2", "commit", "commit"), e.events);
  }

  @Test
  void failureRollsBackAndRethrows() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> e.inTx(() -> {
      throw new IllegalStateException("boom");
    }));
    assertEquals("boom", ex.getMessage());
    assertEquals(List.of("begin1", "rollback"), e.events);
    assertNull(e.current());
  }

  @Test
  void afterCommitHooksRunOnlyOnceTheOuterTxCommits() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    e.inTx(() -> {
      e.afterCommit(() -> e.events.add("hook"));
      e.inTx(Propagation.REQUIRED, () -> {
        e.afterCommit(() -> e.events.add("innerHook"));
        return null;
      });
      assertEquals(List.of("begin1"), e.events);
      return null;
    });
    assertEquals(List.of("begin1", "commit", "hook", "innerHook"), e.events);

    e.afterCommit(() -> e.events.add("direct"));
    assertEquals("direct", e.events.get(e.events.size() - 1));
  }

  @Test
  void afterCommitHooksAreDroppedOnRollback() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    assertThrows(IllegalStateException.class, () -> e.inTx(() -> {
      e.afterCommit(() -> e.events.add("hook"));
      throw new IllegalStateException("boom");
    }));
    assertEquals(List.of("begin1", "rollback"), e.events);
  }

  @Test
  void mandatoryAndNeverCheckForExistingTx() {
    CountingEngine e = new CountingEngine(Propagation.REQUIRED);
    assertThrows(IllegalStateException.class, () -> e.inTx(Propagation.MANDATORY, () -> "x"));
    assertEquals("x", e.inTx(Propagation.NEVER, () -> "x"));
    assertThrows(IllegalStateException.class, () -> e.inTx(() -> e.inTx(Propagation.NEVER, () -> "x")));
  }

  @Test
  void transactionsAreNotSharedBetweenEngines() {
    CountingEngine a = new CountingEngine(Propagation.REQUIRED);
    CountingEngine b = new CountingEngine(Propagation.REQUIRED);
    a.inTx(() -> {
      assertNotNull(a.current());
      assertNull(b.current());
      return b.inTx(() -> "b");
    });
    assertEquals(1, a.beginCount());
    assertEquals(1, b.beginCount());
  }
}
