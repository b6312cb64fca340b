package io.intellixity.flatdoc.persistence.naming;

import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.error.UnknownColumnException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnNamesTest {

  @Test
  void registerRecordsOnceAndDecodes() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    ColumnNames names = new ColumnNames(store);

    String col = names.register("details/age_ind");
    assertEquals(col, names.register("details/age_ind"));
    assertEquals(1, store.inserts.get());
    assertEquals("details/age_ind", names.decode(col));
  }

  @Test
  void deferredPublishKeepsPairOutOfCacheUntilRun() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    ColumnNames names = new ColumnNames(store);
    List<Runnable> pending = new ArrayList<>();
    names.publishWith(pending::add);

    String col = names.register("pending/key");
    assertEquals(0, names.size());
    assertEquals(1, pending.size());

    // Still unpublished, so the store is asked again.
    names.register("pending/key");
    assertEquals(2, store.inserts.get());

    pending.forEach(Runnable::run);
    assertEquals(1, names.size());
    names.register("pending/key");
    assertEquals(2, store.inserts.get());
    assertEquals("pending/key", names.decode(col));
  }

  @Test
  void encodeDoesNotRecord() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    ColumnNames names = new ColumnNames(store);
    String col = names.encode("name");
    assertEquals(0, store.inserts.get());
    assertThrows(UnknownColumnException.class, () -> names.decode(col));
  }

  @Test
  void newInstanceLoadsExistingMappings() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    String col = new ColumnNames(store).register("user/email");

    ColumnNames reopened = new ColumnNames(store);
    assertEquals(1, reopened.size());
    assertEquals("user/email", reopened.decode(col));
  }

  @Test
  void decodeFallsThroughToStoreForPairsRecordedElsewhere() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    ColumnNames names = new ColumnNames(store);
    String col = ColumnNameCodec.encode("late/key");
    store.put(col, "late/key");

    assertEquals("late/key", names.decode(col));
    assertEquals(1, store.finds.get());
    names.decode(col);
    assertEquals(1, store.finds.get());
  }

  @Test
  void collisionWithDifferentRecordedKeyIsSchemaConflict() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    store.put(ColumnNameCodec.encode("a"), "something-else");
    ColumnNames names = new ColumnNames(store);

    SchemaConflictException ex = assertThrows(SchemaConflictException.class, () -> names.register("a"));
    assertTrue(ex.getMessage().contains("something-else"));
  }

  @Test
  void collisionDetectedWhenStoreWinsRace() {
    InMemoryNameMappingStore store = new InMemoryNameMappingStore();
    ColumnNames names = new ColumnNames(store);
    store.put(ColumnNameCodec.encode("b"), "other");

    assertThrows(SchemaConflictException.class, () -> names.register("b"));
    assertThrows(SchemaConflictException.class, () -> names.register("b"));
  }
}
