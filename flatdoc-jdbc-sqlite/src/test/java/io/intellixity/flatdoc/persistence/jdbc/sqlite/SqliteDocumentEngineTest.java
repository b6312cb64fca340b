package io.intellixity.flatdoc.persistence.jdbc.sqlite;

import io.intellixity.flatdoc.persistence.document.ArrayPolicy;
import io.intellixity.flatdoc.persistence.error.DocumentNotFoundException;
import io.intellixity.flatdoc.persistence.error.InvalidArgumentException;
import io.intellixity.flatdoc.persistence.error.InvalidConditionException;
import io.intellixity.flatdoc.persistence.error.SchemaConflictException;
import io.intellixity.flatdoc.persistence.exec.EngineSettings;
import io.intellixity.flatdoc.persistence.exec.Propagation;
import io.intellixity.flatdoc.persistence.exec.StoredDocument;
import io.intellixity.flatdoc.persistence.jdbc.JdbcDocumentEngine;
import io.intellixity.flatdoc.persistence.jdbc.JdbcHandle;
import io.intellixity.flatdoc.persistence.jdbc.dml.JdbcDmlPlanner;
import io.intellixity.flatdoc.persistence.naming.ColumnNameCodec;
import io.intellixity.flatdoc.persistence.query.SortField;
import io.intellixity.flatdoc.persistence.schema.TableSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteDocumentEngineTest {
  private static final String USERS = "user_data";

  @TempDir
  Path dir;

  private DataSource ds;
  private JdbcDocumentEngine engine;

  @BeforeEach
  void setUp() {
    ds = SqliteDataSources.file(dir.resolve("flatdoc.db"));
    engine = new JdbcDocumentEngine(ds, new SqliteDialect());
  }

  private static Map<String, Object> user(String id, Map<String, Object> details) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("user_pri", id);
    doc.put("details", details);
    return doc;
  }

  private void insertScenarioUsers() {
    engine.insertOrReplace(USERS, user("U1", Map.of("age_ind", 25, "address", Map.of("city", "Shanghai"))));
    engine.insertOrReplace(USERS, user("U2", Map.of("age2_ind", 30, "address", Map.of("city", "Beijing"))));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> details(StoredDocument d) {
    return (Map<String, Object>) d.document().get("details");
  }

  private Set<String> columns(String table) throws SQLException {
    Set<String> out = new HashSet<>();
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement("SELECT name FROM pragma_table_info(?)")) {
      ps.setString(1, table);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) out.add(rs.getString(1));
      }
    }
    return out;
  }

  private StoredDocument only(List<StoredDocument> docs) {
    assertEquals(1, docs.size(), () -> "expected one document, got " + docs);
    return docs.get(0);
  }

  @Test
  void paginatedQueryOrdersMissingSortKeyAsDefault() {
    insertScenarioUsers();

    List<StoredDocument> page = engine.queryPaginated(USERS, "details/age_ind", SortField.Direction.DESC, 1, 2);

    assertEquals(2, page.size());
    assertEquals("U1", page.get(0).document().get("user_pri"));
    assertEquals("25", details(page.get(0)).get("age_ind"));
    assertEquals("U2", page.get(1).document().get("user_pri"));
    assertFalse(details(page.get(1)).containsKey("age_ind"));
    assertEquals("30", details(page.get(1)).get("age2_ind"));
  }

  @Test
  void updateChangesOnlyTheGivenKeys() {
    insertScenarioUsers();

    assertEquals(1, engine.update(USERS, Map.of("details/age_ind", 28), "user_pri = 'U1'"));

    StoredDocument u1 = only(engine.find(USERS, "user_pri = U1"));
    assertEquals("28", details(u1).get("age_ind"));
    assertEquals(Map.of("city", "Shanghai"), details(u1).get("address"));
    assertEquals(u1, engine.getById(USERS, u1.rowId()));
  }

  @Test
  void deleteRemovesMatchingRowsOnly() {
    insertScenarioUsers();

    assertEquals(1, engine.delete(USERS, "user_pri = 'U2'"));

    List<StoredDocument> all = engine.listAll(USERS);
    assertEquals(1, all.size());
    assertEquals("U1", all.get(0).document().get("user_pri"));
    assertEquals(1, engine.count(USERS));
  }

  @Test
  void roundTripNormalizesScalarsToText() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("name", "O'Brien \"the\" ; DROP TABLE x");
    doc.put("active", true);
    doc.put("score", 12.5);
    doc.put("meta", Map.of("tags/main", "a", "empty", Map.of()));

    String rowId = engine.insertOrReplace("people", doc);
    StoredDocument back = engine.getById("people", rowId);

    assertEquals(rowId, back.rowId());
    assertEquals(Map.of(
        "name", "O'Brien \"the\" ; DROP TABLE x",
        "active", "true",
        "score", "12.5",
        "meta", Map.of("tags", Map.of("main", "a"))
    ), back.document());
  }

  @Test
  void schemaGrowsMonotonically() throws SQLException {
    engine.insertOrReplace("shapes", Map.of("a", 1, "b", 2));
    Set<String> first = columns("shapes");
    engine.insertOrReplace("shapes", Map.of("c", 3));
    Set<String> second = columns("shapes");

    assertTrue(second.containsAll(first));
    assertEquals(Set.of(TableSchema.ROW_ID, ColumnNameCodec.encode("a"), ColumnNameCodec.encode("b"),
        ColumnNameCodec.encode("c")), second);

    List<StoredDocument> docs = engine.listAll("shapes");
    assertEquals(2, docs.size());
    assertTrue(docs.stream().anyMatch(d -> d.document().equals(Map.of("c", "3"))));
  }

  @Test
  void pagesCoverEveryRowExactlyOnceInOrder() {
    for (String rank : List.of("3", "1", "5", "2", "4")) engine.insertOrReplace("ranked", Map.of("rank", rank));
    engine.insertOrReplace("ranked", Map.of("other", "x"));
    engine.insertOrReplace("ranked", Map.of("other", "y"));

    List<StoredDocument> all = new ArrayList<>();
    for (int page = 1; page <= 3; page++) {
      all.addAll(engine.queryPaginated("ranked", "rank", SortField.Direction.ASC, page, 3));
    }
    assertTrue(engine.queryPaginated("ranked", "rank", SortField.Direction.ASC, 4, 3).isEmpty());

    assertEquals(7, all.size());
    assertEquals(7, all.stream().map(StoredDocument::rowId).distinct().count());
    List<Object> ranks = all.stream().map(d -> d.document().get("rank")).toList();
    assertEquals(java.util.Arrays.asList(null, null, "1", "2", "3", "4", "5"), ranks);
  }

  @Test
  void unknownSortKeyFallsBackToRowIdOrder() {
    engine.insertOrReplace("c", Map.of("a", "1"));
    engine.insertOrReplace("c", Map.of("a", "2"));
    assertEquals(2, engine.queryPaginated("c", "missing/key", SortField.Direction.DESC, 1, 10).size());
  }

  @Test
  void mappingsSurviveANewEngineInstance() throws SQLException {
    insertScenarioUsers();
    Set<String> before = columns(USERS);

    JdbcDocumentEngine reopened = new JdbcDocumentEngine(ds, new SqliteDialect());
    assertEquals(engine.listAll(USERS), reopened.listAll(USERS));

    reopened.insertOrReplace(USERS, user("U3", Map.of("age_ind", 40)));
    assertEquals(before, columns(USERS));
    assertEquals("40", details(only(reopened.find(USERS, "user_pri = U3"))).get("age_ind"));
  }

  @Test
  void identifierCollisionIsSchemaConflict() throws SQLException {
    engine.insertOrReplace("c", Map.of("seed", "1"));
    try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
      st.executeUpdate("INSERT INTO " + EngineSettings.DEFAULT_MAPPING_TABLE + " (hashed_name, original_name) VALUES ('" +
          ColumnNameCodec.encode("victim") + "', 'impostor')");
    }

    assertThrows(SchemaConflictException.class, () -> engine.insertOrReplace("c", Map.of("victim", "v")));
    assertEquals(1, engine.count("c"));
  }

  @Test
  void declaredPrimaryKeyReplacesWholeRowAndKeepsRowId() {
    Map<String, Object> first = new LinkedHashMap<>();
    first.put("id_pri", "k1");
    first.put("a", "x");
    first.put("b", "y");
    String rowId = engine.insertOrReplace("keyed", first);

    String again = engine.insertOrReplace("keyed", Map.of("id_pri", "k1", "a", "z"));

    assertEquals(rowId, again);
    assertEquals(1, engine.count("keyed"));
    assertEquals(Map.of("id_pri", "k1", "a", "z"), engine.getById("keyed", rowId).document());
    assertEquals(rowId, engine.insertOrReplace("keyed", Map.of("id_pri", "k1")));
  }

  @Test
  void documentMissingPrimaryKeyIsRejected() {
    engine.insertOrReplace("keyed", Map.of("id_pri", "k1", "a", "x"));
    InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
        () -> engine.insertOrReplace("keyed", Map.of("a", "no key")));
    assertTrue(ex.getMessage().contains("id_pri"));
    assertEquals(1, engine.count("keyed"));
  }

  @Test
  void primaryKeyIsFixedAtCreation() {
    engine.insertOrReplace("loose", Map.of("a", "1"));
    engine.insertOrReplace("loose", Map.of("late_pri", "k"));
    engine.insertOrReplace("loose", Map.of("late_pri", "k"));
    assertEquals(3, engine.count("loose"));
  }

  @Test
  void missingCollectionBehavesAsEmpty() {
    assertTrue(engine.listAll("ghost").isEmpty());
    assertTrue(engine.find("ghost", "a = 1").isEmpty());
    assertTrue(engine.queryPaginated("ghost", "a", SortField.Direction.ASC, 1, 5).isEmpty());
    assertEquals(0, engine.count("ghost"));
    assertEquals(0, engine.update("ghost", Map.of("a", 1), "a = 2"));
    assertEquals(0, engine.delete("ghost", "a = 2"));
    assertThrows(DocumentNotFoundException.class, () -> engine.getById("ghost", "nope"));
  }

  @Test
  void getByUnknownIdIsNotFound() {
    engine.insertOrReplace("c", Map.of("a", "1"));
    DocumentNotFoundException ex = assertThrows(DocumentNotFoundException.class, () -> engine.getById("c", "nope"));
    assertEquals("nope", ex.rowId());
  }

  @Test
  void conditionOnUnknownKeyMatchesNothing() {
    engine.insertOrReplace("c", Map.of("a", "1"));
    assertTrue(engine.find("c", "zzz = 1").isEmpty());
    assertEquals(0, engine.update("c", Map.of("a", "2"), "zzz = 1"));
    assertEquals(0, engine.delete("c", "zzz = 1"));
    assertEquals(1, engine.count("c"));
  }

  @Test
  void conditionValuesAreBoundNotInterpolated() {
    insertScenarioUsers();
    assertTrue(engine.find(USERS, "user_pri = 'U1'' OR ''1''=''1'").isEmpty());
    assertEquals(2, engine.count(USERS));
  }

  @Test
  void updateAndDeleteById() {
    String id = engine.insertOrReplace("c", Map.of("a", "1", "b", Map.of("c", "2")));

    assertEquals(1, engine.updateById("c", id, Map.of("b", Map.of("d", "3"))));
    assertEquals(Map.of("a", "1", "b", Map.of("c", "2", "d", "3")), engine.getById("c", id).document());

    assertEquals(0, engine.updateById("c", "nope", Map.of("a", "x")));
    assertEquals(1, engine.deleteById("c", id));
    assertEquals(0, engine.deleteById("c", id));
  }

  @Test
  void invalidInputsFailBeforeAnyWrite() {
    assertThrows(InvalidArgumentException.class, () -> engine.insertOrReplace("Bad Path", Map.of("a", 1)));
    assertThrows(InvalidArgumentException.class, () -> engine.insertOrReplace(EngineSettings.DEFAULT_MAPPING_TABLE, Map.of("a", 1)));
    assertThrows(InvalidArgumentException.class, () -> engine.insertOrReplace("c", Map.of("tags", List.of("x"))));
    assertThrows(InvalidArgumentException.class, () -> engine.queryPaginated("c", "a", SortField.Direction.ASC, 0, 5));
    assertThrows(InvalidArgumentException.class, () -> engine.queryPaginated("c", "a", SortField.Direction.ASC, 1, 0));
    assertThrows(InvalidArgumentException.class, () -> engine.update("c", Map.of(), "a = 1"));
    assertThrows(InvalidConditionException.class, () -> engine.find("c", "a ~ 1"));
    assertThrows(InvalidConditionException.class, () -> engine.delete("c", "a = 1 OR b = 2"));
    assertEquals(0, engine.count("c"));
  }

  @Test
  void arraysAreStoredAsJsonTextWhenConfigured() {
    JdbcDocumentEngine json = new JdbcDocumentEngine(new JdbcHandle("sqlite", ds, null), new SqliteDialect(),
        new JdbcDmlPlanner(), EngineSettings.defaults().withArrayPolicy(ArrayPolicy.JSON_TEXT), Propagation.REQUIRED);
    String id = json.insertOrReplace("c", Map.of("tags", List.of("a", "b")));
    assertEquals("[\"a\",\"b\"]", json.getById("c", id).document().get("tags"));
  }

  @Test
  void failedTransactionLeavesNoRows() {
    assertThrows(IllegalStateException.class, () -> engine.inTx(() -> {
      engine.insertOrReplace("tx", Map.of("a", "1"));
      engine.insertOrReplace("tx", Map.of("a", "2"));
      throw new IllegalStateException("abort");
    }));
    assertEquals(0, engine.count("tx"));

    engine.inTx(() -> {
      engine.insertOrReplace("tx", Map.of("a", "1"));
      return engine.insertOrReplace("tx", Map.of("a", "2"));
    });
    assertEquals(2, engine.count("tx"));
  }

  @Test
  void transactionCanIntroduceNewKeysAfterItsFirstWrite() {
    String id = engine.inTx(() -> {
      engine.insertOrReplace("tx", Map.of("a", "1"));
      String second = engine.insertOrReplace("tx", Map.of("b", Map.of("c", "2")));
      assertEquals(2, engine.listAll("tx").size());
      return second;
    });

    assertEquals(Map.of("b", Map.of("c", "2")), engine.getById("tx", id).document());
    JdbcDocumentEngine reopened = new JdbcDocumentEngine(ds, new SqliteDialect());
    assertEquals(Map.of("b", Map.of("c", "2")), reopened.getById("tx", id).document());
  }

  @Test
  void rolledBackTransactionLeavesNoMapping() throws SQLException {
    assertThrows(IllegalStateException.class, () -> engine.inTx(() -> {
      engine.insertOrReplace("tx", Map.of("a", "1"));
      engine.insertOrReplace("tx", Map.of("ghost", "2"));
      throw new IllegalStateException("abort");
    }));
    assertEquals(0, mappingRows("ghost"));

    String id = engine.insertOrReplace("tx", Map.of("ghost", "3"));
    assertEquals(1, mappingRows("ghost"));
    assertEquals(Map.of("ghost", "3"), new JdbcDocumentEngine(ds, new SqliteDialect()).getById("tx", id).document());
  }

  private int mappingRows(String flatKey) throws SQLException {
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(
             "SELECT COUNT(1) FROM " + EngineSettings.DEFAULT_MAPPING_TABLE + " WHERE original_name = ?")) {
      ps.setString(1, flatKey);
      try (ResultSet rs = ps.executeQuery()) {
        rs.next();
        return rs.getInt(1);
      }
    }
  }

  @Test
  void updateReplacesConflictingSubtreeAndRowsStayReadable() {
    String id = engine.insertOrReplace("u", Map.of("id_pri", "1", "details", Map.of("age", "30", "city", "X")));

    assertEquals(1, engine.update("u", Map.of("details", "flat"), "id_pri = 1"));
    assertEquals(Map.of("id_pri", "1", "details", "flat"), engine.getById("u", id).document());

    assertEquals(1, engine.updateById("u", id, Map.of("details/age", "31")));
    assertEquals(Map.of("id_pri", "1", "details", Map.of("age", "31")), engine.getById("u", id).document());
    assertEquals(1, engine.listAll("u").size());
  }

  @Test
  void updateThatWouldClearPrimaryKeyIsSchemaConflict() {
    engine.insertOrReplace("k", Map.of("id_pri", "1", "a", "x"));

    assertThrows(SchemaConflictException.class,
        () -> engine.update("k", Map.of("id_pri", Map.of("sub", "2")), "a = x"));
    assertEquals(Map.of("id_pri", "1", "a", "x"), only(engine.listAll("k")).document());
  }

  @Test
  void concurrentWritersWithNewKeysAllSucceed() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < 4; t++) {
        final int thread = t;
        futures.add(pool.submit(() -> {
          for (int i = 0; i < 10; i++) {
            engine.insertOrReplace("busy", Map.of("shared", "s", "k" + thread + "_" + (i % 3), String.valueOf(i)));
            engine.listAll("busy");
          }
        }));
      }
      for (Future<?> f : futures) f.get(60, TimeUnit.SECONDS);
    } finally {
      pool.shutdownNow();
    }
    assertEquals(40, engine.count("busy"));
    assertEquals(40, engine.find("busy", "shared = s").size());
  }
}
