package io.intellixity.flatdoc.persistence.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnNameCodecTest {

  @Test
  void encodeIsDeterministicAndFixedLength() {
    String a = ColumnNameCodec.encode("details/address/city");
    assertEquals(a, ColumnNameCodec.encode("details/address/city"));
    assertEquals(36, a.length());
    assertTrue(a.startsWith("col_"));
    assertTrue(ColumnNameCodec.isColumnId(a));
  }

  @Test
  void encodeMatchesTruncatedSha256() {
    // SHA-256("") = e3b0c44298fc1c149afbf4c8996fb924...
    assertEquals("col_e3b0c44298fc1c149afbf4c8996fb924", ColumnNameCodec.encode(""));
  }

  @Test
  void distinctKeysGetDistinctIdentifiers() {
    assertNotEquals(ColumnNameCodec.encode("name"), ColumnNameCodec.encode("Name"));
    assertNotEquals(ColumnNameCodec.encode("a/b"), ColumnNameCodec.encode("a_b"));
  }

  @Test
  void identifiersAreSafeSqlIdentifiers() {
    String id = ColumnNameCodec.encode("weird \"key\"; DROP TABLE x; --");
    assertTrue(id.matches("[a-z0-9_]+"), id);
  }

  @Test
  void indexNameDependsOnTableAndColumn() {
    String col = ColumnNameCodec.encode("age_ind");
    String i1 = ColumnNameCodec.indexName("users", col);
    String i2 = ColumnNameCodec.indexName("people", col);
    assertNotEquals(i1, i2);
    assertTrue(i1.startsWith("idx_"));
    assertEquals(36, i1.length());
  }

  @Test
  void isColumnIdRejectsOtherNames() {
    assertFalse(ColumnNameCodec.isColumnId("row_id"));
    assertFalse(ColumnNameCodec.isColumnId(null));
    assertFalse(ColumnNameCodec.isColumnId("col_E3B0C44298FC1C149AFBF4C8996FB924"));
  }
}
