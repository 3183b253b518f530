package org.marcdb.ingest_service.tabular;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TableTest {

  @Test
  void testShortRowsArePaddedWithNull() {
    Table table = Table.of(List.of("a", "b", "c"), List.of(List.of("1")));

    Map<String, String> row = table.getRows().get(0);
    assertEquals("1", row.get("a"));
    assertTrue(row.containsKey("b"));
    assertNull(row.get("b"));
    assertNull(row.get("c"));
  }

  @Test
  void testFirstOfRepeatedHeadersWins() {
    Table table = Table.of(List.of("a", "a"), List.of(List.of("first", "second")));

    assertEquals("first", table.getRows().get(0).get("a"));
  }

  @Test
  void testRenameColumnsKeepsValues() {
    Table table =
        Table.of(List.of("SampleID", "Run"), List.of(List.of("s1", "2"), Arrays.asList("s2", null)));

    Table renamed = table.renameColumns(ColumnNormalizer::normalize);

    assertEquals(List.of("sample_id", "run_number"), renamed.getColumns());
    assertEquals(2, renamed.size());
    assertEquals("s1", renamed.getRows().get(0).get("sample_id"));
    assertEquals("2", renamed.getRows().get(0).get("run_number"));
    assertNull(renamed.getRows().get(1).get("run_number"));
    assertTrue(renamed.hasColumn("sample_id"));
    assertFalse(renamed.hasColumn("SampleID"));
  }

  @Test
  void testTableIsImmutable() {
    Table table = Table.of(List.of("a"), List.of(List.of("1")));

    assertThrows(UnsupportedOperationException.class, () -> table.getColumns().add("b"));
    assertThrows(UnsupportedOperationException.class, () -> table.getRows().get(0).put("a", "2"));
  }

  @Test
  void testBatchSourceNeedsExactlyOneOrigin() {
    assertThrows(IllegalArgumentException.class, () -> new BatchSource(null, null));
    assertThrows(NullPointerException.class, () -> BatchSource.of((Table) null));
  }
}
