package org.marcdb.ingest_service.tabular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * An in-memory tabular batch: an ordered header row and the data rows keyed by header.
 *
 * <p>Rows keep {@code null} for cells that are absent. Tables are immutable once built.
 */
public final class Table {

  private final List<String> columns;
  private final List<Map<String, String>> rows;

  private Table(List<String> columns, List<Map<String, String>> rows) {
    this.columns = Collections.unmodifiableList(columns);
    this.rows = Collections.unmodifiableList(rows);
  }

  /**
   * Builds a table from a header row and positional values. Short rows are padded with
   * {@code null}; when a header repeats, the first occurrence wins.
   *
   * @param columns header row
   * @param values data rows, each aligned with {@code columns}
   * @return the table
   */
  public static Table of(List<String> columns, List<List<String>> values) {
    List<Map<String, String>> rows = new ArrayList<>(values.size());
    for (List<String> rowValues : values) {
      Map<String, String> row = new LinkedHashMap<>();
      for (int i = 0; i < columns.size(); i++) {
        String column = columns.get(i);
        if (!row.containsKey(column)) {
          row.put(column, i < rowValues.size() ? rowValues.get(i) : null);
        }
      }
      rows.add(Collections.unmodifiableMap(row));
    }
    return new Table(new ArrayList<>(columns), rows);
  }

  /**
   * Returns a copy of this table whose headers have been passed through {@code renamer}. When two
   * headers end up with the same name, the first keeps its values.
   */
  public Table renameColumns(UnaryOperator<String> renamer) {
    List<String> renamed = new ArrayList<>(columns.size());
    List<List<String>> values = new ArrayList<>(rows.size());
    columns.forEach(column -> renamed.add(renamer.apply(column)));
    for (Map<String, String> row : rows) {
      List<String> rowValues = new ArrayList<>(columns.size());
      columns.forEach(column -> rowValues.add(row.get(column)));
      values.add(rowValues);
    }
    return of(renamed, values);
  }

  public List<String> getColumns() {
    return columns;
  }

  public List<Map<String, String>> getRows() {
    return rows;
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  public int size() {
    return rows.size();
  }
}
