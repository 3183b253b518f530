package org.marcdb.ingest_service.loading;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.exceptions.SchemaException;
import org.marcdb.ingest_service.tabular.CanonicalField;

/**
 * One data row of a batch with typed accessors. Cells matching one of the
 * {@link Constants#NULL_TOKENS} read as {@code null}; absent columns read as {@code null} too.
 */
public final class SourceRow {

  private final BatchKind kind;
  private final int rowNumber;
  private final Map<String, String> values;

  public SourceRow(BatchKind kind, int rowNumber, Map<String, String> values) {
    this.kind = kind;
    this.rowNumber = rowNumber;
    this.values = values;
  }

  /**
   * Returns the 1-based position of the row among the data rows of its batch.
   */
  public int getRowNumber() {
    return rowNumber;
  }

  public String getString(CanonicalField field) {
    String raw = values.get(field.getName());
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    return Constants.NULL_TOKENS.contains(trimmed.toLowerCase(Locale.ROOT)) ? null : trimmed;
  }

  /**
   * Reads an integral cell. Spreadsheet exports write whole numbers as {@code 12.0}; those are
   * accepted.
   *
   * @throws SchemaException if the cell holds anything but a whole number
   */
  public Long getLong(CanonicalField field) {
    String value = getString(field);
    if (value == null) {
      return null;
    }
    try {
      return new BigDecimal(value).longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw SchemaException.invalidValue(kind.getTableName(), field.getName(), rowNumber, value);
    }
  }

  /**
   * Reads a decimal cell. A trailing percent sign is ignored.
   *
   * @throws SchemaException if the cell is not a number
   */
  public Double getDouble(CanonicalField field) {
    String value = getString(field);
    if (value == null) {
      return null;
    }
    String number = value.endsWith("%") ? value.substring(0, value.length() - 1).trim() : value;
    try {
      return Double.valueOf(number);
    } catch (NumberFormatException e) {
      throw SchemaException.invalidValue(kind.getTableName(), field.getName(), rowNumber, value);
    }
  }

  /**
   * Reads a date cell leniently; unparseable values yield {@code null}.
   */
  public LocalDate getDate(CanonicalField field) {
    return LenientDateParser.parse(getString(field));
  }
}
