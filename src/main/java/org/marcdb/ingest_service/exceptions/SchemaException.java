package org.marcdb.ingest_service.exceptions;

import java.util.List;

/**
 * Signals that a tabular batch does not have the shape its entity type needs: required columns
 * are missing, or a cell cannot be coerced to the column's type. Raised before any row is
 * resolved against the store.
 */
public class SchemaException extends IngestionException {

  private final List<String> missingColumns;

  public SchemaException(String message) {
    this(message, List.of());
  }

  private SchemaException(String message, List<String> missingColumns) {
    super(message);
    this.missingColumns = List.copyOf(missingColumns);
  }

  /**
   * Creates an exception naming every required column absent from a batch.
   *
   * @param batchName the entity type of the batch, used in the message
   * @param missingColumns canonical names of all missing columns, in declaration order
   * @return the exception to throw
   */
  public static SchemaException missingColumns(String batchName, List<String> missingColumns) {
    return new SchemaException(
        "Missing required column(s) in " + batchName + " batch: " + String.join(", ", missingColumns),
        missingColumns);
  }

  /**
   * Creates an exception for a cell that cannot be read as the column's type.
   *
   * @param batchName the entity type of the batch
   * @param column canonical column name
   * @param rowNumber 1-based data row number
   * @param value the offending raw value
   * @return the exception to throw
   */
  public static SchemaException invalidValue(
      String batchName, String column, int rowNumber, String value) {
    return new SchemaException(
        String.format(
            "Invalid value '%s' for column %s in %s batch (row %d)",
            value, column, batchName, rowNumber));
  }

  public List<String> getMissingColumns() {
    return missingColumns;
  }
}
