package org.marcdb.ingest_service.exceptions;

/**
 * Umbrella exception for all fatal ingestion errors.
 * <p>
 * Any subclass thrown while an ingestion is in progress aborts the whole batch: the transaction
 * is rolled back and the exception reaches the caller. Duplicates and orphans are never reported
 * through exceptions.
 */
public class IngestionException extends RuntimeException {

  public IngestionException(String message) {
    super(message);
  }

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
