package org.marcdb.ingest_service.exceptions;

/**
 * Runtime exception to signal that a batch file could not be opened or parsed.
 */
public class BatchReadException extends IngestionException {

  public BatchReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
