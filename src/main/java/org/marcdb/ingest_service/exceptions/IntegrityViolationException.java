package org.marcdb.ingest_service.exceptions;

/**
 * Wraps a constraint failure raised by the store while flushing staged rows (unknown foreign key,
 * unique or not-null violation). Always surfaces before the confirmation prompt.
 */
public class IntegrityViolationException extends IngestionException {

  public IntegrityViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
