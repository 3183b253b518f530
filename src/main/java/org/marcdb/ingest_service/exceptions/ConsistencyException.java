package org.marcdb.ingest_service.exceptions;

/**
 * Raised when rows for one isolate disagree with each other, or with the isolate already in the
 * store. Isolate data is never overwritten, so the whole ingestion is aborted.
 */
public class ConsistencyException extends IngestionException {

  private final String sampleId;

  public ConsistencyException(String sampleId, String detail) {
    super("Conflicting isolate data for SampleID " + sampleId + ": " + detail);
    this.sampleId = sampleId;
  }

  public String getSampleId() {
    return sampleId;
  }
}
