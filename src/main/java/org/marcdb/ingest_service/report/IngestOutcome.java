package org.marcdb.ingest_service.report;

/**
 * What happened to a change-set.
 */
public enum IngestOutcome {
  /** Summarised but not decided yet; only seen in the confirmation preview. */
  PENDING,
  COMMITTED,
  DECLINED
}
