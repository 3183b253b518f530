package org.marcdb.ingest_service.model;

import java.util.Objects;

/**
 * One genomic assembly run for an isolate. {@code id} is generated by the store and is
 * {@code null} until the assembly has been flushed. The natural identity is
 * ({@code isolateId}, {@code runNumber}).
 */
public record Assembly(
    Long id,
    String isolateId,
    String metagenomicSampleId,
    String metagenomicRunId,
    String runNumber,
    String nanoporePath,
    String sunbeamVersion,
    String sbxSgaVersion,
    String sunbeamOutputPath,
    String ncbiId) {

  public Assembly withId(Long newId) {
    return new Assembly(
        newId,
        isolateId,
        metagenomicSampleId,
        metagenomicRunId,
        runNumber,
        nanoporePath,
        sunbeamVersion,
        sbxSgaVersion,
        sunbeamOutputPath,
        ncbiId);
  }

  /**
   * Compares every attribute except the generated id.
   */
  public boolean sameValuesAs(Assembly other) {
    return other != null && Objects.equals(withId(null), other.withId(null));
  }

  /**
   * Human readable label, e.g. {@code sample1 run 2}.
   */
  public String label() {
    return runNumber == null ? isolateId : isolateId + " run " + runNumber;
  }
}
