package org.marcdb.ingest_service.model;

import lombok.Builder;

/**
 * Values shared by a whole ingestion that override the matching assembly columns. Any component
 * left {@code null} keeps the value from the batch.
 */
@Builder
public record AssemblyMetadata(
    String runNumber, String sunbeamVersion, String sbxSgaVersion, String sunbeamOutputPath) {

  public static final AssemblyMetadata NONE = new AssemblyMetadata(null, null, null, null);

  /**
   * Returns {@code assembly} with every non-null override applied.
   */
  public Assembly applyTo(Assembly assembly) {
    return new Assembly(
        assembly.id(),
        assembly.isolateId(),
        assembly.metagenomicSampleId(),
        assembly.metagenomicRunId(),
        runNumber != null ? runNumber : assembly.runNumber(),
        assembly.nanoporePath(),
        sunbeamVersion != null ? sunbeamVersion : assembly.sunbeamVersion(),
        sbxSgaVersion != null ? sbxSgaVersion : assembly.sbxSgaVersion(),
        sunbeamOutputPath != null ? sunbeamOutputPath : assembly.sunbeamOutputPath(),
        assembly.ncbiId());
  }
}
