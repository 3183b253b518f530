package org.marcdb.ingest_service.loading;

/**
 * How a dependent row names its assembly: an explicit store id, or a sample id optionally
 * narrowed by run number.
 */
public record AssemblyReference(Long assemblyId, String sampleId, String runNumber) {

  /**
   * Label used in orphan descriptions, e.g. {@code sample1 run 2} or {@code assembly 14}.
   */
  public String describe() {
    if (sampleId == null) {
      return assemblyId != null ? "assembly " + assemblyId : "row without sample id";
    }
    return runNumber == null ? sampleId : sampleId + " run " + runNumber;
  }
}
