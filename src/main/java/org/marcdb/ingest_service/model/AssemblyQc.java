package org.marcdb.ingest_service.model;

/**
 * Assembly quality metrics. At most one per assembly.
 */
public record AssemblyQc(
    Long assemblyId,
    Long contigCount,
    Long genomeSize,
    Long n50,
    Double gcContent,
    Long cds,
    Double completeness,
    Double contamination,
    Double minContigCoverage,
    Double avgContigCoverage,
    Double maxContigCoverage)
    implements AssemblyScoped<AssemblyQc> {

  @Override
  public AssemblyQc withAssemblyId(Long newAssemblyId) {
    return new AssemblyQc(
        newAssemblyId,
        contigCount,
        genomeSize,
        n50,
        gcContent,
        cds,
        completeness,
        contamination,
        minContigCoverage,
        avgContigCoverage,
        maxContigCoverage);
  }
}
