package org.marcdb.ingest_service.model;

/**
 * A contamination call for an assembly.
 */
public record Contaminant(Long assemblyId, String tool, Double confidence, String classification)
    implements AssemblyScoped<Contaminant> {

  @Override
  public Contaminant withAssemblyId(Long newAssemblyId) {
    return new Contaminant(newAssemblyId, tool, confidence, classification);
  }
}
