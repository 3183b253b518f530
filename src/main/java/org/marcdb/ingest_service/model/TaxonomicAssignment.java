package org.marcdb.ingest_service.model;

/**
 * A taxonomic call for an assembly. Several tools may each contribute one; a call is identified
 * by (assembly, tool, classification).
 */
public record TaxonomicAssignment(
    Long assemblyId,
    String tool,
    String classification,
    Double abundance,
    Double mashContamination,
    String mashContaminatedSpp,
    String st,
    String stSchema,
    String alleleAssignment,
    String comment)
    implements AssemblyScoped<TaxonomicAssignment> {

  @Override
  public TaxonomicAssignment withAssemblyId(Long newAssemblyId) {
    return new TaxonomicAssignment(
        newAssemblyId,
        tool,
        classification,
        abundance,
        mashContamination,
        mashContaminatedSpp,
        st,
        stSchema,
        alleleAssignment,
        comment);
  }
}
