package org.marcdb.ingest_service.model;

/**
 * An antimicrobial-resistance gene call on one contig of an assembly.
 */
public record Antimicrobial(
    Long assemblyId,
    String contigId,
    String geneSymbol,
    String geneName,
    String accession,
    String elementType,
    String resistanceProduct)
    implements AssemblyScoped<Antimicrobial> {

  @Override
  public Antimicrobial withAssemblyId(Long newAssemblyId) {
    return new Antimicrobial(
        newAssemblyId, contigId, geneSymbol, geneName, accession, elementType, resistanceProduct);
  }

  /**
   * True when the row carries no gene information at all. Such rows are dropped before staging.
   */
  public boolean hasNoGeneFields() {
    return geneSymbol == null
        && geneName == null
        && accession == null
        && elementType == null
        && resistanceProduct == null;
  }
}
