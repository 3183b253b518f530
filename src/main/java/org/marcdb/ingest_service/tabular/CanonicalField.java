package org.marcdb.ingest_service.tabular;

import java.util.List;

/**
 * Canonical field names used by every component downstream of the {@link ColumnNormalizer},
 * together with the header aliases emitted by the upstream tools and spreadsheets.
 *
 * <p>The canonical name itself is always an accepted alias. Alias matching ignores case and
 * surrounding whitespace.
 */
public enum CanonicalField {

  /** Isolate natural key; also the isolate reference of every other batch. */
  SAMPLE_ID("sample_id", "SampleID", "Sample", "Sample ID", "isolate_id"),
  SUBJECT_ID("subject_id", "Subject ID", "SubjectID"),
  SPECIMEN_ID("specimen_id", "Specimen ID", "SpecimenID"),
  SUSPECTED_ORGANISM("suspected_organism", "sample species", "Suspected Organism", "organism"),
  SPECIAL_COLLECTION("special_collection", "Special Collection"),
  RECEIVED_DATE("received_date", "Received by mARC", "Received"),
  CRYOBANKING_DATE("cryobanking_date", "Cryobanking"),
  TUBE_BARCODE("tube_barcode", "Tube Barcode", "barcode"),
  BOX_NAME("box_name", "Box-name_position", "Box name", "box"),

  /** Store-generated assembly identifier, when a batch already knows it. */
  ASSEMBLY_ID("assembly_id", "Assembly ID"),
  RUN_NUMBER("run_number", "Run Number", "run"),
  METAGENOMIC_SAMPLE_ID("metagenomic_sample_id"),
  METAGENOMIC_RUN_ID("metagenomic_run_id", "metagenomic_run_number"),
  NANOPORE_PATH("nanopore_path"),
  SUNBEAM_VERSION("sunbeam_version"),
  SBX_SGA_VERSION("sbx_sga_version"),
  SUNBEAM_OUTPUT_PATH("sunbeam_output_path", "assembly_fasta_path"),
  NCBI_ID("ncbi_id"),

  CONTIG_COUNT("contig_count"),
  GENOME_SIZE("genome_size"),
  N50("n50", "N50"),
  GC_CONTENT("gc_content", "GC", "GC%"),
  CDS("cds", "CDS"),
  COMPLETENESS("completeness"),
  CONTAMINATION("contamination"),
  MIN_CONTIG_COVERAGE("min_contig_coverage"),
  AVG_CONTIG_COVERAGE("avg_contig_coverage"),
  MAX_CONTIG_COVERAGE("max_contig_coverage"),

  TOOL("tool"),
  CLASSIFICATION("classification", "taxonomic_classification", "Species"),
  ABUNDANCE("abundance"),
  MASH_CONTAMINATION("mash_contamination"),
  MASH_CONTAMINATED_SPP("mash_contaminated_spp"),
  ST("st"),
  ST_SCHEMA("st_schema"),
  ALLELE_ASSIGNMENT("allele_assignment"),
  COMMENT("comment"),

  CONFIDENCE("confidence", "proportion"),

  CONTIG_ID("contig_id", "Contig id"),
  GENE_SYMBOL("gene_symbol", "Gene symbol", "Element symbol"),
  GENE_NAME("gene_name", "Sequence name", "Element name"),
  ACCESSION("accession", "Accession of closest sequence"),
  ELEMENT_TYPE("element_type", "Element type", "Type"),
  RESISTANCE_PRODUCT("resistance_product", "Class");

  private final String name;
  private final List<String> aliases;

  CanonicalField(String name, String... aliases) {
    this.name = name;
    this.aliases = List.of(aliases);
  }

  /**
   * Returns the canonical column name used by the loader and the store.
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the alternative headers accepted for this field, excluding the canonical name.
   */
  public List<String> getAliases() {
    return aliases;
  }

  @Override
  public String toString() {
    return name;
  }
}
