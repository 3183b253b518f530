package org.marcdb.ingest_service;

import java.util.Set;

/**
 * A utility class holding application-wide constant values used across the ingest service.
 * This class is non-instantiable.
 */
public final class Constants {

  /**
   * Cell values treated as "no value" when loading a tabular batch. Comparison is
   * case-insensitive and happens after trimming.
   */
  public static final Set<String> NULL_TOKENS = Set.of("", "na", "n/a", "nan", "null", "none");

  /** Value stored for an isolate whose suspected organism column is blank. */
  public static final String UNKNOWN_ORGANISM = "unknown";

  /** Answers to the confirmation prompt that allow the change-set to be committed. */
  public static final Set<String> AFFIRMATIVE_ANSWERS = Set.of("y", "yes");

  // Extra counters reported next to the added count of an entity type
  public static final String ALIQUOTS_EXTRA = "aliquots";
  public static final String EMPTY_ROWS_DROPPED_EXTRA = "empty rows dropped";

  // Table names, also used as entity keys in the ingestion report
  public static final String ISOLATES_TABLE = "isolates";
  public static final String ALIQUOTS_TABLE = "aliquots";
  public static final String ASSEMBLIES_TABLE = "assemblies";
  public static final String ASSEMBLY_QC_TABLE = "assembly_qc";
  public static final String TAXONOMIC_ASSIGNMENTS_TABLE = "taxonomic_assignments";
  public static final String CONTAMINANTS_TABLE = "contaminants";
  public static final String ANTIMICROBIALS_TABLE = "antimicrobials";

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
