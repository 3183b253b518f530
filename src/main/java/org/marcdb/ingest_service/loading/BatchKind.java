package org.marcdb.ingest_service.loading;

import static org.marcdb.ingest_service.tabular.CanonicalField.ASSEMBLY_ID;
import static org.marcdb.ingest_service.tabular.CanonicalField.BOX_NAME;
import static org.marcdb.ingest_service.tabular.CanonicalField.CRYOBANKING_DATE;
import static org.marcdb.ingest_service.tabular.CanonicalField.RECEIVED_DATE;
import static org.marcdb.ingest_service.tabular.CanonicalField.SAMPLE_ID;
import static org.marcdb.ingest_service.tabular.CanonicalField.SPECIAL_COLLECTION;
import static org.marcdb.ingest_service.tabular.CanonicalField.SPECIMEN_ID;
import static org.marcdb.ingest_service.tabular.CanonicalField.SUBJECT_ID;
import static org.marcdb.ingest_service.tabular.CanonicalField.SUSPECTED_ORGANISM;
import static org.marcdb.ingest_service.tabular.CanonicalField.TUBE_BARCODE;

import java.util.List;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.tabular.CanonicalField;
import org.marcdb.ingest_service.tabular.Table;

/**
 * The six kinds of tabular batch accepted by an ingestion, in processing order. Parents always
 * precede the kinds that reference them.
 */
public enum BatchKind {

  /** Isolate rows; each row also describes one aliquot. */
  ISOLATES(
      Constants.ISOLATES_TABLE,
      "isolate",
      false,
      List.of(
          SAMPLE_ID,
          SUBJECT_ID,
          SPECIMEN_ID,
          SUSPECTED_ORGANISM,
          SPECIAL_COLLECTION,
          RECEIVED_DATE,
          CRYOBANKING_DATE,
          TUBE_BARCODE,
          BOX_NAME)),

  ASSEMBLIES(Constants.ASSEMBLIES_TABLE, "assembly", false, List.of(SAMPLE_ID)),

  ASSEMBLY_QC(Constants.ASSEMBLY_QC_TABLE, "assembly QC", true, List.of(SAMPLE_ID)),

  TAXONOMIC_ASSIGNMENTS(
      Constants.TAXONOMIC_ASSIGNMENTS_TABLE, "taxonomic assignment", true, List.of(SAMPLE_ID)),

  CONTAMINANTS(Constants.CONTAMINANTS_TABLE, "contaminant", true, List.of(SAMPLE_ID)),

  ANTIMICROBIALS(Constants.ANTIMICROBIALS_TABLE, "antimicrobial", true, List.of(SAMPLE_ID));

  private final String tableName;
  private final String displayName;
  private final boolean assemblyDependent;
  private final List<CanonicalField> requiredFields;

  BatchKind(
      String tableName,
      String displayName,
      boolean assemblyDependent,
      List<CanonicalField> requiredFields) {
    this.tableName = tableName;
    this.displayName = displayName;
    this.assemblyDependent = assemblyDependent;
    this.requiredFields = requiredFields;
  }

  /**
   * Table the kind is persisted to; also its key in the ingestion report.
   */
  public String getTableName() {
    return tableName;
  }

  /**
   * Singular, human readable name used in report descriptions.
   */
  public String getDisplayName() {
    return displayName;
  }

  /**
   * Returns the canonical columns a batch of this kind must carry. Assembly-dependent batches
   * that already name their assembly through an {@code assembly_id} column do not need the
   * sample id.
   *
   * @param table the batch, headers already normalized
   * @return required canonical column names
   */
  public List<String> requiredColumns(Table table) {
    if (assemblyDependent && table.hasColumn(ASSEMBLY_ID.getName())) {
      return List.of(ASSEMBLY_ID.getName());
    }
    return requiredFields.stream().map(CanonicalField::getName).toList();
  }
}
