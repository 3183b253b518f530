package org.marcdb.ingest_service.loading;

import static org.marcdb.ingest_service.tabular.CanonicalField.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.exceptions.SchemaException;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyMetadata;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.AssemblyScoped;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.Isolate;
import org.marcdb.ingest_service.model.TaxonomicAssignment;
import org.marcdb.ingest_service.tabular.Table;
import org.springframework.stereotype.Component;

/**
 * Turns normalized tables into typed rows for each {@link BatchKind}.
 *
 * <p>Every load first checks that all required columns are present and fails with a
 * {@link SchemaException} listing each missing one. Only then are rows converted. The loader
 * never touches the store.
 */
@Slf4j
@Component
public class RowLoader {

  /**
   * Validates the columns of a batch and wraps its rows.
   *
   * @param table the batch, headers already normalized
   * @param kind the entity type the batch holds
   * @return one {@link SourceRow} per data row, numbered from 1
   * @throws SchemaException if any required column is missing
   */
  public List<SourceRow> load(Table table, BatchKind kind) {
    List<String> missing =
        kind.requiredColumns(table).stream().filter(column -> !table.hasColumn(column)).toList();
    if (!missing.isEmpty()) {
      throw SchemaException.missingColumns(kind.getTableName(), missing);
    }

    List<SourceRow> rows = new ArrayList<>(table.size());
    int rowNumber = 1;
    for (Map<String, String> values : table.getRows()) {
      rows.add(new SourceRow(kind, rowNumber++, values));
    }
    log.debug("Loaded {} {} rows", rows.size(), kind.getTableName());
    return rows;
  }

  public List<IsolateRow> loadIsolates(Table table) {
    return map(load(table, BatchKind.ISOLATES), this::toIsolateRow);
  }

  public List<AssemblyRow> loadAssemblies(Table table, AssemblyMetadata metadata) {
    return map(
        load(table, BatchKind.ASSEMBLIES),
        row -> new AssemblyRow(row.getRowNumber(), metadata.applyTo(toAssembly(row))));
  }

  public List<DependentRow<AssemblyQc>> loadAssemblyQcs(Table table, AssemblyMetadata metadata) {
    return loadDependents(table, BatchKind.ASSEMBLY_QC, metadata, this::toAssemblyQc);
  }

  public List<DependentRow<TaxonomicAssignment>> loadTaxonomicAssignments(
      Table table, AssemblyMetadata metadata) {
    return loadDependents(
        table, BatchKind.TAXONOMIC_ASSIGNMENTS, metadata, this::toTaxonomicAssignment);
  }

  public List<DependentRow<Contaminant>> loadContaminants(Table table, AssemblyMetadata metadata) {
    return loadDependents(table, BatchKind.CONTAMINANTS, metadata, this::toContaminant);
  }

  /**
   * Loads antimicrobial rows. Rows without any gene field are kept here and dropped by the
   * change-set builder, which reports how many were discarded.
   */
  public List<DependentRow<Antimicrobial>> loadAntimicrobials(
      Table table, AssemblyMetadata metadata) {
    return loadDependents(table, BatchKind.ANTIMICROBIALS, metadata, this::toAntimicrobial);
  }

  private <T extends AssemblyScoped<T>> List<DependentRow<T>> loadDependents(
      Table table, BatchKind kind, AssemblyMetadata metadata, Function<SourceRow, T> mapper) {
    return map(
        load(table, kind),
        row ->
            new DependentRow<>(row.getRowNumber(), toReference(row, metadata), mapper.apply(row)));
  }

  private AssemblyReference toReference(SourceRow row, AssemblyMetadata metadata) {
    String runNumber = row.getString(RUN_NUMBER);
    if (runNumber == null) {
      runNumber = metadata.runNumber();
    }
    return new AssemblyReference(row.getLong(ASSEMBLY_ID), row.getString(SAMPLE_ID), runNumber);
  }

  private IsolateRow toIsolateRow(SourceRow row) {
    String sampleId = row.getString(SAMPLE_ID);
    if (sampleId == null) {
      throw SchemaException.invalidValue(
          BatchKind.ISOLATES.getTableName(), SAMPLE_ID.getName(), row.getRowNumber(), "");
    }
    String organism = row.getString(SUSPECTED_ORGANISM);
    Isolate isolate =
        new Isolate(
            sampleId,
            row.getLong(SUBJECT_ID),
            row.getLong(SPECIMEN_ID),
            organism != null ? organism : Constants.UNKNOWN_ORGANISM,
            row.getString(SPECIAL_COLLECTION),
            row.getDate(RECEIVED_DATE),
            row.getDate(CRYOBANKING_DATE));
    Aliquot aliquot = new Aliquot(sampleId, row.getString(TUBE_BARCODE), row.getString(BOX_NAME));
    return new IsolateRow(row.getRowNumber(), isolate, aliquot);
  }

  private Assembly toAssembly(SourceRow row) {
    return new Assembly(
        null,
        row.getString(SAMPLE_ID),
        row.getString(METAGENOMIC_SAMPLE_ID),
        row.getString(METAGENOMIC_RUN_ID),
        row.getString(RUN_NUMBER),
        row.getString(NANOPORE_PATH),
        row.getString(SUNBEAM_VERSION),
        row.getString(SBX_SGA_VERSION),
        row.getString(SUNBEAM_OUTPUT_PATH),
        row.getString(NCBI_ID));
  }

  private AssemblyQc toAssemblyQc(SourceRow row) {
    return new AssemblyQc(
        null,
        row.getLong(CONTIG_COUNT),
        row.getLong(GENOME_SIZE),
        row.getLong(N50),
        row.getDouble(GC_CONTENT),
        row.getLong(CDS),
        row.getDouble(COMPLETENESS),
        row.getDouble(CONTAMINATION),
        row.getDouble(MIN_CONTIG_COVERAGE),
        row.getDouble(AVG_CONTIG_COVERAGE),
        row.getDouble(MAX_CONTIG_COVERAGE));
  }

  private TaxonomicAssignment toTaxonomicAssignment(SourceRow row) {
    return new TaxonomicAssignment(
        null,
        row.getString(TOOL),
        row.getString(CLASSIFICATION),
        row.getDouble(ABUNDANCE),
        row.getDouble(MASH_CONTAMINATION),
        row.getString(MASH_CONTAMINATED_SPP),
        row.getString(ST),
        row.getString(ST_SCHEMA),
        row.getString(ALLELE_ASSIGNMENT),
        row.getString(COMMENT));
  }

  private Contaminant toContaminant(SourceRow row) {
    return new Contaminant(
        null, row.getString(TOOL), row.getDouble(CONFIDENCE), row.getString(CLASSIFICATION));
  }

  private Antimicrobial toAntimicrobial(SourceRow row) {
    return new Antimicrobial(
        null,
        row.getString(CONTIG_ID),
        row.getString(GENE_SYMBOL),
        row.getString(GENE_NAME),
        row.getString(ACCESSION),
        row.getString(ELEMENT_TYPE),
        row.getString(RESISTANCE_PRODUCT));
  }

  private static <R> List<R> map(List<SourceRow> rows, Function<SourceRow, R> mapper) {
    List<R> mapped = new ArrayList<>(rows.size());
    rows.forEach(row -> mapped.add(mapper.apply(row)));
    return mapped;
  }
}
