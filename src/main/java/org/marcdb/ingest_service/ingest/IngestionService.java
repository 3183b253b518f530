package org.marcdb.ingest_service.ingest;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.changeset.ChangeSet;
import org.marcdb.ingest_service.changeset.ChangeSetBuilder;
import org.marcdb.ingest_service.config.IngestProperties;
import org.marcdb.ingest_service.exceptions.IngestionException;
import org.marcdb.ingest_service.loading.AssemblyReference;
import org.marcdb.ingest_service.loading.AssemblyRow;
import org.marcdb.ingest_service.loading.DependentRow;
import org.marcdb.ingest_service.loading.IsolateRow;
import org.marcdb.ingest_service.loading.RowLoader;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyMetadata;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.TaxonomicAssignment;
import org.marcdb.ingest_service.report.IngestOutcome;
import org.marcdb.ingest_service.report.IngestReport;
import org.marcdb.ingest_service.report.ReportFormatter;
import org.marcdb.ingest_service.resolution.AssemblyIndex;
import org.marcdb.ingest_service.store.SpecimenStore;
import org.marcdb.ingest_service.tabular.BatchSource;
import org.marcdb.ingest_service.tabular.Table;
import org.marcdb.ingest_service.tabular.TableReader;
import org.marcdb.ingest_service.transaction.IngestionTransaction;
import org.marcdb.ingest_service.transaction.TransactionCoordinator;
import org.springframework.stereotype.Service;

/**
 * Entry point of the ingestion engine.
 *
 * <p>An ingestion reads and validates every batch first, then stages isolates, aliquots and
 * assemblies, flushes them so that dependents can be attached to generated assembly ids, stages
 * and flushes the dependents, and finally shows the change-set summary. The whole change-set is
 * committed only if the confirmation prompt accepts it (or confirmation is skipped); otherwise,
 * and on any failure, nothing is written.
 */
@Slf4j
@Service
public class IngestionService {

  private final TableReader tableReader;
  private final RowLoader rowLoader;
  private final ChangeSetBuilder changeSetBuilder;
  private final SpecimenStore store;
  private final TransactionCoordinator transactionCoordinator;
  private final ReportFormatter reportFormatter;
  private final IngestProperties ingestProperties;

  public IngestionService(
      TableReader tableReader,
      RowLoader rowLoader,
      ChangeSetBuilder changeSetBuilder,
      SpecimenStore store,
      TransactionCoordinator transactionCoordinator,
      ReportFormatter reportFormatter,
      IngestProperties ingestProperties) {
    this.tableReader = tableReader;
    this.rowLoader = rowLoader;
    this.changeSetBuilder = changeSetBuilder;
    this.store = store;
    this.transactionCoordinator = transactionCoordinator;
    this.reportFormatter = reportFormatter;
    this.ingestProperties = ingestProperties;
  }

  /**
   * Runs one ingestion.
   *
   * <p>If the calling thread is already inside a transaction the ingestion runs in a savepoint:
   * a commit then only releases the savepoint and the caller decides the final outcome.
   *
   * @param request the batches and run-wide options
   * @param prompt asked after the summary unless {@link IngestionRequest#skipConfirmation()}
   * @return the per-entity report, with outcome {@link IngestOutcome#COMMITTED} or
   *     {@link IngestOutcome#DECLINED}
   * @throws org.marcdb.ingest_service.exceptions.SchemaException if a batch lacks required
   *     columns or holds uncoercible values; nothing has been staged
   * @throws org.marcdb.ingest_service.exceptions.ConsistencyException if isolate rows conflict;
   *     the change-set is rolled back
   * @throws org.marcdb.ingest_service.exceptions.IntegrityViolationException if the store rejects
   *     a staged row; the change-set is rolled back
   */
  public IngestReport ingest(IngestionRequest request, ConfirmationPrompt prompt) {
    LoadedBatches batches = load(request);
    log.info("Loaded batches: {}", batches.describe());

    ChangeSet changeSet = new ChangeSet();
    try (IngestionTransaction transaction = transactionCoordinator.begin()) {
      stageParents(batches, changeSet, transaction);
      stageDependents(batches, changeSet);

      transaction.validate();
      transaction.flush("dependent rows", () -> flushDependents(changeSet));

      IngestReport preview = IngestReport.of(changeSet, IngestOutcome.PENDING);
      String summary = reportFormatter.summarize(preview);
      transaction.awaitConfirmation();
      if (request.skipConfirmation()) {
        log.info("Confirmation skipped, committing:\n{}", summary);
      } else if (!prompt.confirm(summary + ingestProperties.getConfirmationPrompt())) {
        transaction.rollback();
        log.info("Ingest cancelled, {} staged rows discarded", changeSet.size());
        return preview.withOutcome(IngestOutcome.DECLINED);
      }

      transaction.commit();
      IngestReport report = preview.withOutcome(IngestOutcome.COMMITTED);
      log.info(
          "Ingest committed{}: {} rows added",
          transaction.isNested() ? " to savepoint" : "",
          report.totalAdded());
      return report;
    } catch (IngestionException e) {
      log.error("Ingest failed and was rolled back: {}", e.getMessage());
      throw e;
    }
  }

  private void stageParents(
      LoadedBatches batches, ChangeSet changeSet, IngestionTransaction transaction) {
    if (batches.isolates() != null) {
      changeSetBuilder.stageIsolates(batches.isolates(), changeSet);
    }
    if (batches.assemblies() != null) {
      changeSetBuilder.stageAssemblies(batches.assemblies(), changeSet);
    }
    transaction.flush(
        "isolates, aliquots and assemblies",
        () -> {
          store.insertIsolates(changeSet.getIsolates().toInsert());
          store.insertAliquots(changeSet.getAliquots());
          List<Assembly> inserted = store.insertAssemblies(changeSet.getAssemblies().toInsert());
          log.debug("Flushed {} assemblies", inserted.size());
        });
  }

  private void stageDependents(LoadedBatches batches, ChangeSet changeSet) {
    List<AssemblyReference> references = batches.dependentReferences();
    if (references.isEmpty()) {
      return;
    }
    AssemblyIndex index = changeSetBuilder.indexAssemblies(references);
    if (batches.assemblyQcs() != null) {
      changeSetBuilder.stageAssemblyQcs(batches.assemblyQcs(), index, changeSet);
    }
    if (batches.taxonomicAssignments() != null) {
      changeSetBuilder.stageTaxonomicAssignments(batches.taxonomicAssignments(), index, changeSet);
    }
    if (batches.contaminants() != null) {
      changeSetBuilder.stageContaminants(batches.contaminants(), index, changeSet);
    }
    if (batches.antimicrobials() != null) {
      changeSetBuilder.stageAntimicrobials(batches.antimicrobials(), index, changeSet);
    }
  }

  private void flushDependents(ChangeSet changeSet) {
    store.insertAssemblyQcs(changeSet.getAssemblyQcs().toInsert());
    store.insertTaxonomicAssignments(changeSet.getTaxonomicAssignments().toInsert());
    store.insertContaminants(changeSet.getContaminants().toInsert());
    store.insertAntimicrobials(changeSet.getAntimicrobials().toInsert());
  }

  private LoadedBatches load(IngestionRequest request) {
    AssemblyMetadata metadata = request.metadataOrDefault();
    return new LoadedBatches(
        read(request.isolates(), metadata, (table, m) -> rowLoader.loadIsolates(table)),
        read(request.assemblies(), metadata, rowLoader::loadAssemblies),
        read(request.assemblyQcs(), metadata, rowLoader::loadAssemblyQcs),
        read(request.taxonomicAssignments(), metadata, rowLoader::loadTaxonomicAssignments),
        read(request.contaminants(), metadata, rowLoader::loadContaminants),
        read(request.antimicrobials(), metadata, rowLoader::loadAntimicrobials));
  }

  private <R> List<R> read(
      BatchSource source,
      AssemblyMetadata metadata,
      BiFunction<Table, AssemblyMetadata, List<R>> loader) {
    if (source == null) {
      return null;
    }
    log.debug("Reading {}", source.describe());
    return loader.apply(tableReader.read(source), metadata);
  }

  /**
   * Typed rows of every batch in the request; a batch that was not supplied is {@code null}.
   */
  private record LoadedBatches(
      List<IsolateRow> isolates,
      List<AssemblyRow> assemblies,
      List<DependentRow<AssemblyQc>> assemblyQcs,
      List<DependentRow<TaxonomicAssignment>> taxonomicAssignments,
      List<DependentRow<Contaminant>> contaminants,
      List<DependentRow<Antimicrobial>> antimicrobials) {

    List<AssemblyReference> dependentReferences() {
      List<AssemblyReference> references = new ArrayList<>();
      addReferences(references, assemblyQcs);
      addReferences(references, taxonomicAssignments);
      addReferences(references, contaminants);
      addReferences(references, antimicrobials);
      return references;
    }

    String describe() {
      return "isolates=" + count(isolates)
          + ", assemblies=" + count(assemblies)
          + ", assembly_qc=" + count(assemblyQcs)
          + ", taxonomic_assignments=" + count(taxonomicAssignments)
          + ", contaminants=" + count(contaminants)
          + ", antimicrobials=" + count(antimicrobials);
    }

    private static void addReferences(
        List<AssemblyReference> references, List<? extends DependentRow<?>> rows) {
      if (rows != null) {
        rows.forEach(row -> references.add(row.reference()));
      }
    }

    private static String count(List<?> rows) {
      return rows == null ? "-" : String.valueOf(rows.size());
    }
  }
}
