package org.marcdb.ingest_service.changeset;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.exceptions.ConsistencyException;
import org.marcdb.ingest_service.loading.AssemblyReference;
import org.marcdb.ingest_service.loading.AssemblyRow;
import org.marcdb.ingest_service.loading.BatchKind;
import org.marcdb.ingest_service.loading.DependentRow;
import org.marcdb.ingest_service.loading.IsolateRow;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.AssemblyScoped;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.Isolate;
import org.marcdb.ingest_service.model.TaxonomicAssignment;
import org.marcdb.ingest_service.reconcile.Conflict;
import org.marcdb.ingest_service.reconcile.ReconcilePolicy;
import org.marcdb.ingest_service.reconcile.ReconcileResult;
import org.marcdb.ingest_service.reconcile.Reconciler;
import org.marcdb.ingest_service.resolution.AssemblyIndex;
import org.marcdb.ingest_service.resolution.EntityResolver;
import org.marcdb.ingest_service.resolution.Resolution;
import org.marcdb.ingest_service.store.SpecimenStore;
import org.springframework.stereotype.Component;

/**
 * Fills a {@link ChangeSet} one entity type at a time, in the order parents before children.
 *
 * <p>Each stage resolves the rows of one batch, reads the matching records from the store and
 * reconciles the batch against them. Nothing is written here: persisting the staged rows, and
 * making generated assembly ids visible before dependents are staged, is left to the caller.
 */
@Slf4j
@Component
public class ChangeSetBuilder {

  private static final ReconcilePolicy<Isolate, String> ISOLATE_POLICY =
      ReconcilePolicy.byKey(Isolate::sampleId);

  private static final ReconcilePolicy<Aliquot, Aliquot> ALIQUOT_POLICY =
      ReconcilePolicy.byKey(Function.identity());

  private static final ReconcilePolicy<Assembly, List<String>> ASSEMBLY_POLICY =
      ReconcilePolicy.byKey(
          assembly -> Arrays.asList(assembly.isolateId(), assembly.runNumber()),
          Assembly::sameValuesAs);

  private static final ReconcilePolicy<AssemblyQc, Long> QC_POLICY =
      ReconcilePolicy.keyOnly(AssemblyQc::assemblyId);

  private static final ReconcilePolicy<TaxonomicAssignment, List<Object>> TAXONOMY_POLICY =
      ReconcilePolicy.byKey(
          tax -> Arrays.<Object>asList(tax.assemblyId(), tax.tool(), tax.classification()));

  private static final ReconcilePolicy<Contaminant, Contaminant> CONTAMINANT_POLICY =
      ReconcilePolicy.byKey(Function.identity());

  private static final ReconcilePolicy<Antimicrobial, Antimicrobial> ANTIMICROBIAL_POLICY =
      ReconcilePolicy.byKey(Function.identity());

  private final EntityResolver resolver;
  private final SpecimenStore store;

  public ChangeSetBuilder(EntityResolver resolver, SpecimenStore store) {
    this.resolver = resolver;
    this.store = store;
  }

  /**
   * Stages the isolates and aliquots of an isolate batch. Isolates and aliquots already stored
   * with identical values are skipped silently.
   *
   * @throws ConsistencyException if rows for one sample id disagree, or disagree with the stored
   *     isolate
   */
  public void stageIsolates(List<IsolateRow> rows, ChangeSet changeSet) {
    List<Isolate> collapsed = resolver.collapseIsolates(rows);
    List<String> sampleIds = collapsed.stream().map(Isolate::sampleId).toList();

    Map<String, Isolate> stored = store.findIsolates(sampleIds);
    ReconcileResult<Isolate> isolates = Reconciler.reconcile(stored.values(), collapsed, ISOLATE_POLICY);
    if (isolates.hasConflicts()) {
      Conflict<Isolate> conflict = isolates.conflicts().get(0);
      throw new ConsistencyException(
          conflict.candidate().sampleId(),
          String.join("; ", conflict.prior().differencesFrom(conflict.candidate()))
              + " (stored record differs from batch)");
    }

    List<Aliquot> batchAliquots = rows.stream().map(IsolateRow::aliquot).toList();
    ReconcileResult<Aliquot> aliquots =
        Reconciler.reconcile(store.findAliquots(sampleIds), batchAliquots, ALIQUOT_POLICY);

    log.info(
        "Staged {} new isolates ({} already stored) and {} new aliquots from {} rows",
        isolates.toInsert().size(),
        isolates.duplicates().size(),
        aliquots.toInsert().size(),
        rows.size());
    changeSet.setAliquots(aliquots.toInsert());
    changeSet.setIsolates(
        new StagedBatch<Isolate>(BatchKind.ISOLATES, isolates.toInsert(), 0, List.of(), List.of(), Map.of())
            .withExtra(Constants.ALIQUOTS_EXTRA, aliquots.toInsert().size()));
  }

  /**
   * Stages assemblies whose isolate is stored or staged in {@code changeSet}. Assemblies are
   * matched with stored ones on (isolate id, run number).
   */
  public void stageAssemblies(List<AssemblyRow> rows, ChangeSet changeSet) {
    Set<String> sampleIds =
        rows.stream()
            .map(row -> row.assembly().isolateId())
            .filter(Objects::nonNull)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    Set<String> knownIsolates = new HashSet<>(store.findIsolates(sampleIds).keySet());
    changeSet.getIsolates().toInsert().forEach(isolate -> knownIsolates.add(isolate.sampleId()));

    Resolution<Assembly> resolution = resolver.resolveAssemblies(rows, knownIsolates);
    Set<String> resolvedIsolates =
        resolution.resolved().stream()
            .map(Assembly::isolateId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    ReconcileResult<Assembly> result =
        Reconciler.reconcile(
            store.findAssembliesByIsolate(resolvedIsolates), resolution.resolved(), ASSEMBLY_POLICY);

    StagedBatch<Assembly> staged =
        classify(BatchKind.ASSEMBLIES, resolution, result, assembly -> "assembly " + assembly.label());
    log.info(
        "Staged {} new assemblies, {} duplicates, {} orphans",
        staged.added(),
        staged.duplicateCount(),
        staged.orphanCount());
    changeSet.setAssemblies(staged);
  }

  /**
   * Builds the lookup used to attach dependent rows, from the assemblies visible in the store for
   * the given references. Assemblies flushed earlier in the running transaction are included.
   */
  public AssemblyIndex indexAssemblies(Collection<AssemblyReference> references) {
    Set<String> sampleIds = new LinkedHashSet<>();
    Set<Long> assemblyIds = new LinkedHashSet<>();
    for (AssemblyReference reference : references) {
      if (reference.assemblyId() != null) {
        assemblyIds.add(reference.assemblyId());
      } else if (reference.sampleId() != null) {
        sampleIds.add(reference.sampleId());
      }
    }
    List<Assembly> assemblies = new ArrayList<>(store.findAssembliesByIsolate(sampleIds));
    assemblies.addAll(store.findAssembliesById(assemblyIds));
    AssemblyIndex index = new AssemblyIndex(assemblies);
    log.debug("Indexed {} assemblies for {} references", index.size(), references.size());
    return index;
  }

  public void stageAssemblyQcs(
      List<DependentRow<AssemblyQc>> rows, AssemblyIndex index, ChangeSet changeSet) {
    changeSet.setAssemblyQcs(
        stageDependents(
            BatchKind.ASSEMBLY_QC,
            rows,
            index,
            store::findAssemblyQcs,
            QC_POLICY,
            qc -> "assembly QC for " + label(index, qc)));
  }

  public void stageTaxonomicAssignments(
      List<DependentRow<TaxonomicAssignment>> rows, AssemblyIndex index, ChangeSet changeSet) {
    changeSet.setTaxonomicAssignments(
        stageDependents(
            BatchKind.TAXONOMIC_ASSIGNMENTS,
            rows,
            index,
            store::findTaxonomicAssignments,
            TAXONOMY_POLICY,
            tax ->
                "taxonomic assignment "
                    + tax.tool()
                    + "/"
                    + tax.classification()
                    + " for "
                    + label(index, tax)));
  }

  public void stageContaminants(
      List<DependentRow<Contaminant>> rows, AssemblyIndex index, ChangeSet changeSet) {
    changeSet.setContaminants(
        stageDependents(
            BatchKind.CONTAMINANTS,
            rows,
            index,
            store::findContaminants,
            CONTAMINANT_POLICY,
            contaminant ->
                "contaminant "
                    + contaminant.tool()
                    + "/"
                    + contaminant.classification()
                    + " for "
                    + label(index, contaminant)));
  }

  /**
   * Stages antimicrobial rows. Rows without any gene field are dropped first and counted under
   * {@link Constants#EMPTY_ROWS_DROPPED_EXTRA}.
   */
  public void stageAntimicrobials(
      List<DependentRow<Antimicrobial>> rows, AssemblyIndex index, ChangeSet changeSet) {
    List<DependentRow<Antimicrobial>> withGenes =
        rows.stream().filter(row -> !row.record().hasNoGeneFields()).toList();
    int dropped = rows.size() - withGenes.size();
    if (dropped > 0) {
      log.debug("Dropped {} antimicrobial rows without gene fields", dropped);
    }

    StagedBatch<Antimicrobial> staged =
        stageDependents(
            BatchKind.ANTIMICROBIALS,
            withGenes,
            index,
            store::findAntimicrobials,
            ANTIMICROBIAL_POLICY,
            amr ->
                "antimicrobial "
                    + amr.geneSymbol()
                    + " on "
                    + amr.contigId()
                    + " for "
                    + label(index, amr));
    changeSet.setAntimicrobials(
        dropped > 0 ? staged.withExtra(Constants.EMPTY_ROWS_DROPPED_EXTRA, dropped) : staged);
  }

  private <T extends AssemblyScoped<T>, K> StagedBatch<T> stageDependents(
      BatchKind kind,
      List<DependentRow<T>> rows,
      AssemblyIndex index,
      Function<Collection<Long>, List<T>> existing,
      ReconcilePolicy<T, K> policy,
      Function<T, String> describe) {
    Resolution<T> resolution = resolver.resolveDependents(kind, rows, index);
    Set<Long> assemblyIds =
        resolution.resolved().stream()
            .map(AssemblyScoped::assemblyId)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    ReconcileResult<T> result =
        Reconciler.reconcile(existing.apply(assemblyIds), resolution.resolved(), policy);

    StagedBatch<T> staged = classify(kind, resolution, result, describe);
    if (staged.orphanCount() > 0) {
      log.warn(
          "{} {} rows could not be attached to an assembly",
          staged.orphanCount(),
          kind.getTableName());
    }
    log.info(
        "Staged {} new {} rows, {} duplicates, {} orphans",
        staged.added(),
        kind.getTableName(),
        staged.duplicateCount(),
        staged.orphanCount());
    return staged;
  }

  private static <T> StagedBatch<T> classify(
      BatchKind kind,
      Resolution<T> resolution,
      ReconcileResult<T> result,
      Function<T, String> describe) {
    List<String> duplicates = new ArrayList<>();
    result.duplicates().forEach(record -> duplicates.add(describe.apply(record)));
    for (Conflict<T> conflict : result.conflicts()) {
      String description =
          describe.apply(conflict.candidate())
              + (conflict.priorInStore()
                  ? " (differs from stored record)"
                  : " (differs from earlier row)");
      log.warn("Skipping conflicting {}", description);
      duplicates.add(description);
    }
    return new StagedBatch<>(
        kind,
        result.toInsert(),
        result.duplicates().size() + result.conflicts().size(),
        List.copyOf(duplicates),
        resolution.orphans(),
        Map.of());
  }

  private static String label(AssemblyIndex index, AssemblyScoped<?> record) {
    Assembly assembly = index.get(record.assemblyId());
    return assembly != null ? assembly.label() : "assembly " + record.assemblyId();
  }
}
