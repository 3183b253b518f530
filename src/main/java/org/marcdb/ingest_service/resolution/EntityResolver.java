package org.marcdb.ingest_service.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.exceptions.ConsistencyException;
import org.marcdb.ingest_service.loading.AssemblyRow;
import org.marcdb.ingest_service.loading.BatchKind;
import org.marcdb.ingest_service.loading.DependentRow;
import org.marcdb.ingest_service.loading.IsolateRow;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyScoped;
import org.marcdb.ingest_service.model.Isolate;
import org.springframework.stereotype.Component;

/**
 * Determines the identity of each batch row: which isolate an isolate row stands for, whether an
 * assembly's isolate exists, and which assembly a dependent row belongs to.
 *
 * <p>Only isolate self-consistency is fatal. Assemblies and dependents whose parent cannot be
 * found are returned as orphan descriptions and left out of the change-set, since pipelines
 * routinely submit QC and taxonomy files that cover samples outside the current batch.
 */
@Slf4j
@Component
public class EntityResolver {

  /**
   * Groups isolate rows by sample id and collapses each group into one isolate.
   *
   * @param rows isolate rows in batch order
   * @return one isolate per distinct sample id, in order of first appearance
   * @throws ConsistencyException if two rows for the same sample id differ in any attribute
   */
  public List<Isolate> collapseIsolates(List<IsolateRow> rows) {
    Map<String, IsolateRow> representatives = new LinkedHashMap<>();
    for (IsolateRow row : rows) {
      String sampleId = row.isolate().sampleId();
      IsolateRow first = representatives.putIfAbsent(sampleId, row);
      if (first != null && !first.isolate().equals(row.isolate())) {
        List<String> differences = first.isolate().differencesFrom(row.isolate());
        throw new ConsistencyException(
            sampleId,
            String.join("; ", differences)
                + " (rows "
                + first.rowNumber()
                + " and "
                + row.rowNumber()
                + ")");
      }
    }
    return representatives.values().stream().map(IsolateRow::isolate).collect(Collectors.toList());
  }

  /**
   * Keeps assembly rows whose isolate is known.
   *
   * @param rows assembly rows in batch order
   * @param knownIsolateIds sample ids present in the store or staged earlier in this ingestion
   * @return assemblies to reconcile, and orphan descriptions for the rest
   */
  public Resolution<Assembly> resolveAssemblies(List<AssemblyRow> rows, Set<String> knownIsolateIds) {
    List<Assembly> resolved = new ArrayList<>();
    List<String> orphans = new ArrayList<>();
    for (AssemblyRow row : rows) {
      Assembly assembly = row.assembly();
      if (assembly.isolateId() != null && knownIsolateIds.contains(assembly.isolateId())) {
        resolved.add(assembly);
      } else {
        log.warn("Assembly row {} references unknown isolate {}", row.rowNumber(), assembly.isolateId());
        orphans.add("assembly " + assembly.label() + " (isolate not found)");
      }
    }
    return new Resolution<>(resolved, orphans);
  }

  /**
   * Attaches dependent rows to their assembly.
   *
   * @param kind the dependent batch kind, used in orphan descriptions
   * @param rows rows in batch order
   * @param index assemblies visible to this ingestion
   * @return records carrying their assembly id, and orphan descriptions for unresolved rows
   */
  public <T extends AssemblyScoped<T>> Resolution<T> resolveDependents(
      BatchKind kind, List<DependentRow<T>> rows, AssemblyIndex index) {
    List<T> resolved = new ArrayList<>();
    List<String> orphans = new ArrayList<>();
    for (DependentRow<T> row : rows) {
      AssemblyMatch match = index.match(row.reference());
      if (match.isUnique()) {
        resolved.add(row.record().withAssemblyId(match.assembly().id()));
        continue;
      }
      String description =
          "unmatched assembly for " + kind.getDisplayName() + ": " + row.reference().describe();
      if (match.status() == MatchStatus.AMBIGUOUS) {
        description += " (ambiguous between " + match.candidates().size() + " assemblies)";
      }
      log.debug("{} row {}: {}", kind.getTableName(), row.rowNumber(), description);
      orphans.add(description);
    }
    return new Resolution<>(resolved, orphans);
  }
}
