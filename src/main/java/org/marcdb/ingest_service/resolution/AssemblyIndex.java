package org.marcdb.ingest_service.resolution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.marcdb.ingest_service.loading.AssemblyReference;
import org.marcdb.ingest_service.model.Assembly;

/**
 * Lookup of persisted assemblies (committed, or flushed earlier in the running ingestion) used to
 * attach dependent rows to their assembly.
 *
 * <p>Resolution is a ranked list of rules, applied in order until one yields a decision:
 *
 * <ol>
 *   <li>an explicit assembly id names the assembly directly;
 *   <li>a row naming a run number only matches assemblies of its sample with that run;
 *   <li>otherwise a sample id matching exactly one assembly selects it.
 * </ol>
 *
 * Anything left with zero or several candidates is not attached.
 */
public final class AssemblyIndex {

  private final Map<Long, Assembly> byId = new HashMap<>();
  private final Map<String, List<Assembly>> bySampleId = new HashMap<>();

  public AssemblyIndex(Collection<Assembly> assemblies) {
    for (Assembly assembly : assemblies) {
      if (assembly.id() == null) {
        throw new IllegalArgumentException(
            "Assembly " + assembly.label() + " has not been flushed and has no id");
      }
      if (byId.put(assembly.id(), assembly) == null) {
        bySampleId.computeIfAbsent(assembly.isolateId(), k -> new ArrayList<>()).add(assembly);
      }
    }
    bySampleId.values().forEach(list -> list.sort(Comparator.comparing(Assembly::id)));
  }

  /**
   * Resolves a reference to at most one assembly.
   *
   * @param reference the assembly columns of a dependent row
   * @return the match outcome
   */
  public AssemblyMatch match(AssemblyReference reference) {
    if (reference.assemblyId() != null) {
      Assembly assembly = byId.get(reference.assemblyId());
      return assembly != null ? AssemblyMatch.unique(assembly) : AssemblyMatch.none();
    }

    List<Assembly> candidates = bySampleId.getOrDefault(reference.sampleId(), List.of());
    if (reference.runNumber() != null) {
      candidates =
          candidates.stream()
              .filter(assembly -> Objects.equals(assembly.runNumber(), reference.runNumber()))
              .toList();
    }
    if (candidates.isEmpty()) {
      return AssemblyMatch.none();
    }
    return candidates.size() == 1
        ? AssemblyMatch.unique(candidates.get(0))
        : AssemblyMatch.ambiguous(candidates);
  }

  public Assembly get(Long assemblyId) {
    return byId.get(assemblyId);
  }

  public int size() {
    return byId.size();
  }
}
