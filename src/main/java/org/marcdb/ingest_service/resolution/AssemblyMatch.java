package org.marcdb.ingest_service.resolution;

import java.util.List;
import org.marcdb.ingest_service.model.Assembly;

/**
 * Result of resolving a dependent row to an assembly.
 *
 * @param status whether exactly one, several or no assembly matched
 * @param assembly the match when {@code status} is {@link MatchStatus#UNIQUE}, otherwise null
 * @param candidates the assemblies still in the running when resolution stopped
 */
public record AssemblyMatch(MatchStatus status, Assembly assembly, List<Assembly> candidates) {

  static AssemblyMatch unique(Assembly assembly) {
    return new AssemblyMatch(MatchStatus.UNIQUE, assembly, List.of(assembly));
  }

  static AssemblyMatch ambiguous(List<Assembly> candidates) {
    return new AssemblyMatch(MatchStatus.AMBIGUOUS, null, List.copyOf(candidates));
  }

  static AssemblyMatch none() {
    return new AssemblyMatch(MatchStatus.NONE, null, List.of());
  }

  public boolean isUnique() {
    return status == MatchStatus.UNIQUE;
  }
}
