package org.marcdb.ingest_service.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.marcdb.ingest_service.changeset.StagedBatch;

/**
 * Report line for one entity type.
 *
 * @param entity table name of the entity type
 * @param added number of rows added (or, in a preview, to be added)
 * @param extras additional named counters, e.g. aliquots added with isolates
 * @param duplicateCount number of rows skipped as duplicates
 * @param duplicates sorted, distinct descriptions of the duplicate rows
 * @param orphanCount number of rows left out because their parent could not be resolved
 * @param orphans sorted, distinct descriptions of rows without a resolvable parent
 */
public record EntityReport(
    String entity,
    int added,
    Map<String, Integer> extras,
    int duplicateCount,
    List<String> duplicates,
    int orphanCount,
    List<String> orphans) {

  public static EntityReport of(StagedBatch<?> batch) {
    return new EntityReport(
        batch.kind().getTableName(),
        batch.added(),
        Collections.unmodifiableMap(new TreeMap<>(batch.extras())),
        batch.duplicateCount(),
        sortedDistinct(batch.duplicates()),
        batch.orphanCount(),
        sortedDistinct(batch.orphans()));
  }

  @JsonIgnore
  public boolean isEmpty() {
    return added == 0 && duplicateCount == 0 && orphanCount == 0 && extras.isEmpty();
  }

  private static List<String> sortedDistinct(Collection<String> descriptions) {
    return List.copyOf(new TreeSet<>(descriptions));
  }
}
