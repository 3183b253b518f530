package org.marcdb.ingest_service.changeset;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.marcdb.ingest_service.loading.BatchKind;

/**
 * Classification of one batch: the records to insert and descriptions of everything left out.
 *
 * @param kind the batch kind
 * @param toInsert new records, in batch order
 * @param duplicateCount number of rows skipped as identical or conflicting duplicates
 * @param duplicates descriptions of the skipped duplicate rows
 * @param orphans descriptions of rows whose parent could not be resolved, one per row
 * @param extras additional named counters reported next to the added count
 */
public record StagedBatch<T>(
    BatchKind kind,
    List<T> toInsert,
    int duplicateCount,
    List<String> duplicates,
    List<String> orphans,
    Map<String, Integer> extras) {

  public static <T> StagedBatch<T> empty(BatchKind kind) {
    return new StagedBatch<>(kind, List.of(), 0, List.of(), List.of(), Map.of());
  }

  public StagedBatch<T> withExtra(String name, int count) {
    Map<String, Integer> merged = new LinkedHashMap<>(extras);
    merged.put(name, count);
    return new StagedBatch<>(kind, toInsert, duplicateCount, duplicates, orphans, merged);
  }

  public int added() {
    return toInsert.size();
  }

  public int orphanCount() {
    return orphans.size();
  }
}
