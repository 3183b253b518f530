package org.marcdb.ingest_service.reconcile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Store-agnostic duplicate detection over plain in-memory records.
 *
 * <p>Each batch record is compared, by natural key, first with the existing records and then with
 * the records accepted earlier from the same batch. The first record seen for a key is the one
 * every later record is compared with.
 */
public final class Reconciler {

  // Private constructor to prevent instantiation
  private Reconciler() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Classifies {@code batch} against {@code existing}.
   *
   * @param existing records already persisted; only their keys and values are read
   * @param batch candidate records, in arrival order
   * @param policy key extraction and value comparison for the record type
   * @return records to insert, duplicates and conflicts
   */
  public static <T, K> ReconcileResult<T> reconcile(
      Collection<T> existing, List<T> batch, ReconcilePolicy<T, K> policy) {
    Map<K, T> stored = new HashMap<>();
    for (T record : existing) {
      stored.putIfAbsent(policy.key().apply(record), record);
    }

    Map<K, T> accepted = new HashMap<>();
    List<T> toInsert = new ArrayList<>();
    List<T> duplicates = new ArrayList<>();
    List<Conflict<T>> conflicts = new ArrayList<>();

    for (T candidate : batch) {
      K key = policy.key().apply(candidate);
      T prior = stored.get(key);
      boolean priorInStore = prior != null;
      if (prior == null) {
        prior = accepted.get(key);
      }

      if (prior == null) {
        accepted.put(key, candidate);
        toInsert.add(candidate);
      } else if (policy.keyOnly() || policy.sameValues().test(prior, candidate)) {
        duplicates.add(candidate);
      } else {
        conflicts.add(new Conflict<>(candidate, prior, priorInStore));
      }
    }
    return new ReconcileResult<>(List.copyOf(toInsert), List.copyOf(duplicates), List.copyOf(conflicts));
  }
}
