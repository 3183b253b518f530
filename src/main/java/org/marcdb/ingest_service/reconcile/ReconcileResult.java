package org.marcdb.ingest_service.reconcile;

import java.util.List;

/**
 * Outcome of {@link Reconciler#reconcile}: every batch record lands in exactly one list.
 *
 * @param toInsert new records, in batch order, free of duplicates among themselves
 * @param duplicates records identical to a prior record (or any key match for key-only policies)
 * @param conflicts records whose key matches a prior record with different values
 */
public record ReconcileResult<T>(List<T> toInsert, List<T> duplicates, List<Conflict<T>> conflicts) {

  public boolean hasConflicts() {
    return !conflicts.isEmpty();
  }
}
