package org.marcdb.ingest_service.reconcile;

/**
 * A candidate record whose key matches a prior record carrying different values.
 *
 * @param candidate the rejected batch record
 * @param prior the stored or earlier-accepted record it collides with
 * @param priorInStore true when {@code prior} comes from the store, false when it was accepted
 *     earlier in the same batch
 */
public record Conflict<T>(T candidate, T prior, boolean priorInStore) {}
