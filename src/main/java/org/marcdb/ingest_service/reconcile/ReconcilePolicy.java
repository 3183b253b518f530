package org.marcdb.ingest_service.reconcile;

import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Describes how records of one entity type are compared.
 *
 * @param key extracts the natural duplicate key; keys are compared with {@link Object#equals}
 * @param sameValues decides whether two records with equal keys carry identical values
 * @param keyOnly when true any prior record with the key is a duplicate, whatever its values
 * @param <T> record type
 * @param <K> key type
 */
public record ReconcilePolicy<T, K>(
    Function<T, K> key, BiPredicate<T, T> sameValues, boolean keyOnly) {

  /**
   * Policy comparing full record equality once keys match.
   */
  public static <T, K> ReconcilePolicy<T, K> byKey(Function<T, K> key) {
    return new ReconcilePolicy<>(key, Objects::equals, false);
  }

  /**
   * Policy with a custom value comparison.
   */
  public static <T, K> ReconcilePolicy<T, K> byKey(
      Function<T, K> key, BiPredicate<T, T> sameValues) {
    return new ReconcilePolicy<>(key, sameValues, false);
  }

  /**
   * Policy for one-to-one records: a key match alone makes a duplicate.
   */
  public static <T, K> ReconcilePolicy<T, K> keyOnly(Function<T, K> key) {
    return new ReconcilePolicy<>(key, (a, b) -> true, true);
  }
}
