package org.marcdb.ingest_service.transaction;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.exceptions.IntegrityViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

/**
 * Scoped handle on the store transaction of one ingestion. Obtained from
 * {@link TransactionCoordinator#begin()} and meant to be used in a try-with-resources block:
 * closing a handle that was neither committed nor rolled back rolls it back.
 *
 * <p>When the caller already had a transaction, the handle wraps a savepoint; committing it
 * releases the savepoint and leaves the outer transaction to its owner.
 */
@Slf4j
public class IngestionTransaction implements AutoCloseable {

  private final PlatformTransactionManager transactionManager;
  private final TransactionStatus status;
  private final boolean nested;
  private IngestionState state = IngestionState.IDLE;

  IngestionTransaction(
      PlatformTransactionManager transactionManager, TransactionStatus status, boolean nested) {
    this.transactionManager = transactionManager;
    this.status = status;
    this.nested = nested;
    transitionTo(IngestionState.STAGING);
  }

  public IngestionState getState() {
    return state;
  }

  public boolean isNested() {
    return nested;
  }

  /**
   * Runs store writes and turns any store failure into an {@link IntegrityViolationException}.
   * Allowed while staging or validating.
   *
   * @param description what is being written, used in the error message
   * @param writes the store calls
   * @return the value returned by {@code writes}
   */
  public <T> T flush(String description, Supplier<T> writes) {
    if (state != IngestionState.STAGING && state != IngestionState.VALIDATING) {
      throw new IllegalStateException("Cannot flush " + description + " while " + state);
    }
    try {
      return writes.get();
    } catch (DataAccessException e) {
      throw new IntegrityViolationException(
          "Store rejected " + description + ": " + e.getMostSpecificCause().getMessage(), e);
    }
  }

  public void flush(String description, Runnable writes) {
    flush(
        description,
        () -> {
          writes.run();
          return null;
        });
  }

  /**
   * Marks the end of staging. Flushes issued from now on are the final validation writes.
   */
  public void validate() {
    transitionTo(IngestionState.VALIDATING);
  }

  public void awaitConfirmation() {
    transitionTo(IngestionState.AWAITING_CONFIRMATION);
  }

  public void commit() {
    transitionTo(IngestionState.COMMITTED);
    try {
      transactionManager.commit(status);
    } catch (RuntimeException e) {
      state = IngestionState.ROLLED_BACK;
      throw e;
    }
    log.debug("Ingestion transaction committed (nested: {})", nested);
  }

  public void rollback() {
    transitionTo(IngestionState.ROLLED_BACK);
    if (!status.isCompleted()) {
      transactionManager.rollback(status);
    }
    log.debug("Ingestion transaction rolled back (nested: {})", nested);
  }

  @Override
  public void close() {
    if (!state.isTerminal()) {
      log.debug("Closing ingestion transaction in state {}", state);
      rollback();
    }
  }

  private void transitionTo(IngestionState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException("Illegal ingestion state transition " + state + " -> " + next);
    }
    state = next;
  }
}
