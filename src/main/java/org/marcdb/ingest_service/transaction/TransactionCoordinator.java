package org.marcdb.ingest_service.transaction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Opens the store transaction an ingestion runs in. The coordinator is the only component that
 * talks to the {@link PlatformTransactionManager}; everything else writes through the store and
 * joins the transaction bound to the current thread.
 */
@Slf4j
@Service
public class TransactionCoordinator {

  private final PlatformTransactionManager transactionManager;

  public TransactionCoordinator(PlatformTransactionManager transactionManager) {
    this.transactionManager = transactionManager;
  }

  /**
   * Starts staging. If the calling thread already runs inside a transaction, the ingestion gets a
   * savepoint within it; otherwise a new top-level transaction is opened.
   *
   * @return a handle in state {@link IngestionState#STAGING}
   */
  public IngestionTransaction begin() {
    boolean nested = TransactionSynchronizationManager.isActualTransactionActive();
    DefaultTransactionDefinition definition =
        new DefaultTransactionDefinition(
            nested
                ? TransactionDefinition.PROPAGATION_NESTED
                : TransactionDefinition.PROPAGATION_REQUIRED);
    definition.setName("ingest");
    TransactionStatus status = transactionManager.getTransaction(definition);
    log.debug("Opened {} ingestion transaction", nested ? "nested" : "top-level");
    return new IngestionTransaction(transactionManager, status, nested);
  }
}
