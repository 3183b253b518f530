package org.marcdb.ingest_service.transaction;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of an {@link IngestionTransaction}. {@link #COMMITTED} and {@link #ROLLED_BACK} are
 * terminal; rolling back is possible from every other state.
 */
public enum IngestionState {
  IDLE,
  STAGING,
  VALIDATING,
  AWAITING_CONFIRMATION,
  COMMITTED,
  ROLLED_BACK;

  public boolean isTerminal() {
    return this == COMMITTED || this == ROLLED_BACK;
  }

  public boolean canTransitionTo(IngestionState next) {
    return successors().contains(next);
  }

  private Set<IngestionState> successors() {
    switch (this) {
      case IDLE:
        return EnumSet.of(STAGING, ROLLED_BACK);
      case STAGING:
        return EnumSet.of(VALIDATING, ROLLED_BACK);
      case VALIDATING:
        return EnumSet.of(AWAITING_CONFIRMATION, ROLLED_BACK);
      case AWAITING_CONFIRMATION:
        return EnumSet.of(COMMITTED, ROLLED_BACK);
      default:
        return EnumSet.noneOf(IngestionState.class);
    }
  }
}
