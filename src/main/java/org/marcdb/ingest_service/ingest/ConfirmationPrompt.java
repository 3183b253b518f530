package org.marcdb.ingest_service.ingest;

/**
 * Yes/no decision taken after the change-set preview and before anything is committed.
 */
@FunctionalInterface
public interface ConfirmationPrompt {

  /**
   * Asks whether to commit.
   *
   * @param prompt the change-set summary followed by the question
   * @return true to commit, false to roll back
   */
  boolean confirm(String prompt);
}
