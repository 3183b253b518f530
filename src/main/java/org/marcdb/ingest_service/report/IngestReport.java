package org.marcdb.ingest_service.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.changeset.ChangeSet;
import org.marcdb.ingest_service.changeset.StagedBatch;
import org.marcdb.ingest_service.loading.BatchKind;

/**
 * Structured result of an ingestion: one {@link EntityReport} per entity type, keyed by table name
 * in processing order, and the outcome.
 */
public record IngestReport(Map<String, EntityReport> entities, IngestOutcome outcome) {

  public IngestReport {
    entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public static IngestReport of(ChangeSet changeSet, IngestOutcome outcome) {
    Map<String, EntityReport> entities = new LinkedHashMap<>();
    for (StagedBatch<?> batch : changeSet.batches()) {
      entities.put(batch.kind().getTableName(), EntityReport.of(batch));
    }
    return new IngestReport(entities, outcome);
  }

  public IngestReport withOutcome(IngestOutcome newOutcome) {
    return new IngestReport(entities, newOutcome);
  }

  public EntityReport entity(BatchKind kind) {
    return entities.get(kind.getTableName());
  }

  /**
   * Rows added across all entity types, aliquots included.
   */
  public int totalAdded() {
    return entities.values().stream()
        .mapToInt(report -> report.added() + report.extras().getOrDefault(Constants.ALIQUOTS_EXTRA, 0))
        .sum();
  }

  @JsonIgnore
  public boolean isCommitted() {
    return outcome == IngestOutcome.COMMITTED;
  }
}
