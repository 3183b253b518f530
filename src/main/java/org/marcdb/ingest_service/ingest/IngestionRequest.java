package org.marcdb.ingest_service.ingest;

import java.util.stream.Stream;
import lombok.Builder;
import org.marcdb.ingest_service.model.AssemblyMetadata;
import org.marcdb.ingest_service.tabular.BatchSource;

/**
 * Input of one ingestion. Every batch is optional; {@code metadata} overrides assembly columns
 * for the whole run and may be left null.
 *
 * @param skipConfirmation commit without asking once the change-set has been validated
 */
@Builder
public record IngestionRequest(
    BatchSource isolates,
    BatchSource assemblies,
    BatchSource assemblyQcs,
    BatchSource taxonomicAssignments,
    BatchSource contaminants,
    BatchSource antimicrobials,
    AssemblyMetadata metadata,
    boolean skipConfirmation) {

  public AssemblyMetadata metadataOrDefault() {
    return metadata != null ? metadata : AssemblyMetadata.NONE;
  }

  public boolean hasBatches() {
    return Stream.of(isolates, assemblies, assemblyQcs, taxonomicAssignments, contaminants, antimicrobials)
        .anyMatch(source -> source != null);
  }
}
