package org.marcdb.ingest_service.changeset;

import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.marcdb.ingest_service.loading.BatchKind;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.Isolate;
import org.marcdb.ingest_service.model.TaxonomicAssignment;

/**
 * All rows staged by one ingestion, per entity type. Aliquots travel with the isolate batch they
 * were read from. Kinds that were not part of the ingestion stay empty.
 */
@Getter
@Setter
public class ChangeSet {

  private StagedBatch<Isolate> isolates = StagedBatch.empty(BatchKind.ISOLATES);
  private List<Aliquot> aliquots = List.of();
  private StagedBatch<Assembly> assemblies = StagedBatch.empty(BatchKind.ASSEMBLIES);
  private StagedBatch<AssemblyQc> assemblyQcs = StagedBatch.empty(BatchKind.ASSEMBLY_QC);
  private StagedBatch<TaxonomicAssignment> taxonomicAssignments =
      StagedBatch.empty(BatchKind.TAXONOMIC_ASSIGNMENTS);
  private StagedBatch<Contaminant> contaminants = StagedBatch.empty(BatchKind.CONTAMINANTS);
  private StagedBatch<Antimicrobial> antimicrobials = StagedBatch.empty(BatchKind.ANTIMICROBIALS);

  /**
   * Returns the staged batches in processing order.
   */
  public List<StagedBatch<?>> batches() {
    return List.of(
        isolates, assemblies, assemblyQcs, taxonomicAssignments, contaminants, antimicrobials);
  }

  /**
   * Total number of rows the change-set would insert, aliquots included.
   */
  public int size() {
    return aliquots.size() + batches().stream().mapToInt(StagedBatch::added).sum();
  }
}
