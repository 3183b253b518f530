package org.marcdb.ingest_service.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A uniquely identified biological specimen. {@code sampleId} is the natural key; every other
 * component is compared when deciding whether two rows describe the same isolate.
 */
public record Isolate(
    String sampleId,
    Long subjectId,
    Long specimenId,
    String suspectedOrganism,
    String specialCollection,
    LocalDate receivedDate,
    LocalDate cryobankingDate) {

  /**
   * Lists the attributes on which {@code other} differs from this isolate, formatted as
   * {@code column 'this' vs 'other'}. Two absent values are equal.
   */
  public List<String> differencesFrom(Isolate other) {
    List<String> differences = new ArrayList<>();
    compare(differences, "sample_id", sampleId, other.sampleId);
    compare(differences, "subject_id", subjectId, other.subjectId);
    compare(differences, "specimen_id", specimenId, other.specimenId);
    compare(differences, "suspected_organism", suspectedOrganism, other.suspectedOrganism);
    compare(differences, "special_collection", specialCollection, other.specialCollection);
    compare(differences, "received_date", receivedDate, other.receivedDate);
    compare(differences, "cryobanking_date", cryobankingDate, other.cryobankingDate);
    return differences;
  }

  private static void compare(List<String> differences, String column, Object mine, Object theirs) {
    if (!Objects.equals(mine, theirs)) {
      differences.add(column + " '" + mine + "' vs '" + theirs + "'");
    }
  }
}
