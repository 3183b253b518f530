package org.marcdb.ingest_service.report;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.changeset.ChangeSet;
import org.marcdb.ingest_service.changeset.StagedBatch;
import org.marcdb.ingest_service.config.IngestProperties;
import org.marcdb.ingest_service.loading.BatchKind;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.Isolate;

class ReportFormatterTest {

  private ReportFormatter formatter;
  private ChangeSet changeSet;

  @BeforeEach
  void setUp() {
    IngestProperties properties = new IngestProperties();
    properties.setReportListLimit(2);
    formatter = new ReportFormatter(properties);

    changeSet = new ChangeSet();
    changeSet.setIsolates(
        new StagedBatch<Isolate>(
                BatchKind.ISOLATES,
                List.of(new Isolate("s1", 1L, 1L, "unknown", null, null, null)),
                0,
                List.of(),
                List.of(),
                Map.of())
            .withExtra(Constants.ALIQUOTS_EXTRA, 3));
    changeSet.setAliquots(
        List.of(new Aliquot("s1", "T1", null), new Aliquot("s1", "T2", null), new Aliquot("s1", "T3", null)));
    changeSet.setAssemblyQcs(
        new StagedBatch<AssemblyQc>(
            BatchKind.ASSEMBLY_QC,
            List.of(),
            3,
            List.of("assembly QC for s3", "assembly QC for s1", "assembly QC for s2", "assembly QC for s1"),
            List.of("unmatched assembly for assembly QC: s9"),
            Map.of()));
  }

  @Test
  void testEntityReportSortsAndDeduplicatesDescriptions() {
    IngestReport report = IngestReport.of(changeSet, IngestOutcome.PENDING);

    EntityReport qc = report.entity(BatchKind.ASSEMBLY_QC);
    assertEquals(3, qc.duplicateCount());
    assertEquals(
        List.of("assembly QC for s1", "assembly QC for s2", "assembly QC for s3"), qc.duplicates());
    assertEquals(4, report.totalAdded());
  }

  @Test
  void testReportListsEntityTypesInProcessingOrder() {
    IngestReport report = IngestReport.of(changeSet, IngestOutcome.PENDING);

    assertEquals(
        List.of(
            "isolates",
            "assemblies",
            "assembly_qc",
            "taxonomic_assignments",
            "contaminants",
            "antimicrobials"),
        List.copyOf(report.entities().keySet()));
  }

  @Test
  void testSummarizeTruncatesLongLists() {
    String text = formatter.summarize(IngestReport.of(changeSet, IngestOutcome.PENDING));

    assertEquals(
        "Pending changes:\n"
            + "  isolates: 1 new, aliquots: 3\n"
            + "  assembly_qc: 0 new, 3 duplicate(s), 1 orphan(s)\n"
            + "    duplicates: assembly QC for s1, assembly QC for s2, and 1 more...\n"
            + "    orphans: unmatched assembly for assembly QC: s9\n",
        text);
  }

  @Test
  void testOrphansAreCountedPerRow() throws Exception {
    changeSet.setAntimicrobials(
        new StagedBatch<Antimicrobial>(
            BatchKind.ANTIMICROBIALS,
            List.of(),
            0,
            List.of(),
            List.of(
                "unmatched assembly for antimicrobial: ghost",
                "unmatched assembly for antimicrobial: ghost",
                "unmatched assembly for antimicrobial: ghost"),
            Map.of()));
    IngestReport report = IngestReport.of(changeSet, IngestOutcome.PENDING);

    EntityReport amr = report.entity(BatchKind.ANTIMICROBIALS);
    assertEquals(3, amr.orphanCount());
    assertEquals(List.of("unmatched assembly for antimicrobial: ghost"), amr.orphans());
    assertTrue(
        formatter
            .summarize(report)
            .contains(
                "  antimicrobials: 0 new, 3 orphan(s)\n"
                    + "    orphans: unmatched assembly for antimicrobial: ghost\n"));
    assertEquals(3, root(report).get("entities").get("antimicrobials").get("orphanCount").asInt());
  }

  @Test
  void testSummarizeIsStableAcrossRuns() {
    IngestReport report = IngestReport.of(changeSet, IngestOutcome.COMMITTED);

    assertEquals(formatter.summarize(report), formatter.summarize(report));
    assertTrue(formatter.summarize(report).startsWith("Committed changes:"));
  }

  @Test
  void testEmptyReport() {
    String text = formatter.summarize(IngestReport.of(new ChangeSet(), IngestOutcome.DECLINED));

    assertEquals("Declined changes (nothing written):\n  no changes\n", text);
  }

  @Test
  void testFormatList() {
    assertEquals("a, b", ReportFormatter.formatList(List.of("a", "b"), 2));
    assertEquals("a, and 2 more...", ReportFormatter.formatList(List.of("a", "b", "c"), 1));
    assertEquals("", ReportFormatter.formatList(List.of(), 10));
  }

  @Test
  void testToJsonCarriesFullLists() throws Exception {
    JsonNode root = root(IngestReport.of(changeSet, IngestOutcome.COMMITTED));
    assertEquals("COMMITTED", root.get("outcome").asText());
    JsonNode qc = root.get("entities").get("assembly_qc");
    assertEquals(3, qc.get("duplicates").size());
    assertEquals(3, qc.get("duplicateCount").asInt());
    assertEquals(3, root.get("entities").get("isolates").get("extras").get("aliquots").asInt());
    assertEquals(1, qc.get("orphanCount").asInt());
    assertFalse(qc.has("empty"));
  }

  private JsonNode root(IngestReport report) throws Exception {
    return new ObjectMapper().readTree(formatter.toJson(report));
  }
}
