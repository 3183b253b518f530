package org.marcdb.ingest_service.ingest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.exceptions.ConsistencyException;
import org.marcdb.ingest_service.exceptions.IntegrityViolationException;
import org.marcdb.ingest_service.exceptions.SchemaException;
import org.marcdb.ingest_service.loading.BatchKind;
import org.marcdb.ingest_service.model.AssemblyMetadata;
import org.marcdb.ingest_service.report.EntityReport;
import org.marcdb.ingest_service.report.IngestOutcome;
import org.marcdb.ingest_service.report.IngestReport;
import org.marcdb.ingest_service.report.ReportFormatter;
import org.marcdb.ingest_service.tabular.BatchSource;
import org.marcdb.ingest_service.tabular.Table;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class IngestionServiceIntegrationTest {

  private static final ConfirmationPrompt NEVER_ASKED =
      prompt -> {
        throw new AssertionError("Confirmation should have been skipped");
      };

  @Autowired private IngestionService ingestionService;

  @Autowired private JdbcTemplate jdbcTemplate;

  @Autowired private PlatformTransactionManager transactionManager;

  @SpyBean private ReportFormatter reportFormatter;

  @BeforeEach
  void cleanStore() {
    for (String table :
        List.of(
            Constants.ANTIMICROBIALS_TABLE,
            Constants.CONTAMINANTS_TABLE,
            Constants.TAXONOMIC_ASSIGNMENTS_TABLE,
            Constants.ASSEMBLY_QC_TABLE,
            Constants.ASSEMBLIES_TABLE,
            Constants.ALIQUOTS_TABLE,
            Constants.ISOLATES_TABLE)) {
      jdbcTemplate.update("DELETE FROM " + table);
    }
  }

  private static BatchSource fixture(String name) {
    URL resource = IngestionServiceIntegrationTest.class.getClassLoader().getResource("data/" + name);
    assertNotNull(resource, "Test file not found: " + name);
    try {
      return BatchSource.of(Path.of(resource.toURI()));
    } catch (URISyntaxException e) {
      throw new IllegalStateException(e);
    }
  }

  private int count(String table) {
    Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    return Objects.requireNonNull(count);
  }

  private IngestReport ingestAll() {
    return ingestionService.ingest(
        IngestionRequest.builder()
            .isolates(fixture("isolates.tsv"))
            .assemblies(fixture("assemblies.tsv"))
            .assemblyQcs(fixture("assembly_qc.tsv"))
            .taxonomicAssignments(fixture("taxonomy.tsv"))
            .contaminants(fixture("contaminants.tsv"))
            .antimicrobials(fixture("antimicrobials.tsv"))
            .skipConfirmation(true)
            .build(),
        NEVER_ASKED);
  }

  private IngestReport ingest(IngestionRequest.IngestionRequestBuilder request) {
    return ingestionService.ingest(request.skipConfirmation(true).build(), NEVER_ASKED);
  }

  @Test
  void testFullIngestCommitsEveryEntityType() {
    IngestReport report = ingestAll();

    assertEquals(IngestOutcome.COMMITTED, report.outcome());
    assertEquals(2, count(Constants.ISOLATES_TABLE));
    assertEquals(3, count(Constants.ALIQUOTS_TABLE));
    assertEquals(2, count(Constants.ASSEMBLIES_TABLE));
    assertEquals(2, count(Constants.ASSEMBLY_QC_TABLE));
    assertEquals(2, count(Constants.TAXONOMIC_ASSIGNMENTS_TABLE));
    assertEquals(1, count(Constants.CONTAMINANTS_TABLE));
    assertEquals(8, count(Constants.ANTIMICROBIALS_TABLE));

    assertEquals(3, report.entity(BatchKind.ISOLATES).extras().get(Constants.ALIQUOTS_EXTRA));
    EntityReport antimicrobials = report.entity(BatchKind.ANTIMICROBIALS);
    assertEquals(8, antimicrobials.added());
    assertEquals(1, antimicrobials.extras().get(Constants.EMPTY_ROWS_DROPPED_EXTRA));

    assertEquals(
        List.of("Escherichia coli", "Klebsiella pneumoniae"),
        jdbcTemplate.queryForList(
            "SELECT classification FROM taxonomic_assignments WHERE tool = 'mlst' ORDER BY classification",
            String.class));
    assertEquals(
        LocalDate.of(2024, 1, 16),
        jdbcTemplate.queryForObject(
            "SELECT received_date FROM isolates WHERE sample_id = 'sample2'", LocalDate.class));
  }

  @Test
  void testReingestingSameBatchAddsNothing() {
    ingestAll();

    IngestReport second = ingestAll();

    assertEquals(0, second.totalAdded());
    assertEquals(0, second.entity(BatchKind.ISOLATES).duplicateCount());
    assertEquals(0, second.entity(BatchKind.ISOLATES).extras().get(Constants.ALIQUOTS_EXTRA));
    assertEquals(2, second.entity(BatchKind.ASSEMBLIES).duplicateCount());
    assertEquals(2, second.entity(BatchKind.ASSEMBLY_QC).duplicateCount());
    assertEquals(2, second.entity(BatchKind.TAXONOMIC_ASSIGNMENTS).duplicateCount());
    assertEquals(1, second.entity(BatchKind.CONTAMINANTS).duplicateCount());
    assertEquals(8, second.entity(BatchKind.ANTIMICROBIALS).duplicateCount());
    assertEquals(2, count(Constants.ISOLATES_TABLE));
    assertEquals(3, count(Constants.ALIQUOTS_TABLE));
    assertEquals(8, count(Constants.ANTIMICROBIALS_TABLE));
  }

  @Test
  void testConflictingIsolateRowsLeaveStoreUnchanged() {
    ingest(IngestionRequest.builder().isolates(fixture("isolates.tsv")));

    ConsistencyException e =
        assertThrows(
            ConsistencyException.class,
            () ->
                ingest(
                    IngestionRequest.builder()
                        .isolates(fixture("isolates_conflict.tsv"))
                        .assemblies(fixture("assemblies.tsv"))));

    assertEquals("sample3", e.getSampleId());
    assertEquals(2, count(Constants.ISOLATES_TABLE));
    assertEquals(3, count(Constants.ALIQUOTS_TABLE));
    assertEquals(0, count(Constants.ASSEMBLIES_TABLE));
  }

  @Test
  void testOrphanQcRowIsReportedAndOthersCommit() {
    ingest(
        IngestionRequest.builder()
            .isolates(fixture("isolates.tsv"))
            .assemblies(fixture("assemblies.tsv")));

    IngestReport report =
        ingest(IngestionRequest.builder().assemblyQcs(fixture("assembly_qc_orphan.tsv")));

    EntityReport qc = report.entity(BatchKind.ASSEMBLY_QC);
    assertEquals(1, qc.added());
    assertEquals(List.of("unmatched assembly for assembly QC: sample_missing"), qc.orphans());
    assertEquals(1, count(Constants.ASSEMBLY_QC_TABLE));
  }

  @Test
  void testQcWithoutRunNumberIsAmbiguousBetweenTwoRuns() {
    Table assemblies =
        Table.of(
            List.of("sample_id", "run_number", "sunbeam_version"),
            List.of(List.of("sample1", "1", "4.1.0"), List.of("sample1", "2", "4.1.0")));
    Table qcWithoutRun =
        Table.of(List.of("sample_id", "contig_count"), List.of(List.of("sample1", "120")));

    IngestReport report =
        ingest(
            IngestionRequest.builder()
                .isolates(fixture("isolates.tsv"))
                .assemblies(BatchSource.of(assemblies))
                .assemblyQcs(BatchSource.of(qcWithoutRun)));

    assertEquals(2, report.entity(BatchKind.ASSEMBLIES).added());
    EntityReport qc = report.entity(BatchKind.ASSEMBLY_QC);
    assertEquals(0, qc.added());
    assertEquals(
        List.of("unmatched assembly for assembly QC: sample1 (ambiguous between 2 assemblies)"),
        qc.orphans());
    assertEquals(0, count(Constants.ASSEMBLY_QC_TABLE));
  }

  @Test
  void testRunNumberOverrideTargetsOneRun() {
    Table assemblies =
        Table.of(List.of("sample_id", "run_number"), List.of(List.of("sample1", "1"), List.of("sample1", "2")));
    ingest(
        IngestionRequest.builder()
            .isolates(fixture("isolates.tsv"))
            .assemblies(BatchSource.of(assemblies)));
    Table qcWithoutRun =
        Table.of(List.of("sample_id", "contig_count"), List.of(List.of("sample1", "77")));

    IngestReport report =
        ingest(
            IngestionRequest.builder()
                .assemblyQcs(BatchSource.of(qcWithoutRun))
                .metadata(AssemblyMetadata.builder().runNumber("2").build()));

    assertEquals(1, report.entity(BatchKind.ASSEMBLY_QC).added());
    assertEquals(
        "2",
        jdbcTemplate.queryForObject(
            "SELECT a.run_number FROM assembly_qc q JOIN assemblies a ON a.id = q.assembly_id",
            String.class));
  }

  @Test
  void testNamedRunWithoutMatchingAssemblyIsOrphaned() {
    ingest(
        IngestionRequest.builder()
            .isolates(fixture("isolates.tsv"))
            .assemblies(fixture("assemblies.tsv")));
    Table qc =
        Table.of(
            List.of("sample_id", "run_number", "contig_count"),
            List.of(List.of("sample2", "3", "40"), List.of("sample2", "1", "41")));

    EntityReport report =
        ingest(IngestionRequest.builder().assemblyQcs(BatchSource.of(qc)))
            .entity(BatchKind.ASSEMBLY_QC);

    assertEquals(1, report.added());
    assertEquals(1, report.orphanCount());
    assertEquals(
        41L,
        jdbcTemplate.queryForObject(
            "SELECT q.contig_count FROM assembly_qc q JOIN assemblies a ON a.id = q.assembly_id"
                + " WHERE a.isolate_id = 'sample2'",
            Long.class));
  }

  @Test
  void testEveryOrphanedRowIsCounted() {
    ingest(
        IngestionRequest.builder()
            .isolates(fixture("isolates.tsv"))
            .assemblies(fixture("assemblies.tsv")));
    Table antimicrobials =
        Table.of(
            List.of("sample_id", "contig_id", "gene_symbol"),
            List.of(
                List.of("ghost", "c1", "blaTEM-1"),
                List.of("ghost", "c2", "tet(A)"),
                List.of("ghost", "c3", "sul1"),
                List.of("sample1", "c1", "blaTEM-1")));

    EntityReport report =
        ingest(IngestionRequest.builder().antimicrobials(BatchSource.of(antimicrobials)))
            .entity(BatchKind.ANTIMICROBIALS);

    assertEquals(1, report.added());
    assertEquals(3, report.orphanCount());
    assertEquals(List.of("unmatched assembly for antimicrobial: ghost"), report.orphans());
  }

  @Test
  void testDistinctToolsAndClassificationsCoexistOnOneAssembly() {
    ingestAll();
    Table taxonomy =
        Table.of(
            List.of("sample_id", "tool", "classification", "abundance"),
            List.of(
                List.of("sample1", "sylph", "Escherichia coli", "0.97"),
                List.of("sample1", "mlst", "Klebsiella pneumoniae", "NA"),
                List.of("sample1", "sylph", "Klebsiella pneumoniae", "0.02")));

    EntityReport report =
        ingest(IngestionRequest.builder().taxonomicAssignments(BatchSource.of(taxonomy)))
            .entity(BatchKind.TAXONOMIC_ASSIGNMENTS);

    assertEquals(3, report.added());
    assertEquals(0, report.duplicateCount());
    assertEquals(
        List.of(
            "mlst/Escherichia coli",
            "mlst/Klebsiella pneumoniae",
            "sylph/Escherichia coli",
            "sylph/Klebsiella pneumoniae"),
        jdbcTemplate.queryForList(
            "SELECT t.tool || '/' || t.classification FROM taxonomic_assignments t"
                + " JOIN assemblies a ON a.id = t.assembly_id"
                + " WHERE a.isolate_id = 'sample1' ORDER BY 1",
            String.class));
  }

  @Test
  void testBatchFileWithByteOrderMarkIsIngested(@TempDir Path tempDir) throws IOException {
    Path isolates = tempDir.resolve("isolates.tsv");
    Files.writeString(
        isolates,
        "\uFEFFSampleID\tSubject ID\tSpecimen ID\tsample species\tspecial_collection"
            + "\tReceived by mARC\tCryobanking\tTube Barcode\tBox-name_position\n"
            + "bom1\t300\t400\tEscherichia coli\t\t2024-02-01\t\tTB900\tBox9_A1\n");

    IngestReport report = ingest(IngestionRequest.builder().isolates(BatchSource.of(isolates)));

    assertEquals(1, report.entity(BatchKind.ISOLATES).added());
    assertEquals(1, count(Constants.ALIQUOTS_TABLE));
  }

  @Test
  void testSkippedConfirmationSummarizesBeforeCommit() {
    ingestAll();

    verify(reportFormatter).summarize(argThat(report -> report.outcome() == IngestOutcome.PENDING));
  }

  @Test
  void testThirtyIsolatesWithThreeAliquotsEach() {
    List<List<String>> rows = new ArrayList<>();
    for (int i = 1; i <= 30; i++) {
      for (int tube = 1; tube <= 3; tube++) {
        rows.add(
            Arrays.asList(
                "bulk" + i,
                String.valueOf(1000 + i),
                String.valueOf(2000 + i),
                "Escherichia coli",
                null,
                "2024-05-01",
                null,
                "T" + i + "-" + tube,
                "Box" + i));
      }
    }
    Table isolates =
        Table.of(
            List.of(
                "SampleID",
                "Subject ID",
                "Specimen ID",
                "sample species",
                "special_collection",
                "Received by mARC",
                "Cryobanking",
                "Tube Barcode",
                "Box-name_position"),
            rows);

    IngestReport report = ingest(IngestionRequest.builder().isolates(BatchSource.of(isolates)));

    assertEquals(30, report.entity(BatchKind.ISOLATES).added());
    assertEquals(30, count(Constants.ISOLATES_TABLE));
    assertEquals(90, count(Constants.ALIQUOTS_TABLE));
  }

  @Test
  void testDecliningConfirmationWritesNothing() {
    List<String> prompts = new ArrayList<>();

    IngestReport report =
        ingestionService.ingest(
            IngestionRequest.builder().isolates(fixture("isolates.tsv")).build(),
            prompt -> {
              prompts.add(prompt);
              return false;
            });

    assertEquals(IngestOutcome.DECLINED, report.outcome());
    assertEquals(2, report.entity(BatchKind.ISOLATES).added());
    assertEquals(1, prompts.size());
    assertTrue(prompts.get(0).startsWith("Pending changes:\n  isolates: 2 new, aliquots: 3\n"));
    assertTrue(prompts.get(0).endsWith("Proceed with these changes? [y/N]: "));
    assertEquals(0, count(Constants.ISOLATES_TABLE));
    assertEquals(0, count(Constants.ALIQUOTS_TABLE));
  }

  @Test
  void testConfirmingCommits() {
    IngestReport report =
        ingestionService.ingest(
            IngestionRequest.builder().isolates(fixture("isolates.tsv")).build(), prompt -> true);

    assertTrue(report.isCommitted());
    assertEquals(2, count(Constants.ISOLATES_TABLE));
  }

  @Test
  void testMissingSubjectIdFailsAtFlush() {
    List<String> prompts = new ArrayList<>();

    assertThrows(
        IntegrityViolationException.class,
        () ->
            ingestionService.ingest(
                IngestionRequest.builder().isolates(fixture("isolates_missing_subject.tsv")).build(),
                prompt -> {
                  prompts.add(prompt);
                  return true;
                }));

    assertTrue(prompts.isEmpty());
    assertEquals(0, count(Constants.ISOLATES_TABLE));
  }

  @Test
  void testMissingColumnsFailBeforeStaging() {
    Table isolates = Table.of(List.of("SampleID", "Tube Barcode"), List.of(List.of("s1", "T1")));

    SchemaException e =
        assertThrows(
            SchemaException.class,
            () -> ingest(IngestionRequest.builder().isolates(BatchSource.of(isolates))));

    assertTrue(e.getMissingColumns().contains("subject_id"));
    assertTrue(e.getMissingColumns().contains("box_name"));
    assertEquals(0, count(Constants.ISOLATES_TABLE));
  }

  @Test
  void testNestedIngestFollowsCallerRollback() {
    TransactionTemplate outer = new TransactionTemplate(transactionManager);

    outer.executeWithoutResult(
        status -> {
          IngestReport report = ingest(IngestionRequest.builder().isolates(fixture("isolates.tsv")));
          assertTrue(report.isCommitted());
          assertEquals(2, count(Constants.ISOLATES_TABLE));
          status.setRollbackOnly();
        });

    assertEquals(0, count(Constants.ISOLATES_TABLE));
  }

  @Test
  void testFailedNestedIngestKeepsCallerWork() {
    TransactionTemplate outer = new TransactionTemplate(transactionManager);

    outer.executeWithoutResult(
        status -> {
          ingest(IngestionRequest.builder().isolates(fixture("isolates.tsv")));
          assertThrows(
              ConsistencyException.class,
              () -> ingest(IngestionRequest.builder().isolates(fixture("isolates_conflict.tsv"))));
        });

    assertEquals(2, count(Constants.ISOLATES_TABLE));
    assertEquals(3, count(Constants.ALIQUOTS_TABLE));
  }
}
