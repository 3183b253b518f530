package org.marcdb.ingest_service.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.exceptions.IngestionException;
import org.marcdb.ingest_service.ingest.ConsoleConfirmationPrompt;
import org.marcdb.ingest_service.ingest.IngestionRequest;
import org.marcdb.ingest_service.ingest.IngestionService;
import org.marcdb.ingest_service.model.AssemblyMetadata;
import org.marcdb.ingest_service.report.IngestReport;
import org.marcdb.ingest_service.report.ReportFormatter;
import org.marcdb.ingest_service.tabular.BatchSource;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Command line front end. Usage:
 *
 * <pre>
 * ingest [--isolates=FILE] [--assemblies=FILE] [--assembly-qc=FILE] [--taxonomy=FILE]
 *        [--contaminants=FILE] [--antimicrobials=FILE] [--run-number=N]
 *        [--sunbeam-version=V] [--sbx-sga-version=V] [--sunbeam-output-path=PATH]
 *        [--yes] [--report-json=FILE]
 * </pre>
 *
 * Started without a command the application does nothing, so it can be embedded or tested.
 */
@Slf4j
@Component
public class IngestCommandRunner implements ApplicationRunner {

  static final String INGEST_COMMAND = "ingest";

  private final IngestionService ingestionService;
  private final ReportFormatter reportFormatter;

  public IngestCommandRunner(IngestionService ingestionService, ReportFormatter reportFormatter) {
    this.ingestionService = ingestionService;
    this.reportFormatter = reportFormatter;
  }

  @Override
  public void run(ApplicationArguments args) throws IOException {
    List<String> commands = args.getNonOptionArgs();
    if (commands.isEmpty()) {
      log.debug("No command given, nothing to do");
      return;
    }
    if (commands.size() != 1 || !INGEST_COMMAND.equals(commands.get(0))) {
      throw new IllegalArgumentException(
          "Unknown command " + commands + ", available commands are: [" + INGEST_COMMAND + "]");
    }

    IngestionRequest request = toRequest(args);
    if (!request.hasBatches()) {
      throw new IllegalArgumentException(
          "Nothing to ingest: pass at least one of --isolates, --assemblies, --assembly-qc,"
              + " --taxonomy, --contaminants or --antimicrobials");
    }

    IngestReport report;
    try {
      report = ingestionService.ingest(request, new ConsoleConfirmationPrompt());
    } catch (IngestionException e) {
      log.error("Ingest aborted: {}", e.getMessage());
      throw e;
    }

    if (report.isCommitted()) {
      System.out.print(reportFormatter.summarize(report));
    } else {
      System.out.println("Ingest cancelled.");
    }

    String reportJson = singleOption(args, "report-json");
    if (reportJson != null) {
      Files.writeString(Path.of(reportJson), reportFormatter.toJson(report));
      log.info("Report written to {}", reportJson);
    }
  }

  static IngestionRequest toRequest(ApplicationArguments args) {
    AssemblyMetadata metadata =
        AssemblyMetadata.builder()
            .runNumber(singleOption(args, "run-number"))
            .sunbeamVersion(singleOption(args, "sunbeam-version"))
            .sbxSgaVersion(singleOption(args, "sbx-sga-version"))
            .sunbeamOutputPath(singleOption(args, "sunbeam-output-path"))
            .build();
    return IngestionRequest.builder()
        .isolates(source(args, "isolates"))
        .assemblies(source(args, "assemblies"))
        .assemblyQcs(source(args, "assembly-qc"))
        .taxonomicAssignments(source(args, "taxonomy"))
        .contaminants(source(args, "contaminants"))
        .antimicrobials(source(args, "antimicrobials"))
        .metadata(metadata)
        .skipConfirmation(args.containsOption("yes"))
        .build();
  }

  private static BatchSource source(ApplicationArguments args, String option) {
    String path = singleOption(args, option);
    return path != null ? BatchSource.of(Path.of(path)) : null;
  }

  private static String singleOption(ApplicationArguments args, String option) {
    List<String> values = args.getOptionValues(option);
    if (values == null || values.isEmpty()) {
      return null;
    }
    if (values.size() > 1) {
      throw new IllegalArgumentException("Option --" + option + " can only be given once");
    }
    String value = values.get(0).trim();
    return value.isEmpty() ? null : value;
  }
}
