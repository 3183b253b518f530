package org.marcdb.ingest_service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;
import java.util.Map;
import org.marcdb.ingest_service.config.IngestProperties;
import org.marcdb.ingest_service.exceptions.IngestionException;
import org.springframework.stereotype.Component;

/**
 * Renders an {@link IngestReport} as the text preview shown before confirmation, or as JSON.
 *
 * <p>Rendering is deterministic: entity types appear in processing order and descriptions in
 * lexicographic order, so two runs over the same data print the same text.
 */
@Component
public class ReportFormatter {

  private final IngestProperties ingestProperties;
  private final ObjectMapper objectMapper;

  public ReportFormatter(IngestProperties ingestProperties) {
    this.ingestProperties = ingestProperties;
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
  }

  /**
   * Formats the report with the configured description limit.
   */
  public String summarize(IngestReport report) {
    return format(report, ingestProperties.getReportListLimit());
  }

  /**
   * Formats the report, one line per entity type that has anything to report, followed by its
   * duplicate and orphan descriptions.
   *
   * @param report the report to render
   * @param listLimit descriptions printed per list before the rest is counted
   * @return multi-line text ending with a line break
   */
  public String format(IngestReport report, int listLimit) {
    StringBuilder text = new StringBuilder(heading(report.outcome())).append('\n');
    boolean empty = true;
    for (EntityReport entity : report.entities().values()) {
      if (entity.isEmpty()) {
        continue;
      }
      empty = false;
      text.append("  ").append(entity.entity()).append(": ").append(entity.added()).append(" new");
      for (Map.Entry<String, Integer> extra : entity.extras().entrySet()) {
        text.append(", ").append(extra.getKey()).append(": ").append(extra.getValue());
      }
      if (entity.duplicateCount() > 0) {
        text.append(", ").append(entity.duplicateCount()).append(" duplicate(s)");
      }
      if (entity.orphanCount() > 0) {
        text.append(", ").append(entity.orphanCount()).append(" orphan(s)");
      }
      text.append('\n');
      if (!entity.duplicates().isEmpty()) {
        text.append("    duplicates: ").append(formatList(entity.duplicates(), listLimit)).append('\n');
      }
      if (!entity.orphans().isEmpty()) {
        text.append("    orphans: ").append(formatList(entity.orphans(), listLimit)).append('\n');
      }
    }
    if (empty) {
      text.append("  no changes\n");
    }
    return text.toString();
  }

  /**
   * Renders the full report, every description included, as indented JSON.
   *
   * @throws IngestionException if the report cannot be serialized
   */
  public String toJson(IngestReport report) {
    try {
      return objectMapper.writeValueAsString(report);
    } catch (JsonProcessingException e) {
      throw new IngestionException("Failed to render ingestion report as JSON", e);
    }
  }

  /**
   * Joins descriptions with commas, replacing everything past {@code limit} with
   * {@code and N more...}.
   */
  static String formatList(List<String> items, int limit) {
    if (items.size() <= limit) {
      return String.join(", ", items);
    }
    return String.join(", ", items.subList(0, limit))
        + ", and "
        + (items.size() - limit)
        + " more...";
  }

  private static String heading(IngestOutcome outcome) {
    switch (outcome) {
      case COMMITTED:
        return "Committed changes:";
      case DECLINED:
        return "Declined changes (nothing written):";
      default:
        return "Pending changes:";
    }
  }
}
