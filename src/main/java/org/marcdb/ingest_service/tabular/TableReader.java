package org.marcdb.ingest_service.tabular;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.marcdb.ingest_service.config.IngestProperties;
import org.marcdb.ingest_service.exceptions.BatchReadException;
import org.springframework.stereotype.Component;

/**
 * Component responsible for turning a {@link BatchSource} into a {@link Table} with canonical
 * headers.
 *
 * <p>Files ending in {@code .csv} are read comma-separated; any other file uses the configured
 * default delimiter (tab unless overridden). Headers of both files and in-memory tables are passed
 * through the {@link ColumnNormalizer}. Blank lines are skipped and cell values are trimmed.
 */
@Slf4j
@Component
public class TableReader {

  static final char BYTE_ORDER_MARK = '\uFEFF';

  private final IngestProperties ingestProperties;

  public TableReader(IngestProperties ingestProperties) {
    this.ingestProperties = ingestProperties;
  }

  /**
   * Reads the batch and normalizes its headers.
   *
   * @param source the batch location or table
   * @return a table whose known headers carry canonical names
   * @throws BatchReadException if the file cannot be opened or parsed
   */
  public Table read(BatchSource source) {
    Table raw = source.isFile() ? readFile(source.path()) : source.table();
    return raw.renameColumns(ColumnNormalizer::normalize);
  }

  Table readFile(Path path) {
    log.debug("Reading batch file {}", path);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      skipByteOrderMark(reader);
      return parse(reader, delimiterFor(path));
    } catch (IOException | IllegalArgumentException | IllegalStateException e) {
      throw new BatchReadException("Problem reading batch file " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Parses delimited text with a header row.
   *
   * @param reader the text to parse; not closed by this method
   * @param delimiter the column delimiter
   * @return the parsed table, headers not yet normalized
   * @throws IOException if reading fails
   */
  Table parse(Reader reader, char delimiter) throws IOException {
    CSVFormat format =
        CSVFormat.DEFAULT
            .builder()
            .setDelimiter(delimiter)
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .setAllowMissingColumnNames(true)
            .build();

    try (CSVParser parser = format.parse(reader)) {
      List<String> headers = parser.getHeaderNames();
      List<List<String>> values = new ArrayList<>();
      for (CSVRecord record : parser) {
        List<String> rowValues = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
          rowValues.add(record.isSet(i) ? record.get(i) : null);
        }
        values.add(rowValues);
      }
      log.debug("Parsed {} rows with columns {}", values.size(), headers);
      return Table.of(headers, values);
    }
  }

  // Spreadsheet "CSV UTF-8" exports start with U+FEFF
  private static void skipByteOrderMark(BufferedReader reader) throws IOException {
    reader.mark(1);
    if (reader.read() != BYTE_ORDER_MARK) {
      reader.reset();
    }
  }

  char delimiterFor(Path path) {
    String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
    return fileName.endsWith(".csv") ? ',' : ingestProperties.getDefaultDelimiter();
  }
}
