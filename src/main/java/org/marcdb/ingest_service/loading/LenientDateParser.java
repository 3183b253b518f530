package org.marcdb.ingest_service.loading;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Utility class that reads the date formats found in specimen spreadsheets.
 *
 * <p>Accepted forms include ISO dates ({@code 2024-03-01}), slash dates in year-first or US order
 * ({@code 2024/03/01}, {@code 3/1/2024}, {@code 3/1/24}), month names ({@code 1-Mar-2024},
 * {@code 1 Mar 2024}) and compact dates ({@code 20240301}). A trailing time component such as
 * {@code 2024-03-01 00:00:00} or {@code 2024-03-01T10:15} is ignored.
 *
 * <p>Values that match none of these forms yield {@code null} rather than an error: a missing
 * date is acceptable, a rejected batch because of one odd cell is not.
 */
public final class LenientDateParser {

  private static final Logger LOGGER = LogManager.getLogger(LenientDateParser.class);

  private static final List<DateTimeFormatter> FORMATS =
      List.of(
          strict("uuuu-M-d"),
          strict("uuuu/M/d"),
          strict("M/d/uuuu"),
          strict("M/d/uu"),
          strict("d-MMM-uuuu"),
          strict("d MMM uuuu"),
          strict("d-MMM-uu"),
          strict("uuuuMMdd"));

  // Private constructor to prevent instantiation
  private LenientDateParser() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Parses a date cell.
   *
   * @param value the raw cell value, already trimmed (may be null)
   * @return the date, or {@code null} when the value is null or unparseable
   */
  public static LocalDate parse(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String text = value.trim();
    LocalDate date = tryFormats(text);
    if (date == null) {
      int timeSeparator = indexOfTimeSeparator(text);
      if (timeSeparator > 0) {
        date = tryFormats(text.substring(0, timeSeparator));
      }
    }
    if (date == null) {
      LOGGER.debug("Unparseable date '{}' treated as unknown", value);
    }
    return date;
  }

  private static LocalDate tryFormats(String text) {
    for (DateTimeFormatter format : FORMATS) {
      try {
        return LocalDate.parse(text, format);
      } catch (DateTimeParseException e) {
        LOGGER.trace("'{}' does not match {}: {}", text, format, e.getMessage());
      }
    }
    return null;
  }

  private static int indexOfTimeSeparator(String text) {
    int t = text.indexOf('T');
    // Month names such as "Oct" never contain an upper-case T, dates with times always do
    if (t > 0 && Character.isDigit(text.charAt(t - 1))) {
      return t;
    }
    int space = text.lastIndexOf(' ');
    return space > 0 && text.indexOf(':', space) > 0 ? space : -1;
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH)
        .withResolverStyle(ResolverStyle.STRICT);
  }
}
