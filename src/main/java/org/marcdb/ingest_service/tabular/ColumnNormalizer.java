package org.marcdb.ingest_service.tabular;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps tool-specific batch headers onto {@link CanonicalField} names.
 *
 * <p>Headers are matched on their trimmed, lower-cased form. Headers that match no alias are
 * returned unchanged, so the absence of a required column is reported by the row loader and not
 * here.
 */
public final class ColumnNormalizer {

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private static final Map<String, String> ALIAS_LOOKUP = buildAliasLookup();

  // Private constructor to prevent instantiation
  private ColumnNormalizer() {
    throw new UnsupportedOperationException("Utility class cannot be instantiated");
  }

  /**
   * Returns the canonical name for a single header.
   *
   * @param header raw header as found in the batch (may be null)
   * @return the canonical field name, or the header itself when it is not a known alias
   */
  public static String normalize(String header) {
    if (header == null) {
      return null;
    }
    String canonical = ALIAS_LOOKUP.get(lookupForm(header));
    return canonical != null ? canonical : header;
  }

  /**
   * Normalizes a full header row, preserving its order.
   *
   * @param headers raw headers
   * @return canonical names, one per input header
   */
  public static List<String> normalizeAll(List<String> headers) {
    return headers.stream().map(ColumnNormalizer::normalize).collect(Collectors.toList());
  }

  private static String lookupForm(String header) {
    String text = header.startsWith(BYTE_ORDER_MARK) ? header.substring(1) : header;
    return text.trim().toLowerCase(Locale.ROOT);
  }

  private static Map<String, String> buildAliasLookup() {
    Map<String, String> lookup = new HashMap<>();
    for (CanonicalField field : CanonicalField.values()) {
      register(lookup, field.getName(), field);
      field.getAliases().forEach(alias -> register(lookup, alias, field));
    }
    return lookup;
  }

  private static void register(Map<String, String> lookup, String alias, CanonicalField field) {
    String previous = lookup.put(lookupForm(alias), field.getName());
    if (previous != null && !previous.equals(field.getName())) {
      throw new IllegalStateException(
          "Alias '" + alias + "' maps to both " + previous + " and " + field.getName());
    }
  }
}
