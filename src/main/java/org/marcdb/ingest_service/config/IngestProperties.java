package org.marcdb.ingest_service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for batch ingestion behaviour.
 *
 * <p>Values are loaded from {@code application.properties} (prefix {@code ingest.*}).
 */
@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {

  /**
   * Number of duplicate/orphan descriptions printed per entity type in the preview before the
   * remainder is summarised as "and N more...".
   */
  private int reportListLimit = 10;

  /**
   * Question shown after the preview when confirmation is required.
   */
  private String confirmationPrompt = "Proceed with these changes? [y/N]: ";

  /**
   * Column delimiter used for batch files that are not {@code .csv}.
   */
  private char defaultDelimiter = '\t';
}
