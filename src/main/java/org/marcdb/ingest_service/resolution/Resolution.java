package org.marcdb.ingest_service.resolution;

import java.util.List;

/**
 * Rows that found their parent, and descriptions of those that did not.
 */
public record Resolution<T>(List<T> resolved, List<String> orphans) {}
