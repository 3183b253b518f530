package org.marcdb.ingest_service.loading;

import org.marcdb.ingest_service.model.Assembly;

/**
 * An assembly batch row, metadata overrides already applied.
 */
public record AssemblyRow(int rowNumber, Assembly assembly) {}
