package org.marcdb.ingest_service.loading;

import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Isolate;

/**
 * An isolate batch row: the isolate it describes and the aliquot tube it records.
 */
public record IsolateRow(int rowNumber, Isolate isolate, Aliquot aliquot) {}
