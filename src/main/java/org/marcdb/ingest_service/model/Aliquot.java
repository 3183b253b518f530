package org.marcdb.ingest_service.model;

/**
 * A physical sub-sample (tube) of an isolate. Unique on the full triple.
 */
public record Aliquot(String isolateId, String tubeBarcode, String boxName) {}
