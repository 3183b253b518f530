package org.marcdb.ingest_service.loading;

import org.marcdb.ingest_service.model.AssemblyScoped;

/**
 * A QC, taxonomy, contaminant or antimicrobial row whose assembly has not been resolved yet.
 *
 * @param <T> the record type carried by the row
 */
public record DependentRow<T extends AssemblyScoped<T>>(
    int rowNumber, AssemblyReference reference, T record) {}
