package org.marcdb.ingest_service.model;

/**
 * Implemented by records that hang off an {@link Assembly}. Rows are loaded before their assembly
 * is known, so the assembly id is filled in once resolution succeeds.
 *
 * @param <T> the implementing record type
 */
public interface AssemblyScoped<T extends AssemblyScoped<T>> {

  Long assemblyId();

  /**
   * Returns a copy of this record attached to the given assembly.
   */
  T withAssemblyId(Long assemblyId);
}
