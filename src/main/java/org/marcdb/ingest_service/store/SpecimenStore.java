package org.marcdb.ingest_service.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.Isolate;
import org.marcdb.ingest_service.model.TaxonomicAssignment;

/**
 * Relational store of isolates and assembly analytics, as seen by the ingestion engine.
 *
 * <p>Queries return rows visible to the current transaction, which includes rows inserted earlier
 * in the same ingestion. Inserts run inside the caller's transaction and become permanent only
 * when it commits; constraint violations surface from the insert call itself as Spring
 * {@link org.springframework.dao.DataAccessException DataAccessExceptions}.
 */
public interface SpecimenStore {

  /**
   * Returns the stored isolates among the given sample ids, keyed by sample id.
   */
  Map<String, Isolate> findIsolates(Collection<String> sampleIds);

  List<Aliquot> findAliquots(Collection<String> isolateIds);

  List<Assembly> findAssembliesByIsolate(Collection<String> isolateIds);

  List<Assembly> findAssembliesById(Collection<Long> assemblyIds);

  List<AssemblyQc> findAssemblyQcs(Collection<Long> assemblyIds);

  List<TaxonomicAssignment> findTaxonomicAssignments(Collection<Long> assemblyIds);

  List<Contaminant> findContaminants(Collection<Long> assemblyIds);

  List<Antimicrobial> findAntimicrobials(Collection<Long> assemblyIds);

  void insertIsolates(List<Isolate> isolates);

  void insertAliquots(List<Aliquot> aliquots);

  /**
   * Inserts assemblies and returns them with their generated ids, in input order.
   */
  List<Assembly> insertAssemblies(List<Assembly> assemblies);

  void insertAssemblyQcs(List<AssemblyQc> qcs);

  void insertTaxonomicAssignments(List<TaxonomicAssignment> assignments);

  void insertContaminants(List<Contaminant> contaminants);

  void insertAntimicrobials(List<Antimicrobial> antimicrobials);

  /**
   * Returns the number of rows in one of the store's tables.
   *
   * @param table a table name from {@link org.marcdb.ingest_service.Constants}
   * @throws IllegalArgumentException for any other name
   */
  long count(String table);
}
