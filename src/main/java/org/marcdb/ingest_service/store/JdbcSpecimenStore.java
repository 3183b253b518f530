package org.marcdb.ingest_service.store;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.model.Aliquot;
import org.marcdb.ingest_service.model.Antimicrobial;
import org.marcdb.ingest_service.model.Assembly;
import org.marcdb.ingest_service.model.AssemblyQc;
import org.marcdb.ingest_service.model.Contaminant;
import org.marcdb.ingest_service.model.Isolate;
import org.marcdb.ingest_service.model.TaxonomicAssignment;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * {@link SpecimenStore} backed by {@link NamedParameterJdbcTemplate}. Statements join the
 * Spring-managed transaction bound to the current thread, so reads see rows inserted earlier in
 * the same ingestion.
 */
@Slf4j
@Repository
public class JdbcSpecimenStore implements SpecimenStore {

  private static final Set<String> TABLES =
      Set.of(
          Constants.ISOLATES_TABLE,
          Constants.ALIQUOTS_TABLE,
          Constants.ASSEMBLIES_TABLE,
          Constants.ASSEMBLY_QC_TABLE,
          Constants.TAXONOMIC_ASSIGNMENTS_TABLE,
          Constants.CONTAMINANTS_TABLE,
          Constants.ANTIMICROBIALS_TABLE);

  private static final String ASSEMBLY_COLUMNS =
      "id, isolate_id, metagenomic_sample_id, metagenomic_run_id, run_number, nanopore_path,"
          + " sunbeam_version, sbx_sga_version, sunbeam_output_path, ncbi_id";

  private static final RowMapper<Isolate> ISOLATE_MAPPER =
      (rs, i) ->
          new Isolate(
              rs.getString("sample_id"),
              rs.getObject("subject_id", Long.class),
              rs.getObject("specimen_id", Long.class),
              rs.getString("suspected_organism"),
              rs.getString("special_collection"),
              rs.getObject("received_date", LocalDate.class),
              rs.getObject("cryobanking_date", LocalDate.class));

  private static final RowMapper<Aliquot> ALIQUOT_MAPPER =
      (rs, i) ->
          new Aliquot(rs.getString("isolate_id"), rs.getString("tube_barcode"), rs.getString("box_name"));

  private static final RowMapper<Assembly> ASSEMBLY_MAPPER =
      (rs, i) ->
          new Assembly(
              rs.getLong("id"),
              rs.getString("isolate_id"),
              rs.getString("metagenomic_sample_id"),
              rs.getString("metagenomic_run_id"),
              rs.getString("run_number"),
              rs.getString("nanopore_path"),
              rs.getString("sunbeam_version"),
              rs.getString("sbx_sga_version"),
              rs.getString("sunbeam_output_path"),
              rs.getString("ncbi_id"));

  private static final RowMapper<AssemblyQc> QC_MAPPER =
      (rs, i) ->
          new AssemblyQc(
              rs.getLong("assembly_id"),
              rs.getObject("contig_count", Long.class),
              rs.getObject("genome_size", Long.class),
              rs.getObject("n50", Long.class),
              rs.getObject("gc_content", Double.class),
              rs.getObject("cds", Long.class),
              rs.getObject("completeness", Double.class),
              rs.getObject("contamination", Double.class),
              rs.getObject("min_contig_coverage", Double.class),
              rs.getObject("avg_contig_coverage", Double.class),
              rs.getObject("max_contig_coverage", Double.class));

  private static final RowMapper<TaxonomicAssignment> TAXONOMY_MAPPER =
      (rs, i) ->
          new TaxonomicAssignment(
              rs.getLong("assembly_id"),
              rs.getString("tool"),
              rs.getString("classification"),
              rs.getObject("abundance", Double.class),
              rs.getObject("mash_contamination", Double.class),
              rs.getString("mash_contaminated_spp"),
              rs.getString("st"),
              rs.getString("st_schema"),
              rs.getString("allele_assignment"),
              rs.getString("comment"));

  private static final RowMapper<Contaminant> CONTAMINANT_MAPPER =
      (rs, i) ->
          new Contaminant(
              rs.getLong("assembly_id"),
              rs.getString("tool"),
              rs.getObject("confidence", Double.class),
              rs.getString("classification"));

  private static final RowMapper<Antimicrobial> ANTIMICROBIAL_MAPPER =
      (rs, i) ->
          new Antimicrobial(
              rs.getLong("assembly_id"),
              rs.getString("contig_id"),
              rs.getString("gene_symbol"),
              rs.getString("gene_name"),
              rs.getString("accession"),
              rs.getString("element_type"),
              rs.getString("resistance_product"));

  private final NamedParameterJdbcTemplate jdbc;

  public JdbcSpecimenStore(NamedParameterJdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Map<String, Isolate> findIsolates(Collection<String> sampleIds) {
    Map<String, Isolate> isolates = new LinkedHashMap<>();
    queryIn("SELECT * FROM isolates WHERE sample_id IN (:ids)", sampleIds, ISOLATE_MAPPER)
        .forEach(isolate -> isolates.put(isolate.sampleId(), isolate));
    return isolates;
  }

  @Override
  public List<Aliquot> findAliquots(Collection<String> isolateIds) {
    return queryIn("SELECT * FROM aliquots WHERE isolate_id IN (:ids)", isolateIds, ALIQUOT_MAPPER);
  }

  @Override
  public List<Assembly> findAssembliesByIsolate(Collection<String> isolateIds) {
    return queryIn(
        "SELECT " + ASSEMBLY_COLUMNS + " FROM assemblies WHERE isolate_id IN (:ids) ORDER BY id",
        isolateIds,
        ASSEMBLY_MAPPER);
  }

  @Override
  public List<Assembly> findAssembliesById(Collection<Long> assemblyIds) {
    return queryIn(
        "SELECT " + ASSEMBLY_COLUMNS + " FROM assemblies WHERE id IN (:ids) ORDER BY id",
        assemblyIds,
        ASSEMBLY_MAPPER);
  }

  @Override
  public List<AssemblyQc> findAssemblyQcs(Collection<Long> assemblyIds) {
    return queryIn("SELECT * FROM assembly_qc WHERE assembly_id IN (:ids)", assemblyIds, QC_MAPPER);
  }

  @Override
  public List<TaxonomicAssignment> findTaxonomicAssignments(Collection<Long> assemblyIds) {
    return queryIn(
        "SELECT * FROM taxonomic_assignments WHERE assembly_id IN (:ids)",
        assemblyIds,
        TAXONOMY_MAPPER);
  }

  @Override
  public List<Contaminant> findContaminants(Collection<Long> assemblyIds) {
    return queryIn(
        "SELECT * FROM contaminants WHERE assembly_id IN (:ids)", assemblyIds, CONTAMINANT_MAPPER);
  }

  @Override
  public List<Antimicrobial> findAntimicrobials(Collection<Long> assemblyIds) {
    return queryIn(
        "SELECT * FROM antimicrobials WHERE assembly_id IN (:ids)",
        assemblyIds,
        ANTIMICROBIAL_MAPPER);
  }

  @Override
  public void insertIsolates(List<Isolate> isolates) {
    batchInsert(
        "INSERT INTO isolates (sample_id, subject_id, specimen_id, suspected_organism,"
            + " special_collection, received_date, cryobanking_date) VALUES (:sampleId,"
            + " :subjectId, :specimenId, :suspectedOrganism, :specialCollection, :receivedDate,"
            + " :cryobankingDate)",
        isolates,
        isolate ->
            new MapSqlParameterSource()
                .addValue("sampleId", isolate.sampleId())
                .addValue("subjectId", isolate.subjectId())
                .addValue("specimenId", isolate.specimenId())
                .addValue("suspectedOrganism", isolate.suspectedOrganism())
                .addValue("specialCollection", isolate.specialCollection())
                .addValue("receivedDate", isolate.receivedDate())
                .addValue("cryobankingDate", isolate.cryobankingDate()));
  }

  @Override
  public void insertAliquots(List<Aliquot> aliquots) {
    batchInsert(
        "INSERT INTO aliquots (isolate_id, tube_barcode, box_name) VALUES (:isolateId,"
            + " :tubeBarcode, :boxName)",
        aliquots,
        aliquot ->
            new MapSqlParameterSource()
                .addValue("isolateId", aliquot.isolateId())
                .addValue("tubeBarcode", aliquot.tubeBarcode())
                .addValue("boxName", aliquot.boxName()));
  }

  @Override
  public List<Assembly> insertAssemblies(List<Assembly> assemblies) {
    String sql =
        "INSERT INTO assemblies (isolate_id, metagenomic_sample_id, metagenomic_run_id,"
            + " run_number, nanopore_path, sunbeam_version, sbx_sga_version, sunbeam_output_path,"
            + " ncbi_id) VALUES (:isolateId, :metagenomicSampleId, :metagenomicRunId, :runNumber,"
            + " :nanoporePath, :sunbeamVersion, :sbxSgaVersion, :sunbeamOutputPath, :ncbiId)";
    List<Assembly> inserted = new ArrayList<>(assemblies.size());
    for (Assembly assembly : assemblies) {
      MapSqlParameterSource params =
          new MapSqlParameterSource()
              .addValue("isolateId", assembly.isolateId())
              .addValue("metagenomicSampleId", assembly.metagenomicSampleId())
              .addValue("metagenomicRunId", assembly.metagenomicRunId())
              .addValue("runNumber", assembly.runNumber())
              .addValue("nanoporePath", assembly.nanoporePath())
              .addValue("sunbeamVersion", assembly.sunbeamVersion())
              .addValue("sbxSgaVersion", assembly.sbxSgaVersion())
              .addValue("sunbeamOutputPath", assembly.sunbeamOutputPath())
              .addValue("ncbiId", assembly.ncbiId());
      KeyHolder keyHolder = new GeneratedKeyHolder();
      jdbc.update(sql, params, keyHolder, new String[] {"id"});
      Number key = keyHolder.getKey();
      if (key == null) {
        throw new IllegalStateException("No id generated for assembly " + assembly.label());
      }
      inserted.add(assembly.withId(key.longValue()));
    }
    log.debug("Inserted {} assemblies", inserted.size());
    return inserted;
  }

  @Override
  public void insertAssemblyQcs(List<AssemblyQc> qcs) {
    batchInsert(
        "INSERT INTO assembly_qc (assembly_id, contig_count, genome_size, n50, gc_content, cds,"
            + " completeness, contamination, min_contig_coverage, avg_contig_coverage,"
            + " max_contig_coverage) VALUES (:assemblyId, :contigCount, :genomeSize, :n50,"
            + " :gcContent, :cds, :completeness, :contamination, :minContigCoverage,"
            + " :avgContigCoverage, :maxContigCoverage)",
        qcs,
        qc ->
            new MapSqlParameterSource()
                .addValue("assemblyId", qc.assemblyId())
                .addValue("contigCount", qc.contigCount())
                .addValue("genomeSize", qc.genomeSize())
                .addValue("n50", qc.n50())
                .addValue("gcContent", qc.gcContent())
                .addValue("cds", qc.cds())
                .addValue("completeness", qc.completeness())
                .addValue("contamination", qc.contamination())
                .addValue("minContigCoverage", qc.minContigCoverage())
                .addValue("avgContigCoverage", qc.avgContigCoverage())
                .addValue("maxContigCoverage", qc.maxContigCoverage()));
  }

  @Override
  public void insertTaxonomicAssignments(List<TaxonomicAssignment> assignments) {
    batchInsert(
        "INSERT INTO taxonomic_assignments (assembly_id, tool, classification, abundance,"
            + " mash_contamination, mash_contaminated_spp, st, st_schema, allele_assignment,"
            + " comment) VALUES (:assemblyId, :tool, :classification, :abundance,"
            + " :mashContamination, :mashContaminatedSpp, :st, :stSchema, :alleleAssignment,"
            + " :comment)",
        assignments,
        tax ->
            new MapSqlParameterSource()
                .addValue("assemblyId", tax.assemblyId())
                .addValue("tool", tax.tool())
                .addValue("classification", tax.classification())
                .addValue("abundance", tax.abundance())
                .addValue("mashContamination", tax.mashContamination())
                .addValue("mashContaminatedSpp", tax.mashContaminatedSpp())
                .addValue("st", tax.st())
                .addValue("stSchema", tax.stSchema())
                .addValue("alleleAssignment", tax.alleleAssignment())
                .addValue("comment", tax.comment()));
  }

  @Override
  public void insertContaminants(List<Contaminant> contaminants) {
    batchInsert(
        "INSERT INTO contaminants (assembly_id, tool, confidence, classification) VALUES"
            + " (:assemblyId, :tool, :confidence, :classification)",
        contaminants,
        contaminant ->
            new MapSqlParameterSource()
                .addValue("assemblyId", contaminant.assemblyId())
                .addValue("tool", contaminant.tool())
                .addValue("confidence", contaminant.confidence())
                .addValue("classification", contaminant.classification()));
  }

  @Override
  public void insertAntimicrobials(List<Antimicrobial> antimicrobials) {
    batchInsert(
        "INSERT INTO antimicrobials (assembly_id, contig_id, gene_symbol, gene_name, accession,"
            + " element_type, resistance_product) VALUES (:assemblyId, :contigId, :geneSymbol,"
            + " :geneName, :accession, :elementType, :resistanceProduct)",
        antimicrobials,
        amr ->
            new MapSqlParameterSource()
                .addValue("assemblyId", amr.assemblyId())
                .addValue("contigId", amr.contigId())
                .addValue("geneSymbol", amr.geneSymbol())
                .addValue("geneName", amr.geneName())
                .addValue("accession", amr.accession())
                .addValue("elementType", amr.elementType())
                .addValue("resistanceProduct", amr.resistanceProduct()));
  }

  @Override
  public long count(String table) {
    if (!TABLES.contains(table)) {
      throw new IllegalArgumentException("Unknown table: " + table);
    }
    Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
    return count != null ? count : 0L;
  }

  private <T> List<T> queryIn(String sql, Collection<?> ids, RowMapper<T> mapper) {
    if (ids == null || ids.isEmpty()) {
      return List.of();
    }
    return jdbc.query(sql, new MapSqlParameterSource("ids", ids), mapper);
  }

  private <T> void batchInsert(
      String sql, List<T> records, Function<T, SqlParameterSource> toParams) {
    if (records.isEmpty()) {
      return;
    }
    SqlParameterSource[] batch = records.stream().map(toParams).toArray(SqlParameterSource[]::new);
    jdbc.batchUpdate(sql, batch);
  }
}
