package com.labvault.lims.service;

import com.labvault.lims.dto.SequencingRunSummaryDTO;
import com.labvault.lims.dto.SequencingSampleViewDTO;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class SequencingRunQueryService {
    private final NamedParameterJdbcTemplate jdbc;

    private static final String RUN_SUMMARY_SELECT = "select r.id, r.run_number, r.service_request_number, r.flowcell_id, r.pool_name,\n" +
            "       r.sequencer_type, r.completion_date, r.base_directory, r.file_pattern_r1, r.file_pattern_r2,\n" +
            "       r.created_by, r.created_at,\n" +
            "       coalesce(c.sample_count, 0) as sample_count,\n" +
            "       coalesce(c.linked_count, 0) as linked_count,\n" +
            "       coalesce(c.no_match_count, 0) as no_match_count,\n" +
            "       coalesce(c.failed_count, 0) as failed_count\n" +
            "from sequencing_runs r\n" +
            "left join (\n" +
            "  select s.sequencing_run_id,\n" +
            "         count(*) as sample_count,\n" +
            "         sum(case when s.link_status = 'linked' then 1 else 0 end) as linked_count,\n" +
            "         sum(case when s.link_status = 'no_match' then 1 else 0 end) as no_match_count,\n" +
            "         sum(case when s.link_status = 'failed' then 1 else 0 end) as failed_count\n" +
            "  from sequencing_samples s\n" +
            "  group by s.sequencing_run_id\n" +
            ") c on c.sequencing_run_id = r.id\n";

    private static final String SAMPLE_COLUMNS = "s.id, s.sequencing_run_id, s.specimen_id, s.facility_sample_name, s.wuid, s.library_id,\n" +
            "       s.esp_id, s.index_sequence, s.flowcell_lane, s.fastq_r1_path, s.fastq_r2_path, s.species,\n" +
            "       s.library_type, s.sample_type, s.total_reads, s.total_bases, s.pct_q30_r1, s.pct_q30_r2,\n" +
            "       s.avg_q_score_r1, s.avg_q_score_r2, s.phix_error_rate_r1, s.phix_error_rate_r2,\n" +
            "       s.pct_pass_filter_r1, s.pct_pass_filter_r2, s.link_status, s.link_error, s.linked_at, s.created_at";

    public SequencingRunQueryService(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public List<SequencingRunSummaryDTO> getSequencingRuns() {
        String sql = RUN_SUMMARY_SELECT + "order by r.run_number desc";
        return jdbc.query(sql, new MapSqlParameterSource(), RUN_SUMMARY_MAPPER);
    }

    public Optional<SequencingRunSummaryDTO> getSequencingRun(Long runId) {
        if (runId == null) return Optional.empty();
        String sql = RUN_SUMMARY_SELECT + "where r.id = :runId";
        List<SequencingRunSummaryDTO> rows = jdbc.query(sql, new MapSqlParameterSource("runId", runId), RUN_SUMMARY_MAPPER);
        return rows.stream().findFirst();
    }

    /** Samples of one run with the linked specimen's identifiers; unknown runs give an empty list. */
    public List<SequencingSampleViewDTO> getRunSequencingSamples(Long runId) {
        String sql = "select " + SAMPLE_COLUMNS + ",\n" +
                "       sp.specimen_number, sp.tube_id, p.project_number, c.pi_name\n" +
                "from sequencing_samples s\n" +
                "left join specimens sp on sp.id = s.specimen_id\n" +
                "left join projects p on p.id = sp.project_id\n" +
                "left join collaborators c on c.id = p.collaborator_id\n" +
                "where s.sequencing_run_id = :runId\n" +
                "order by s.wuid asc, s.id asc";
        return jdbc.query(sql, new MapSqlParameterSource("runId", runId), (rs, rowNum) -> {
            SequencingSampleViewDTO dto = mapSample(rs);
            dto.setSpecimenNumber(rs.getObject("specimen_number", Integer.class));
            dto.setTubeId(rs.getString("tube_id"));
            dto.setProjectNumber(rs.getObject("project_number", Integer.class));
            dto.setPiName(rs.getString("pi_name"));
            return dto;
        });
    }

    public List<SequencingSampleViewDTO> getSpecimenSequencingData(Long specimenId) {
        String sql = "select " + SAMPLE_COLUMNS + ",\n" +
                "       r.run_number, r.service_request_number, r.completion_date\n" +
                "from sequencing_samples s\n" +
                "join sequencing_runs r on r.id = s.sequencing_run_id\n" +
                "where s.specimen_id = :specimenId\n" +
                "order by r.completion_date desc, r.run_number desc, s.id asc";
        return jdbc.query(sql, new MapSqlParameterSource("specimenId", specimenId), (rs, rowNum) -> {
            SequencingSampleViewDTO dto = mapSample(rs);
            dto.setRunNumber(rs.getObject("run_number", Integer.class));
            dto.setServiceRequestNumber(rs.getString("service_request_number"));
            dto.setCompletionDate(rs.getObject("completion_date", LocalDateTime.class));
            return dto;
        });
    }

    private static final RowMapper<SequencingRunSummaryDTO> RUN_SUMMARY_MAPPER = (rs, rowNum) -> {
        SequencingRunSummaryDTO dto = new SequencingRunSummaryDTO();
        dto.setId(rs.getLong("id"));
        dto.setRunNumber(rs.getInt("run_number"));
        dto.setServiceRequestNumber(rs.getString("service_request_number"));
        dto.setFlowcellId(rs.getString("flowcell_id"));
        dto.setPoolName(rs.getString("pool_name"));
        dto.setSequencerType(rs.getString("sequencer_type"));
        dto.setCompletionDate(rs.getObject("completion_date", LocalDateTime.class));
        dto.setBaseDirectory(rs.getString("base_directory"));
        dto.setFilePatternR1(rs.getString("file_pattern_r1"));
        dto.setFilePatternR2(rs.getString("file_pattern_r2"));
        dto.setCreatedBy(rs.getString("created_by"));
        dto.setCreatedAt(rs.getObject("created_at", LocalDateTime.class));
        dto.setSampleCount(rs.getLong("sample_count"));
        dto.setLinkedCount(rs.getLong("linked_count"));
        dto.setNoMatchCount(rs.getLong("no_match_count"));
        dto.setFailedCount(rs.getLong("failed_count"));
        return dto;
    };

    private static SequencingSampleViewDTO mapSample(ResultSet rs) throws SQLException {
        SequencingSampleViewDTO dto = new SequencingSampleViewDTO();
        dto.setId(rs.getLong("id"));
        dto.setSequencingRunId(rs.getLong("sequencing_run_id"));
        dto.setSpecimenId(rs.getObject("specimen_id", Long.class));
        dto.setFacilitySampleName(rs.getString("facility_sample_name"));
        dto.setWuid(rs.getObject("wuid", Integer.class));
        dto.setLibraryId(rs.getString("library_id"));
        dto.setEspId(rs.getString("esp_id"));
        dto.setIndexSequence(rs.getString("index_sequence"));
        dto.setFlowcellLane(rs.getObject("flowcell_lane", Integer.class));
        dto.setFastqR1Path(rs.getString("fastq_r1_path"));
        dto.setFastqR2Path(rs.getString("fastq_r2_path"));
        dto.setSpecies(rs.getString("species"));
        dto.setLibraryType(rs.getString("library_type"));
        dto.setSampleType(rs.getString("sample_type"));
        dto.setTotalReads(rs.getObject("total_reads", Long.class));
        dto.setTotalBases(rs.getObject("total_bases", Long.class));
        dto.setPctQ30R1(rs.getBigDecimal("pct_q30_r1"));
        dto.setPctQ30R2(rs.getBigDecimal("pct_q30_r2"));
        dto.setAvgQScoreR1(rs.getBigDecimal("avg_q_score_r1"));
        dto.setAvgQScoreR2(rs.getBigDecimal("avg_q_score_r2"));
        dto.setPhixErrorRateR1(rs.getBigDecimal("phix_error_rate_r1"));
        dto.setPhixErrorRateR2(rs.getBigDecimal("phix_error_rate_r2"));
        dto.setPctPassFilterR1(rs.getBigDecimal("pct_pass_filter_r1"));
        dto.setPctPassFilterR2(rs.getBigDecimal("pct_pass_filter_r2"));
        dto.setLinkStatus(rs.getString("link_status"));
        dto.setLinkError(rs.getString("link_error"));
        dto.setLinkedAt(rs.getObject("linked_at", LocalDateTime.class));
        dto.setCreatedAt(rs.getObject("created_at", LocalDateTime.class));
        return dto;
    }
}
