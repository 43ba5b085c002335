package com.labvault.lims.service;

import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.dto.SequencingImportResult;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.dto.SequencingRunSummaryDTO;
import com.labvault.lims.dto.SequencingSampleViewDTO;
import com.labvault.lims.model.Collaborator;
import com.labvault.lims.model.Project;
import com.labvault.lims.model.Specimen;
import com.labvault.lims.repository.CollaboratorRepository;
import com.labvault.lims.repository.ProjectRepository;
import com.labvault.lims.repository.SpecimenRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class SequencingRunQueryServiceTest {

    @Autowired private SequencingImportService importService;
    @Autowired private SequencingRunQueryService queryService;
    @Autowired private SpecimenRepository specimenRepository;
    @Autowired private ProjectRepository projectRepository;
    @Autowired private CollaboratorRepository collaboratorRepository;
    @Autowired private JdbcTemplate jdbc;

    private Specimen specimen;

    @BeforeEach
    void seed() {
        jdbc.update("delete from sequencing_samples");
        jdbc.update("delete from sequencing_runs");
        jdbc.update("delete from specimens");
        jdbc.update("delete from projects");
        jdbc.update("delete from collaborators");

        Collaborator c = collaboratorRepository.save(new Collaborator(3, "Dr. Leonard", "WU"));
        Project p = projectRepository.save(new Project(852, c, "Celiac"));
        specimen = specimenRepository.save(new Specimen(39552, p, "TUBE-1"));
    }

    private SequencingImportResult importRun(String srn, LocalDateTime completion, String... names) {
        RunMetadata md = new RunMetadata(srn, null, "/data");
        md.setCompletionDate(completion);
        List<SequencingRowInput> rows = java.util.Arrays.stream(names).map(SequencingRowInput::new).toList();
        return importService.importSequencingData(rows, md, "alice");
    }

    @Test
    void runsAreListedNewestNumberFirstWithCounts() {
        SequencingImportResult older = importRun("SR-OLD", LocalDateTime.of(2024, 1, 10, 0, 0), "I1_39552_A");
        SequencingImportResult newer = importRun("SR-NEW", LocalDateTime.of(2024, 2, 10, 0, 0), "I2_39552_B", "I3_77777_C", "I4_88888_D");

        List<SequencingRunSummaryDTO> runs = queryService.getSequencingRuns();

        assertThat(runs).extracting(SequencingRunSummaryDTO::getId).containsExactly(newer.getRunId(), older.getRunId());
        SequencingRunSummaryDTO top = runs.get(0);
        assertThat(top.getServiceRequestNumber()).isEqualTo("SR-NEW");
        assertThat(top.getSampleCount()).isEqualTo(3);
        assertThat(top.getLinkedCount()).isEqualTo(1);
        assertThat(top.getNoMatchCount()).isEqualTo(2);
        assertThat(top.getFailedCount()).isZero();
        assertThat(top.getCompletionDate()).isEqualTo(LocalDateTime.of(2024, 2, 10, 0, 0));
    }

    @Test
    void singleRunLookup() {
        SequencingImportResult r = importRun("SR-ONE", null);
        assertThat(queryService.getSequencingRun(r.getRunId())).get()
                .satisfies(dto -> {
                    assertThat(dto.getRunNumber()).isEqualTo(r.getRunNumber());
                    assertThat(dto.getSampleCount()).isZero();
                });
        assertThat(queryService.getSequencingRun(r.getRunId() + 500)).isEmpty();
    }

    @Test
    void runSamplesAreOrderedByWuidAndCarrySpecimenDetails() {
        SequencingImportResult r = importRun("SR-S", null, "I9_88888_Z", "I1_39552_A", "I5_40000_Q");

        List<SequencingSampleViewDTO> samples = queryService.getRunSequencingSamples(r.getRunId());

        assertThat(samples).extracting(SequencingSampleViewDTO::getWuid).containsExactly(39552, 40000, 88888);
        SequencingSampleViewDTO linked = samples.get(0);
        assertThat(linked.getLinkStatus()).isEqualTo("linked");
        assertThat(linked.getSpecimenNumber()).isEqualTo(39552);
        assertThat(linked.getTubeId()).isEqualTo("TUBE-1");
        assertThat(linked.getProjectNumber()).isEqualTo(852);
        assertThat(linked.getPiName()).isEqualTo("Dr. Leonard");
        assertThat(samples.get(1).getLinkStatus()).isEqualTo("no_match");
        assertThat(samples.get(1).getSpecimenNumber()).isNull();
        assertThat(samples.get(1).getPiName()).isNull();
    }

    @Test
    void unknownRunHasNoSamples() {
        assertThat(queryService.getRunSequencingSamples(123456L)).isEmpty();
    }

    @Test
    void specimenHistoryShowsNewestRunFirst() {
        importRun("SR-JAN", LocalDateTime.of(2024, 1, 1, 0, 0), "I1_39552_A");
        importRun("SR-MAR", LocalDateTime.of(2024, 3, 1, 0, 0), "I2_39552_B");

        List<SequencingSampleViewDTO> history = queryService.getSpecimenSequencingData(specimen.getId());

        assertThat(history).extracting(SequencingSampleViewDTO::getServiceRequestNumber).containsExactly("SR-MAR", "SR-JAN");
        assertThat(history.get(0).getRunNumber()).isNotNull();
        assertThat(history.get(0).getSpecimenId()).isEqualTo(specimen.getId());
    }
}
