package com.labvault.lims.service;

import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.dto.SequencingImportResult;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.exception.SequencingRunNotFoundException;
import com.labvault.lims.model.AuditEntry;
import com.labvault.lims.model.Collaborator;
import com.labvault.lims.model.Project;
import com.labvault.lims.model.Specimen;
import com.labvault.lims.repository.AuditEntryRepository;
import com.labvault.lims.repository.CollaboratorRepository;
import com.labvault.lims.repository.ProjectRepository;
import com.labvault.lims.repository.SequencingRunRepository;
import com.labvault.lims.repository.SequencingSampleRepository;
import com.labvault.lims.repository.SpecimenRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class SequencingRunLifecycleServiceTest {

    @Autowired private SequencingImportService importService;
    @Autowired private SequencingRunLifecycleService lifecycleService;
    @Autowired private SequencingRunRepository runRepository;
    @Autowired private SequencingSampleRepository sampleRepository;
    @Autowired private SpecimenRepository specimenRepository;
    @Autowired private ProjectRepository projectRepository;
    @Autowired private CollaboratorRepository collaboratorRepository;
    @Autowired private AuditEntryRepository auditEntryRepository;
    @Autowired private JdbcTemplate jdbc;

    @BeforeEach
    void seed() {
        jdbc.update("delete from sequencing_samples");
        jdbc.update("delete from sequencing_runs");
        jdbc.update("delete from specimens");
        jdbc.update("delete from projects");
        jdbc.update("delete from collaborators");
        jdbc.update("delete from audit_log");

        Collaborator c = collaboratorRepository.save(new Collaborator(2, "Dr. Ortiz", "WU"));
        Project p = projectRepository.save(new Project(851, c, "IBD"));
        specimenRepository.save(new Specimen(101, p, "T-101"));
    }

    @Test
    void deletesOnlyTheRequestedRun() {
        List<SequencingRowInput> rows = List.of(new SequencingRowInput("X_101_a"), new SequencingRowInput("X_202_b"));
        SequencingImportResult doomed = importService.importSequencingData(rows, new RunMetadata("SR-D", null, "/d"), "alice");
        SequencingImportResult kept = importService.importSequencingData(rows, new RunMetadata("SR-K", null, "/k"), "alice");

        lifecycleService.deleteSequencingRun(doomed.getRunId(), "carol");

        assertThat(runRepository.findById(doomed.getRunId())).isEmpty();
        assertThat(sampleRepository.countBySequencingRunId(doomed.getRunId())).isZero();
        assertThat(runRepository.findById(kept.getRunId())).isPresent();
        assertThat(sampleRepository.countBySequencingRunId(kept.getRunId())).isEqualTo(2);
        assertThat(specimenRepository.findBySpecimenNumber(101)).isPresent();

        assertThat(auditEntryRepository.findByActionOrderByCreatedAtDesc(AuditEntry.SEQUENCING_RUN_DELETE))
                .singleElement()
                .satisfies(a -> {
                    assertThat(a.getUserId()).isEqualTo("carol");
                    assertThat(a.getEntityId()).isEqualTo(doomed.getRunId());
                    assertThat(a.getAffectedCount()).isEqualTo(2L);
                    assertThat(a.getParams()).contains("SR-D");
                });
    }

    @Test
    void unknownRunIsNotFoundAndNothingChanges() {
        SequencingImportResult kept = importService.importSequencingData(
                List.of(new SequencingRowInput("X_101_a")), new RunMetadata("SR-K", null, "/k"), "alice");

        assertThatThrownBy(() -> lifecycleService.deleteSequencingRun(kept.getRunId() + 1000, "carol"))
                .isInstanceOf(SequencingRunNotFoundException.class);
        assertThat(runRepository.count()).isEqualTo(1);
        assertThat(sampleRepository.count()).isEqualTo(1);
        assertThat(auditEntryRepository.findByActionOrderByCreatedAtDesc(AuditEntry.SEQUENCING_RUN_DELETE)).isEmpty();
    }

    @Test
    void runNumbersAreNotReusedAfterDelete() {
        SequencingImportResult first = importService.importSequencingData(List.of(), new RunMetadata("SR-1", null, null), "alice");
        lifecycleService.deleteSequencingRun(first.getRunId(), "alice");
        SequencingImportResult second = importService.importSequencingData(List.of(), new RunMetadata("SR-2", null, null), "alice");

        assertThat(second.getRunNumber()).isGreaterThan(first.getRunNumber());
    }
}
