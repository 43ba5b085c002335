package com.labvault.lims.service;

import com.labvault.lims.exception.SequencingRunNotFoundException;
import com.labvault.lims.model.AuditEntry;
import com.labvault.lims.model.SequencingRun;
import com.labvault.lims.repository.AuditEntryRepository;
import com.labvault.lims.repository.SequencingRunRepository;
import com.labvault.lims.repository.SequencingSampleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Removes a run together with all of its sample rows. Specimens, other runs and their samples
 * are never touched.
 */
@Service
public class SequencingRunLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(SequencingRunLifecycleService.class);

    private final SequencingRunRepository runRepository;
    private final SequencingSampleRepository sampleRepository;
    private final AuditEntryRepository auditEntryRepository;

    public SequencingRunLifecycleService(SequencingRunRepository runRepository,
                                         SequencingSampleRepository sampleRepository,
                                         AuditEntryRepository auditEntryRepository) {
        this.runRepository = runRepository;
        this.sampleRepository = sampleRepository;
        this.auditEntryRepository = auditEntryRepository;
    }

    @Transactional
    public void deleteSequencingRun(Long runId, String actorId) {
        if (runId == null) throw new IllegalArgumentException("runId is required");
        try {
            SequencingRun run = runRepository.findById(runId).orElse(null);
            String srn = run != null ? run.getServiceRequestNumber() : null;
            String flowcell = run != null ? run.getFlowcellId() : null;
            Integer runNumber = run != null ? run.getRunNumber() : null;

            int samplesDeleted = sampleRepository.deleteBySequencingRunId(runId);
            int runsDeleted = runRepository.deleteRunById(runId);
            if (runsDeleted == 0) {
                throw new SequencingRunNotFoundException(runId);
            }

            AuditEntry audit = new AuditEntry();
            audit.setAction(AuditEntry.SEQUENCING_RUN_DELETE);
            audit.setUserId(actorId == null || actorId.isBlank() ? SequencingImportService.SYSTEM_ACTOR : actorId);
            audit.setEntityId(runId);
            audit.setParams(String.format("{\"runNumber\":%s,\"serviceRequestNumber\":%s,\"flowcellId\":%s}",
                    runNumber, quote(srn), quote(flowcell)));
            audit.setAffectedCount((long) samplesDeleted);
            auditEntryRepository.save(audit);

            log.info("Deleted sequencing run #{} (id={}, service request {}, flowcell {}) with {} samples",
                    runNumber, runId, srn, flowcell, samplesDeleted);
        } catch (SequencingRunNotFoundException ex) {
            log.warn("Delete requested for unknown sequencing run id={}", runId);
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Failed to delete sequencing run id={}: {}", runId, ex.getMessage());
            throw ex;
        }
    }

    private static String quote(String value) {
        if (value == null) return "null";
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
