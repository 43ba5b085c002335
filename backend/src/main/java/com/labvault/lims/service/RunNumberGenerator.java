package com.labvault.lims.service;

import com.labvault.lims.model.IdCounter;
import com.labvault.lims.model.IdGenerationLog;
import com.labvault.lims.repository.IdCounterRepository;
import com.labvault.lims.repository.IdGenerationLogRepository;
import com.labvault.lims.repository.SequencingRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Hands out human-facing run numbers from the id_counters row for sequencing runs.
 * The counter row is locked for the rest of the caller's transaction, so run creation
 * is serialized across concurrent imports.
 */
@Service
public class RunNumberGenerator {
    private static final Logger log = LoggerFactory.getLogger(RunNumberGenerator.class);

    public static final String SEQUENCING_RUN = "sequencing_run";

    private final IdCounterRepository idCounterRepository;
    private final IdGenerationLogRepository idGenerationLogRepository;
    private final SequencingRunRepository runRepository;

    public RunNumberGenerator(IdCounterRepository idCounterRepository,
                              IdGenerationLogRepository idGenerationLogRepository,
                              SequencingRunRepository runRepository) {
        this.idCounterRepository = idCounterRepository;
        this.idGenerationLogRepository = idGenerationLogRepository;
        this.runRepository = runRepository;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public IdCounter lock() {
        return idCounterRepository.findForUpdate(SEQUENCING_RUN)
                .orElseThrow(() -> new IllegalStateException("Missing id_counters row for " + SEQUENCING_RUN));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int next(String actorId) {
        IdCounter counter = lock();
        // Runs loaded outside this generator (legacy imports) must not be renumbered over
        int floor = Math.max(counter.getLastValue(), runRepository.findMaxRunNumber());
        int value = floor + 1;
        counter.setLastValue(value);
        idCounterRepository.save(counter);

        IdGenerationLog entry = new IdGenerationLog();
        entry.setEntityType(SEQUENCING_RUN);
        entry.setGeneratedId(value);
        entry.setGeneratedBy(actorId);
        idGenerationLogRepository.save(entry);

        log.debug("Allocated sequencing run number {} for {}", value, actorId);
        return value;
    }
}
