package com.labvault.lims.service;

import com.labvault.lims.config.SequencingDefaults;
import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.exception.AmbiguousSequencingRunException;
import com.labvault.lims.exception.RunRegistrationConflictException;
import com.labvault.lims.model.SequencingRun;
import com.labvault.lims.repository.SequencingRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;

/**
 * Find-or-create for the run that owns an imported batch. An existing run is returned as stored;
 * metadata sent with a later import of the same batch is ignored.
 */
@Service
public class SequencingRunRegistrar {
    private static final Logger log = LoggerFactory.getLogger(SequencingRunRegistrar.class);

    private final SequencingRunRepository runRepository;
    private final RunNumberGenerator runNumberGenerator;
    private final SequencingDefaults defaults;

    public SequencingRunRegistrar(SequencingRunRepository runRepository,
                                  RunNumberGenerator runNumberGenerator,
                                  SequencingDefaults defaults) {
        this.runRepository = runRepository;
        this.runNumberGenerator = runNumberGenerator;
        this.defaults = defaults;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public SequencingRun findOrCreate(RunMetadata metadata, String actorId) {
        if (metadata == null) throw new IllegalArgumentException("Run metadata is required");
        String serviceRequest = trimToNull(metadata.getServiceRequestNumber());
        String flowcell = trimToNull(metadata.getFlowcellId());
        if (serviceRequest == null && flowcell == null) {
            throw new IllegalArgumentException("Run metadata needs a service request number or a flowcell id");
        }

        Optional<SequencingRun> existing = findExisting(serviceRequest, flowcell);
        if (existing.isPresent()) {
            log.debug("Reusing sequencing run #{} for service request {} / flowcell {}",
                    existing.get().getRunNumber(), serviceRequest, flowcell);
            return existing.get();
        }

        // Another import may have registered the batch while we waited for the counter lock
        runNumberGenerator.lock();
        existing = findExisting(serviceRequest, flowcell);
        if (existing.isPresent()) return existing.get();

        SequencingRun run = new SequencingRun();
        run.setRunNumber(runNumberGenerator.next(actorId));
        run.setServiceRequestNumber(serviceRequest);
        run.setFlowcellId(flowcell);
        run.setPoolName(trimToNull(metadata.getPoolName()));
        run.setCompletionDate(metadata.getCompletionDate());
        run.setSequencerType(orDefault(metadata.getSequencerType(), defaults.getSequencerType()));
        run.setBaseDirectory(trimToNull(metadata.getBaseDirectory()));
        run.setFilePatternR1(orDefault(metadata.getFilePatternR1(), defaults.getFilePatternR1()));
        run.setFilePatternR2(orDefault(metadata.getFilePatternR2(), defaults.getFilePatternR2()));
        run.setCreatedBy(actorId);
        try {
            run = runRepository.saveAndFlush(run);
        } catch (DataIntegrityViolationException ex) {
            throw new RunRegistrationConflictException(serviceRequest, flowcell, ex);
        }
        log.info("Registered sequencing run #{} (service request={}, flowcell={}) by {}",
                run.getRunNumber(), serviceRequest, flowcell, actorId);
        return run;
    }

    /**
     * Both keys must agree: when they resolve to two different runs the batch is rejected
     * instead of being attached to whichever row the store returns first.
     */
    Optional<SequencingRun> findExisting(String serviceRequest, String flowcell) {
        Optional<SequencingRun> byServiceRequest = serviceRequest == null
                ? Optional.empty() : runRepository.findByServiceRequestNumber(serviceRequest);
        Optional<SequencingRun> byFlowcell = flowcell == null
                ? Optional.empty() : runRepository.findByFlowcellId(flowcell);

        if (byServiceRequest.isPresent() && byFlowcell.isPresent()
                && !Objects.equals(byServiceRequest.get().getId(), byFlowcell.get().getId())) {
            throw new AmbiguousSequencingRunException(serviceRequest, byServiceRequest.get().getRunNumber(),
                    flowcell, byFlowcell.get().getRunNumber());
        }
        return byServiceRequest.isPresent() ? byServiceRequest : byFlowcell;
    }

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String orDefault(String value, String fallback) {
        String t = trimToNull(value);
        return t != null ? t : fallback;
    }
}
