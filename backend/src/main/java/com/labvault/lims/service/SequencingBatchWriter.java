package com.labvault.lims.service;

import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.dto.SequencingImportResult;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.model.AuditEntry;
import com.labvault.lims.model.LinkOutcome;
import com.labvault.lims.model.SequencingRun;
import com.labvault.lims.model.SequencingSample;
import com.labvault.lims.repository.AuditEntryRepository;
import com.labvault.lims.repository.SequencingSampleRepository;
import com.labvault.lims.util.FastqPathBuilder;
import com.labvault.lims.util.NumericNormalizer;
import com.labvault.lims.util.WuidExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Writes one facility batch inside a single transaction: the run is registered once, then every
 * row is linked and inserted in order. Rows without a WUID, rows whose specimen is missing and rows
 * whose values do not fit their columns never abort the batch; a failed run registration or a
 * store-level insert error rolls all of it back.
 */
@Service
public class SequencingBatchWriter {
    private static final Logger log = LoggerFactory.getLogger(SequencingBatchWriter.class);

    static final String NO_WUID_ERROR = "Could not extract WUID from facility sample name";

    private final SequencingRunRegistrar runRegistrar;
    private final SpecimenResolver specimenResolver;
    private final SequencingSampleRepository sampleRepository;
    private final AuditEntryRepository auditEntryRepository;
    private final SequencingSampleValidator sampleValidator;

    public SequencingBatchWriter(SequencingRunRegistrar runRegistrar,
                                 SpecimenResolver specimenResolver,
                                 SequencingSampleRepository sampleRepository,
                                 AuditEntryRepository auditEntryRepository,
                                 SequencingSampleValidator sampleValidator) {
        this.runRegistrar = runRegistrar;
        this.specimenResolver = specimenResolver;
        this.sampleRepository = sampleRepository;
        this.auditEntryRepository = auditEntryRepository;
        this.sampleValidator = sampleValidator;
    }

    @Transactional
    public SequencingImportResult write(List<SequencingRowInput> rows, RunMetadata metadata, String actorId) {
        SequencingRun run = runRegistrar.findOrCreate(metadata, actorId);
        SequencingImportResult result = new SequencingImportResult(run.getId(), run.getRunNumber());

        for (int i = 0; i < rows.size(); i++) {
            writeRow(i + 1, rows.get(i), run, result);
        }

        AuditEntry audit = new AuditEntry();
        audit.setAction(AuditEntry.SEQUENCING_IMPORT);
        audit.setUserId(actorId);
        audit.setEntityId(run.getId());
        audit.setParams(String.format("{\"runNumber\":%d,\"rows\":%d,\"linked\":%d,\"noMatch\":%d,\"failed\":%d}",
                run.getRunNumber(), rows.size(), result.getLinkedCount(), result.getNoMatchCount(), result.getFailedCount()));
        audit.setAffectedCount((long) result.getSuccessCount());
        auditEntryRepository.save(audit);
        return result;
    }

    private void writeRow(int rowIndex, SequencingRowInput row, SequencingRun run, SequencingImportResult result) {
        String facilityName = row != null ? row.getFacilitySampleName() : null;
        Integer wuid = WuidExtractor.extract(facilityName);
        if (wuid == null) {
            log.debug("Row {} skipped, no WUID in '{}'", rowIndex, facilityName);
            result.recordExtractionFailure(rowIndex, facilityName, NO_WUID_ERROR);
            return;
        }

        LinkOutcome outcome = resolve(wuid);
        SequencingSample sample = toSample(row, run, wuid, outcome);
        List<String> invalid = sampleValidator.validate(sample);
        if (!invalid.isEmpty()) {
            log.warn("Row {} ('{}') rejected: {}", rowIndex, facilityName, invalid);
            result.recordExtractionFailure(rowIndex, facilityName, String.join("; ", invalid));
            return;
        }
        // Flushed per row so a bad insert surfaces here, inside the batch transaction
        sampleRepository.saveAndFlush(sample);
        result.recordPersisted(rowIndex, facilityName, outcome);
    }

    LinkOutcome resolve(int wuid) {
        try {
            return specimenResolver.findSpecimenIdByWuid(wuid)
                    .<LinkOutcome>map(specimenId -> new LinkOutcome.Linked(specimenId, LocalDateTime.now()))
                    .orElseGet(() -> new LinkOutcome.NoMatch("No specimen found with WUID " + wuid));
        } catch (DataAccessException ex) {
            log.warn("Specimen lookup failed for WUID {}: {}", wuid, ex.getMessage());
            return new LinkOutcome.Failed("Error finding specimen: " + ex.getMessage());
        }
    }

    private SequencingSample toSample(SequencingRowInput row, SequencingRun run, int wuid, LinkOutcome outcome) {
        SequencingSample s = new SequencingSample();
        s.setSequencingRun(run);
        s.setFacilitySampleName(row.getFacilitySampleName());
        s.setWuid(wuid);
        s.setLibraryId(row.getLibraryId());
        s.setEspId(row.getEspId());
        s.setIndexSequence(row.getIndexSequence());
        s.setFlowcellLane(NumericNormalizer.toInteger(row.getFlowcellLane()));
        s.setSpecies(row.getSpecies());
        s.setLibraryType(row.getLibraryType());
        s.setSampleType(row.getSampleType());
        s.setTotalReads(NumericNormalizer.toLong(row.getTotalReads()));
        s.setTotalBases(NumericNormalizer.toLong(row.getTotalBases()));
        s.setPctQ30R1(NumericNormalizer.normalize(row.getPctQ30R1()));
        s.setPctQ30R2(NumericNormalizer.normalize(row.getPctQ30R2()));
        s.setAvgQScoreR1(NumericNormalizer.normalize(row.getAvgQScoreR1()));
        s.setAvgQScoreR2(NumericNormalizer.normalize(row.getAvgQScoreR2()));
        s.setPhixErrorRateR1(NumericNormalizer.normalize(row.getPhixErrorRateR1()));
        s.setPhixErrorRateR2(NumericNormalizer.normalize(row.getPhixErrorRateR2()));
        s.setPctPassFilterR1(NumericNormalizer.normalize(row.getPctPassFilterR1()));
        s.setPctPassFilterR2(NumericNormalizer.normalize(row.getPctPassFilterR2()));

        // Paths follow the stored run, not the metadata of this request
        String runIdentifier = run.getRunIdentifier();
        s.setFastqR1Path(FastqPathBuilder.build(run.getBaseDirectory(), runIdentifier, row.getFacilitySampleName(), run.getFilePatternR1()));
        s.setFastqR2Path(FastqPathBuilder.build(run.getBaseDirectory(), runIdentifier, row.getFacilitySampleName(), run.getFilePatternR2()));

        s.applyLinkOutcome(outcome);
        return s;
    }
}
