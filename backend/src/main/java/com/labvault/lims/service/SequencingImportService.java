package com.labvault.lims.service;

import com.labvault.lims.dto.RunMetadata;
import com.labvault.lims.dto.SequencingImportResult;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.exception.RunRegistrationConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for sequencing imports. A returned result means the batch committed (possibly with
 * unlinked or skipped rows); a thrown exception means nothing from the batch was persisted.
 */
@Service
public class SequencingImportService {
    private static final Logger log = LoggerFactory.getLogger(SequencingImportService.class);

    static final String SYSTEM_ACTOR = "system";

    private final SequencingBatchWriter batchWriter;
    private final int runConflictRetries;

    public SequencingImportService(SequencingBatchWriter batchWriter,
                                   @Value("${lims.sequencing.run-conflict-retries:1}") int runConflictRetries) {
        this.batchWriter = batchWriter;
        this.runConflictRetries = Math.max(0, runConflictRetries);
    }

    public SequencingImportResult importSequencingData(List<SequencingRowInput> rows, RunMetadata runMetadata, String actorId) {
        if (runMetadata == null) throw new IllegalArgumentException("Run metadata is required");
        List<SequencingRowInput> input = rows != null ? rows : List.of();
        String actor = (actorId == null || actorId.isBlank()) ? SYSTEM_ACTOR : actorId.trim();

        int attempt = 0;
        while (true) {
            try {
                SequencingImportResult result = batchWriter.write(input, runMetadata, actor);
                log.info("Sequencing import completed: run #{} rows={} success={} linked={} noMatch={} failed={}",
                        result.getRunNumber(), input.size(), result.getSuccessCount(), result.getLinkedCount(),
                        result.getNoMatchCount(), result.getFailedCount());
                return result;
            } catch (RunRegistrationConflictException ex) {
                if (attempt++ < runConflictRetries) {
                    log.warn("Run registration raced with another import, retrying batch (attempt {}): {}", attempt + 1, ex.getMessage());
                    continue;
                }
                log.error("Sequencing import failed, batch rolled back: {}", ex.getMessage());
                throw ex;
            } catch (RuntimeException ex) {
                log.error("Sequencing import failed, batch rolled back: {}", ex.getMessage());
                throw ex;
            }
        }
    }
}
