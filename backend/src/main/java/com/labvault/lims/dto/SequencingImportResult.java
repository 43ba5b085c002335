package com.labvault.lims.dto;

import com.labvault.lims.model.LinkOutcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one committed batch. successCount counts persisted sample rows;
 * failedCount counts rows listed in errors (no WUID, or specimen lookup failure).
 */
public class SequencingImportResult {
    private final Long runId;
    private final Integer runNumber;
    private int successCount;
    private int linkedCount;
    private int noMatchCount;
    private int failedCount;
    private final List<ImportRowError> errors = new ArrayList<>();

    public SequencingImportResult(Long runId, Integer runNumber) {
        this.runId = runId;
        this.runNumber = runNumber;
    }

    public void recordExtractionFailure(int rowIndex, String facilitySampleName, String error) {
        failedCount++;
        errors.add(new ImportRowError(rowIndex, facilitySampleName, error));
    }

    public void recordPersisted(int rowIndex, String facilitySampleName, LinkOutcome outcome) {
        successCount++;
        if (outcome instanceof LinkOutcome.Linked) {
            linkedCount++;
        } else if (outcome instanceof LinkOutcome.NoMatch) {
            noMatchCount++;
        } else if (outcome instanceof LinkOutcome.Failed failed) {
            failedCount++;
            errors.add(new ImportRowError(rowIndex, facilitySampleName, failed.error()));
        }
    }

    public Long getRunId() { return runId; }
    public Integer getRunNumber() { return runNumber; }
    public int getSuccessCount() { return successCount; }
    public int getLinkedCount() { return linkedCount; }
    public int getNoMatchCount() { return noMatchCount; }
    public int getFailedCount() { return failedCount; }
    public List<ImportRowError> getErrors() { return Collections.unmodifiableList(errors); }
}
