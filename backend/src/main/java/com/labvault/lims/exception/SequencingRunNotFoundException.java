package com.labvault.lims.exception;

public class SequencingRunNotFoundException extends RuntimeException {
    private final Long runId;

    public SequencingRunNotFoundException(Long runId) {
        super("Sequencing run not found: " + runId);
        this.runId = runId;
    }

    public Long getRunId() { return runId; }
}
