package com.labvault.lims.exception;

/**
 * Inserting a new run hit a unique constraint, i.e. another import registered the same
 * facility batch first. The batch transaction is rolled back; retrying finds the other run.
 */
public class RunRegistrationConflictException extends RuntimeException {
    public RunRegistrationConflictException(String serviceRequestNumber, String flowcellId, Throwable cause) {
        super("Sequencing run for service request " + serviceRequestNumber + " / flowcell " + flowcellId
                + " was registered concurrently", cause);
    }
}
