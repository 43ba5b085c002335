package com.labvault.lims.exception;

/**
 * The service request number and the flowcell id of an import point at two different
 * registered runs, so the batch cannot be attached to either of them.
 */
public class AmbiguousSequencingRunException extends RuntimeException {
    private final String serviceRequestNumber;
    private final String flowcellId;

    public AmbiguousSequencingRunException(String serviceRequestNumber, Integer serviceRequestRunNumber,
                                           String flowcellId, Integer flowcellRunNumber) {
        super(String.format("Service request %s belongs to run #%d but flowcell %s belongs to run #%d",
                serviceRequestNumber, serviceRequestRunNumber, flowcellId, flowcellRunNumber));
        this.serviceRequestNumber = serviceRequestNumber;
        this.flowcellId = flowcellId;
    }

    public String getServiceRequestNumber() { return serviceRequestNumber; }
    public String getFlowcellId() { return flowcellId; }
}
