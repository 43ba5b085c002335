package com.labvault.lims.dto;

import java.time.LocalDateTime;

public class RunMetadata {
    private String serviceRequestNumber;
    private String flowcellId;
    private String poolName;
    private LocalDateTime completionDate;
    private String sequencerType;
    private String baseDirectory;
    private String filePatternR1;
    private String filePatternR2;

    public RunMetadata() {}

    public RunMetadata(String serviceRequestNumber, String flowcellId, String baseDirectory) {
        this.serviceRequestNumber = serviceRequestNumber;
        this.flowcellId = flowcellId;
        this.baseDirectory = baseDirectory;
    }

    public String getServiceRequestNumber() { return serviceRequestNumber; }
    public void setServiceRequestNumber(String serviceRequestNumber) { this.serviceRequestNumber = serviceRequestNumber; }
    public String getFlowcellId() { return flowcellId; }
    public void setFlowcellId(String flowcellId) { this.flowcellId = flowcellId; }
    public String getPoolName() { return poolName; }
    public void setPoolName(String poolName) { this.poolName = poolName; }
    public LocalDateTime getCompletionDate() { return completionDate; }
    public void setCompletionDate(LocalDateTime completionDate) { this.completionDate = completionDate; }
    public String getSequencerType() { return sequencerType; }
    public void setSequencerType(String sequencerType) { this.sequencerType = sequencerType; }
    public String getBaseDirectory() { return baseDirectory; }
    public void setBaseDirectory(String baseDirectory) { this.baseDirectory = baseDirectory; }
    public String getFilePatternR1() { return filePatternR1; }
    public void setFilePatternR1(String filePatternR1) { this.filePatternR1 = filePatternR1; }
    public String getFilePatternR2() { return filePatternR2; }
    public void setFilePatternR2(String filePatternR2) { this.filePatternR2 = filePatternR2; }
}
