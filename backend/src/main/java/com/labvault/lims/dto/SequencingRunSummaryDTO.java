package com.labvault.lims.dto;

import java.time.LocalDateTime;

public class SequencingRunSummaryDTO {
    private Long id;
    private Integer runNumber;
    private String serviceRequestNumber;
    private String flowcellId;
    private String poolName;
    private String sequencerType;
    private LocalDateTime completionDate;
    private String baseDirectory;
    private String filePatternR1;
    private String filePatternR2;
    private String createdBy;
    private LocalDateTime createdAt;
    private long sampleCount;
    private long linkedCount;
    private long noMatchCount;
    private long failedCount;

    public SequencingRunSummaryDTO() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getRunNumber() { return runNumber; }
    public void setRunNumber(Integer runNumber) { this.runNumber = runNumber; }
    public String getServiceRequestNumber() { return serviceRequestNumber; }
    public void setServiceRequestNumber(String serviceRequestNumber) { this.serviceRequestNumber = serviceRequestNumber; }
    public String getFlowcellId() { return flowcellId; }
    public void setFlowcellId(String flowcellId) { this.flowcellId = flowcellId; }
    public String getPoolName() { return poolName; }
    public void setPoolName(String poolName) { this.poolName = poolName; }
    public String getSequencerType() { return sequencerType; }
    public void setSequencerType(String sequencerType) { this.sequencerType = sequencerType; }
    public LocalDateTime getCompletionDate() { return completionDate; }
    public void setCompletionDate(LocalDateTime completionDate) { this.completionDate = completionDate; }
    public String getBaseDirectory() { return baseDirectory; }
    public void setBaseDirectory(String baseDirectory) { this.baseDirectory = baseDirectory; }
    public String getFilePatternR1() { return filePatternR1; }
    public void setFilePatternR1(String filePatternR1) { this.filePatternR1 = filePatternR1; }
    public String getFilePatternR2() { return filePatternR2; }
    public void setFilePatternR2(String filePatternR2) { this.filePatternR2 = filePatternR2; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public long getSampleCount() { return sampleCount; }
    public void setSampleCount(long sampleCount) { this.sampleCount = sampleCount; }
    public long getLinkedCount() { return linkedCount; }
    public void setLinkedCount(long linkedCount) { this.linkedCount = linkedCount; }
    public long getNoMatchCount() { return noMatchCount; }
    public void setNoMatchCount(long noMatchCount) { this.noMatchCount = noMatchCount; }
    public long getFailedCount() { return failedCount; }
    public void setFailedCount(long failedCount) { this.failedCount = failedCount; }
}
