package com.labvault.lims.model;

import jakarta.persistence.*;
import java.time.LocalDateTime;

@Entity
@Table(name = "sequencing_runs", uniqueConstraints = {
        @UniqueConstraint(name = "uk_sequencing_runs_run_number", columnNames = "run_number"),
        @UniqueConstraint(name = "uk_sequencing_runs_service_request", columnNames = "service_request_number"),
        @UniqueConstraint(name = "uk_sequencing_runs_flowcell", columnNames = "flowcell_id")
})
public class SequencingRun {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_number", nullable = false)
    private Integer runNumber;

    @Column(name = "service_request_number")
    private String serviceRequestNumber;

    @Column(name = "flowcell_id")
    private String flowcellId;

    @Column(name = "pool_name")
    private String poolName;

    @Column(name = "sequencer_type", length = 100, nullable = false)
    private String sequencerType;

    @Column(name = "completion_date")
    private LocalDateTime completionDate;

    @Column(name = "base_directory", length = 1000)
    private String baseDirectory;

    @Column(name = "file_pattern_r1", nullable = false)
    private String filePatternR1;

    @Column(name = "file_pattern_r2", nullable = false)
    private String filePatternR2;

    @Column(name = "created_by", length = 100)
    private String createdBy; // user or system that registered the run

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    /** Service request number when present, otherwise the flowcell id; prefixes FASTQ file names. */
    public String getRunIdentifier() {
        if (serviceRequestNumber != null && !serviceRequestNumber.isBlank()) return serviceRequestNumber;
        return flowcellId;
    }

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
}
