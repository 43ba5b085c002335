package com.labvault.lims.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A sequencing sample row plus display fields from the joined specimen/project/collaborator
 * (run listing) or from the owning run (specimen listing). Joined fields are null when absent.
 */
public class SequencingSampleViewDTO {
    private Long id;
    private Long sequencingRunId;
    private Long specimenId;
    private String facilitySampleName;
    private Integer wuid;
    private String libraryId;
    private String espId;
    private String indexSequence;
    private Integer flowcellLane;
    private String fastqR1Path;
    private String fastqR2Path;
    private String species;
    private String libraryType;
    private String sampleType;
    private Long totalReads;
    private Long totalBases;
    private BigDecimal pctQ30R1;
    private BigDecimal pctQ30R2;
    private BigDecimal avgQScoreR1;
    private BigDecimal avgQScoreR2;
    private BigDecimal phixErrorRateR1;
    private BigDecimal phixErrorRateR2;
    private BigDecimal pctPassFilterR1;
    private BigDecimal pctPassFilterR2;
    private String linkStatus;
    private String linkError;
    private LocalDateTime linkedAt;
    private LocalDateTime createdAt;

    // specimen side
    private Integer specimenNumber;
    private String tubeId;
    private Integer projectNumber;
    private String piName;

    // run side
    private Integer runNumber;
    private String serviceRequestNumber;
    private LocalDateTime completionDate;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Long getSequencingRunId() { return sequencingRunId; }
    public void setSequencingRunId(Long sequencingRunId) { this.sequencingRunId = sequencingRunId; }
    public Long getSpecimenId() { return specimenId; }
    public void setSpecimenId(Long specimenId) { this.specimenId = specimenId; }
    public String getFacilitySampleName() { return facilitySampleName; }
    public void setFacilitySampleName(String facilitySampleName) { this.facilitySampleName = facilitySampleName; }
    public Integer getWuid() { return wuid; }
    public void setWuid(Integer wuid) { this.wuid = wuid; }
    public String getLibraryId() { return libraryId; }
    public void setLibraryId(String libraryId) { this.libraryId = libraryId; }
    public String getEspId() { return espId; }
    public void setEspId(String espId) { this.espId = espId; }
    public String getIndexSequence() { return indexSequence; }
    public void setIndexSequence(String indexSequence) { this.indexSequence = indexSequence; }
    public Integer getFlowcellLane() { return flowcellLane; }
    public void setFlowcellLane(Integer flowcellLane) { this.flowcellLane = flowcellLane; }
    public String getFastqR1Path() { return fastqR1Path; }
    public void setFastqR1Path(String fastqR1Path) { this.fastqR1Path = fastqR1Path; }
    public String getFastqR2Path() { return fastqR2Path; }
    public void setFastqR2Path(String fastqR2Path) { this.fastqR2Path = fastqR2Path; }
    public String getSpecies() { return species; }
    public void setSpecies(String species) { this.species = species; }
    public String getLibraryType() { return libraryType; }
    public void setLibraryType(String libraryType) { this.libraryType = libraryType; }
    public String getSampleType() { return sampleType; }
    public void setSampleType(String sampleType) { this.sampleType = sampleType; }
    public Long getTotalReads() { return totalReads; }
    public void setTotalReads(Long totalReads) { this.totalReads = totalReads; }
    public Long getTotalBases() { return totalBases; }
    public void setTotalBases(Long totalBases) { this.totalBases = totalBases; }
    public BigDecimal getPctQ30R1() { return pctQ30R1; }
    public void setPctQ30R1(BigDecimal pctQ30R1) { this.pctQ30R1 = pctQ30R1; }
    public BigDecimal getPctQ30R2() { return pctQ30R2; }
    public void setPctQ30R2(BigDecimal pctQ30R2) { this.pctQ30R2 = pctQ30R2; }
    public BigDecimal getAvgQScoreR1() { return avgQScoreR1; }
    public void setAvgQScoreR1(BigDecimal avgQScoreR1) { this.avgQScoreR1 = avgQScoreR1; }
    public BigDecimal getAvgQScoreR2() { return avgQScoreR2; }
    public void setAvgQScoreR2(BigDecimal avgQScoreR2) { this.avgQScoreR2 = avgQScoreR2; }
    public BigDecimal getPhixErrorRateR1() { return phixErrorRateR1; }
    public void setPhixErrorRateR1(BigDecimal phixErrorRateR1) { this.phixErrorRateR1 = phixErrorRateR1; }
    public BigDecimal getPhixErrorRateR2() { return phixErrorRateR2; }
    public void setPhixErrorRateR2(BigDecimal phixErrorRateR2) { this.phixErrorRateR2 = phixErrorRateR2; }
    public BigDecimal getPctPassFilterR1() { return pctPassFilterR1; }
    public void setPctPassFilterR1(BigDecimal pctPassFilterR1) { this.pctPassFilterR1 = pctPassFilterR1; }
    public BigDecimal getPctPassFilterR2() { return pctPassFilterR2; }
    public void setPctPassFilterR2(BigDecimal pctPassFilterR2) { this.pctPassFilterR2 = pctPassFilterR2; }
    public String getLinkStatus() { return linkStatus; }
    public void setLinkStatus(String linkStatus) { this.linkStatus = linkStatus; }
    public String getLinkError() { return linkError; }
    public void setLinkError(String linkError) { this.linkError = linkError; }
    public LocalDateTime getLinkedAt() { return linkedAt; }
    public void setLinkedAt(LocalDateTime linkedAt) { this.linkedAt = linkedAt; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
    public Integer getSpecimenNumber() { return specimenNumber; }
    public void setSpecimenNumber(Integer specimenNumber) { this.specimenNumber = specimenNumber; }
    public String getTubeId() { return tubeId; }
    public void setTubeId(String tubeId) { this.tubeId = tubeId; }
    public Integer getProjectNumber() { return projectNumber; }
    public void setProjectNumber(Integer projectNumber) { this.projectNumber = projectNumber; }
    public String getPiName() { return piName; }
    public void setPiName(String piName) { this.piName = piName; }
    public Integer getRunNumber() { return runNumber; }
    public void setRunNumber(Integer runNumber) { this.runNumber = runNumber; }
    public String getServiceRequestNumber() { return serviceRequestNumber; }
    public void setServiceRequestNumber(String serviceRequestNumber) { this.serviceRequestNumber = serviceRequestNumber; }
    public LocalDateTime getCompletionDate() { return completionDate; }
    public void setCompletionDate(LocalDateTime completionDate) { this.completionDate = completionDate; }
}
