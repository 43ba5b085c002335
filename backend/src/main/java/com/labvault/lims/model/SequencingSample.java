package com.labvault.lims.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "sequencing_samples", indexes = {
        @Index(name = "idx_sequencing_samples_run_id", columnList = "sequencing_run_id"),
        @Index(name = "idx_sequencing_samples_specimen_id", columnList = "specimen_id"),
        @Index(name = "idx_sequencing_samples_wuid", columnList = "wuid")
})
public class SequencingSample {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sequencing_run_id", nullable = false, foreignKey = @ForeignKey(name = "fk_sequencing_samples_run"))
    private SequencingRun sequencingRun;

    // Weak reference: specimens are owned elsewhere and may disappear
    @Column(name = "specimen_id")
    private Long specimenId;

    @Column(name = "facility_sample_name")
    private String facilitySampleName;

    @Column(name = "wuid")
    private Integer wuid;

    @Column(name = "library_id")
    private String libraryId;

    @Column(name = "esp_id")
    private String espId;

    @Column(name = "index_sequence", length = 100)
    private String indexSequence;

    @Column(name = "flowcell_lane")
    private Integer flowcellLane;

    @Column(name = "fastq_r1_path", length = 2000)
    private String fastqR1Path;

    @Column(name = "fastq_r2_path", length = 2000)
    private String fastqR2Path;

    private String species;

    @Column(name = "library_type")
    private String libraryType;

    @Column(name = "sample_type")
    private String sampleType;

    @Column(name = "total_reads")
    private Long totalReads;

    @Column(name = "total_bases")
    private Long totalBases;

    @Column(name = "pct_q30_r1", precision = 5, scale = 2)
    private BigDecimal pctQ30R1;

    @Column(name = "pct_q30_r2", precision = 5, scale = 2)
    private BigDecimal pctQ30R2;

    @Column(name = "avg_q_score_r1", precision = 5, scale = 2)
    private BigDecimal avgQScoreR1;

    @Column(name = "avg_q_score_r2", precision = 5, scale = 2)
    private BigDecimal avgQScoreR2;

    @Column(name = "phix_error_rate_r1", precision = 8, scale = 4)
    private BigDecimal phixErrorRateR1;

    @Column(name = "phix_error_rate_r2", precision = 8, scale = 4)
    private BigDecimal phixErrorRateR2;

    @Column(name = "pct_pass_filter_r1", precision = 5, scale = 2)
    private BigDecimal pctPassFilterR1;

    @Column(name = "pct_pass_filter_r2", precision = 5, scale = 2)
    private BigDecimal pctPassFilterR2;

    @Convert(converter = LinkStatusConverter.class)
    @Column(name = "link_status", length = 20, nullable = false)
    private LinkStatus linkStatus;

    @Column(name = "link_error", columnDefinition = "TEXT")
    private String linkError;

    @Column(name = "linked_at")
    private LocalDateTime linkedAt;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }

    /**
     * The only way to set the link columns; keeps status, specimen id, error and linked_at consistent.
     */
    public void applyLinkOutcome(LinkOutcome outcome) {
        if (outcome == null) throw new IllegalArgumentException("Link outcome is required");
        this.linkStatus = outcome.status();
        if (outcome instanceof LinkOutcome.Linked linked) {
            this.specimenId = linked.specimenId();
            this.linkedAt = linked.linkedAt();
            this.linkError = null;
        } else if (outcome instanceof LinkOutcome.NoMatch noMatch) {
            this.specimenId = null;
            this.linkedAt = null;
            this.linkError = noMatch.reason();
        } else if (outcome instanceof LinkOutcome.Failed failed) {
            this.specimenId = null;
            this.linkedAt = null;
            this.linkError = failed.error();
        } else {
            throw new IllegalArgumentException("Unsupported link outcome: " + outcome.getClass().getName());
        }
    }

    public LinkOutcome getLinkOutcome() {
        if (linkStatus == null) return null;
        return switch (linkStatus) {
            case LINKED -> new LinkOutcome.Linked(specimenId, linkedAt);
            case NO_MATCH -> new LinkOutcome.NoMatch(linkError != null ? linkError : "");
            case FAILED -> new LinkOutcome.Failed(linkError != null ? linkError : "");
        };
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public SequencingRun getSequencingRun() { return sequencingRun; }
    public void setSequencingRun(SequencingRun sequencingRun) { this.sequencingRun = sequencingRun; }
    public Long getSpecimenId() { return specimenId; }
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
    public LinkStatus getLinkStatus() { return linkStatus; }
    public String getLinkError() { return linkError; }
    public LocalDateTime getLinkedAt() { return linkedAt; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }
}
