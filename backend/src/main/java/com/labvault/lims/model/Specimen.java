package com.labvault.lims.model;

import jakarta.persistence.*;

/**
 * Specimen record as seen by sequencing ingestion. specimen_number is the WUID that
 * facility sample names embed.
 */
@Entity
@Table(name = "specimens")
public class Specimen {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "specimen_number", unique = true)
    private Integer specimenNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id", foreignKey = @ForeignKey(name = "fk_specimens_project"))
    private Project project;

    @Column(name = "tube_id")
    private String tubeId;

    public Specimen() {}

    public Specimen(Integer specimenNumber, Project project, String tubeId) {
        this.specimenNumber = specimenNumber;
        this.project = project;
        this.tubeId = tubeId;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getSpecimenNumber() { return specimenNumber; }
    public void setSpecimenNumber(Integer specimenNumber) { this.specimenNumber = specimenNumber; }
    public Project getProject() { return project; }
    public void setProject(Project project) { this.project = project; }
    public String getTubeId() { return tubeId; }
    public void setTubeId(String tubeId) { this.tubeId = tubeId; }
}
