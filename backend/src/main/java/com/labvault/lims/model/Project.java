package com.labvault.lims.model;

import jakarta.persistence.*;

@Entity
@Table(name = "projects")
public class Project {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "project_number", unique = true)
    private Integer projectNumber;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "collaborator_id", foreignKey = @ForeignKey(name = "fk_projects_collaborator"))
    private Collaborator collaborator;

    private String disease;

    public Project() {}

    public Project(Integer projectNumber, Collaborator collaborator, String disease) {
        this.projectNumber = projectNumber;
        this.collaborator = collaborator;
        this.disease = disease;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getProjectNumber() { return projectNumber; }
    public void setProjectNumber(Integer projectNumber) { this.projectNumber = projectNumber; }
    public Collaborator getCollaborator() { return collaborator; }
    public void setCollaborator(Collaborator collaborator) { this.collaborator = collaborator; }
    public String getDisease() { return disease; }
    public void setDisease(String disease) { this.disease = disease; }
}
