package com.labvault.lims.model;

import jakarta.persistence.*;

@Entity
@Table(name = "collaborators")
public class Collaborator {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "collaborator_number", unique = true)
    private Integer collaboratorNumber;

    @Column(name = "pi_name", nullable = false)
    private String piName;

    @Column(name = "pi_institute")
    private String piInstitute;

    public Collaborator() {}

    public Collaborator(Integer collaboratorNumber, String piName, String piInstitute) {
        this.collaboratorNumber = collaboratorNumber;
        this.piName = piName;
        this.piInstitute = piInstitute;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getCollaboratorNumber() { return collaboratorNumber; }
    public void setCollaboratorNumber(Integer collaboratorNumber) { this.collaboratorNumber = collaboratorNumber; }
    public String getPiName() { return piName; }
    public void setPiName(String piName) { this.piName = piName; }
    public String getPiInstitute() { return piInstitute; }
    public void setPiInstitute(String piInstitute) { this.piInstitute = piInstitute; }
}
