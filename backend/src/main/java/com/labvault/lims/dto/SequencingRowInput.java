package com.labvault.lims.dto;

/**
 * One parsed row of a facility sheet. Numeric columns stay as text because facilities
 * send thousands separators ("1,613,040") and placeholders ("as needed").
 */
public class SequencingRowInput {
    private String facilitySampleName;
    private String libraryId;
    private String espId;
    private String indexSequence;
    private String flowcellLane;
    private String species;
    private String libraryType;
    private String sampleType;
    private String totalReads;
    private String totalBases;
    private String pctQ30R1;
    private String pctQ30R2;
    private String avgQScoreR1;
    private String avgQScoreR2;
    private String phixErrorRateR1;
    private String phixErrorRateR2;
    private String pctPassFilterR1;
    private String pctPassFilterR2;
    private String dateComplete;

    public SequencingRowInput() {}

    public SequencingRowInput(String facilitySampleName) {
        this.facilitySampleName = facilitySampleName;
    }

    public String getFacilitySampleName() { return facilitySampleName; }
    public void setFacilitySampleName(String facilitySampleName) { this.facilitySampleName = facilitySampleName; }
    public String getLibraryId() { return libraryId; }
    public void setLibraryId(String libraryId) { this.libraryId = libraryId; }
    public String getEspId() { return espId; }
    public void setEspId(String espId) { this.espId = espId; }
    public String getIndexSequence() { return indexSequence; }
    public void setIndexSequence(String indexSequence) { this.indexSequence = indexSequence; }
    public String getFlowcellLane() { return flowcellLane; }
    public void setFlowcellLane(String flowcellLane) { this.flowcellLane = flowcellLane; }
    public String getSpecies() { return species; }
    public void setSpecies(String species) { this.species = species; }
    public String getLibraryType() { return libraryType; }
    public void setLibraryType(String libraryType) { this.libraryType = libraryType; }
    public String getSampleType() { return sampleType; }
    public void setSampleType(String sampleType) { this.sampleType = sampleType; }
    public String getTotalReads() { return totalReads; }
    public void setTotalReads(String totalReads) { this.totalReads = totalReads; }
    public String getTotalBases() { return totalBases; }
    public void setTotalBases(String totalBases) { this.totalBases = totalBases; }
    public String getPctQ30R1() { return pctQ30R1; }
    public void setPctQ30R1(String pctQ30R1) { this.pctQ30R1 = pctQ30R1; }
    public String getPctQ30R2() { return pctQ30R2; }
    public void setPctQ30R2(String pctQ30R2) { this.pctQ30R2 = pctQ30R2; }
    public String getAvgQScoreR1() { return avgQScoreR1; }
    public void setAvgQScoreR1(String avgQScoreR1) { this.avgQScoreR1 = avgQScoreR1; }
    public String getAvgQScoreR2() { return avgQScoreR2; }
    public void setAvgQScoreR2(String avgQScoreR2) { this.avgQScoreR2 = avgQScoreR2; }
    public String getPhixErrorRateR1() { return phixErrorRateR1; }
    public void setPhixErrorRateR1(String phixErrorRateR1) { this.phixErrorRateR1 = phixErrorRateR1; }
    public String getPhixErrorRateR2() { return phixErrorRateR2; }
    public void setPhixErrorRateR2(String phixErrorRateR2) { this.phixErrorRateR2 = phixErrorRateR2; }
    public String getPctPassFilterR1() { return pctPassFilterR1; }
    public void setPctPassFilterR1(String pctPassFilterR1) { this.pctPassFilterR1 = pctPassFilterR1; }
    public String getPctPassFilterR2() { return pctPassFilterR2; }
    public void setPctPassFilterR2(String pctPassFilterR2) { this.pctPassFilterR2 = pctPassFilterR2; }
    public String getDateComplete() { return dateComplete; }
    public void setDateComplete(String dateComplete) { this.dateComplete = dateComplete; }
}
