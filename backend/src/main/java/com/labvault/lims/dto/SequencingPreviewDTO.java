package com.labvault.lims.dto;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class SequencingPreviewDTO {
    private int totalSamples;
    private int samplesWithWuid;
    private LocalDateTime completionDate;
    private List<SamplePreview> samplePreviews = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();

    public record SamplePreview(int row, String facilitySampleName, Integer wuid, boolean hasWuid, String libraryType) {}

    public int getTotalSamples() { return totalSamples; }
    public void setTotalSamples(int totalSamples) { this.totalSamples = totalSamples; }
    public int getSamplesWithWuid() { return samplesWithWuid; }
    public void setSamplesWithWuid(int samplesWithWuid) { this.samplesWithWuid = samplesWithWuid; }
    public LocalDateTime getCompletionDate() { return completionDate; }
    public void setCompletionDate(LocalDateTime completionDate) { this.completionDate = completionDate; }
    public List<SamplePreview> getSamplePreviews() { return samplePreviews; }
    public void setSamplePreviews(List<SamplePreview> samplePreviews) { this.samplePreviews = samplePreviews; }
    public List<String> getWarnings() { return warnings; }
    public void setWarnings(List<String> warnings) { this.warnings = warnings; }
}
