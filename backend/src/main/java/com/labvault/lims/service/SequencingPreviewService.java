package com.labvault.lims.service;

import com.labvault.lims.dto.SequencingPreviewDTO;
import com.labvault.lims.dto.SequencingRowInput;
import com.labvault.lims.util.CompletionDateParser;
import com.labvault.lims.util.WuidExtractor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Summarises a parsed sheet before import. Nothing is written.
 */
@Service
public class SequencingPreviewService {

    static final int MIN_PLAUSIBLE_YEAR = 2000;
    static final int MAX_PLAUSIBLE_YEAR = 2050;

    private final int previewRows;

    public SequencingPreviewService(@Value("${lims.sequencing.preview-rows:5}") int previewRows) {
        this.previewRows = previewRows <= 0 ? 5 : previewRows;
    }

    public SequencingPreviewDTO preview(List<SequencingRowInput> rows) {
        if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("No data found in file");

        SequencingPreviewDTO dto = new SequencingPreviewDTO();
        List<String> warnings = new ArrayList<>();

        String rawDate = rows.get(0) != null ? rows.get(0).getDateComplete() : null;
        LocalDateTime completion = CompletionDateParser.parse(rawDate);
        if (completion != null) {
            int year = completion.getYear();
            if (year < MIN_PLAUSIBLE_YEAR || year > MAX_PLAUSIBLE_YEAR) {
                warnings.add("Date looks suspicious: " + completion.format(DateTimeFormatter.ISO_LOCAL_DATE));
            }
        } else if (rawDate != null && !rawDate.isBlank()) {
            warnings.add("Could not parse completion date from file");
        }
        dto.setCompletionDate(completion);

        int withWuid = 0;
        List<SequencingPreviewDTO.SamplePreview> previews = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            SequencingRowInput row = rows.get(i);
            String name = row != null ? row.getFacilitySampleName() : null;
            Integer wuid = WuidExtractor.extract(name);
            if (wuid != null) withWuid++;
            if (i < previewRows) {
                previews.add(new SequencingPreviewDTO.SamplePreview(i + 1, name, wuid, wuid != null,
                        row != null ? row.getLibraryType() : null));
            }
        }

        if (withWuid < rows.size()) {
            warnings.add((rows.size() - withWuid) + " samples may not link to specimens (no WUID found)");
        }

        dto.setTotalSamples(rows.size());
        dto.setSamplesWithWuid(withWuid);
        dto.setSamplePreviews(previews);
        dto.setWarnings(warnings);
        return dto;
    }
}
