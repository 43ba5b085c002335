package com.labvault.lims.service;

import com.labvault.lims.dto.SequencingRowInput;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * Reads a facility sample sheet (header row first) into row inputs. Each field accepts the
 * facility's column title or its snake_case name; the first non-blank match wins.
 */
@Component
public class SequencingSheetReader {

    private static final char BOM = '\uFEFF';

    private record ColumnMapping(String[] headers, BiConsumer<SequencingRowInput, String> setter) {}

    private static final List<ColumnMapping> MAPPINGS = List.of(
            map(SequencingRowInput::setFacilitySampleName, "Library Name", "facility_sample_name"),
            // the facility's library name doubles as the library id when present
            map(SequencingRowInput::setLibraryId, "Library Name", "Library ID", "library_id"),
            map(SequencingRowInput::setEspId, "ESP ID", "esp_id"),
            map(SequencingRowInput::setIndexSequence, "Index Sequence", "index_sequence"),
            map(SequencingRowInput::setFlowcellLane, "Flowcell Lane", "flowcell_lane"),
            map(SequencingRowInput::setSpecies, "Species", "species"),
            map(SequencingRowInput::setLibraryType, "Library Type", "library_type"),
            map(SequencingRowInput::setSampleType, "Illumina Sample Type", "Sample Type", "sample_type"),
            map(SequencingRowInput::setTotalReads, "Total Reads", "total_reads"),
            map(SequencingRowInput::setTotalBases, "Total Bases", "total_bases"),
            map(SequencingRowInput::setPctQ30R1, "% >Q30 Read 1", "pct_q30_r1"),
            map(SequencingRowInput::setPctQ30R2, "% >Q30 Read 2", "pct_q30_r2"),
            map(SequencingRowInput::setAvgQScoreR1, "Avg Q Score Read 1", "avg_q_score_r1"),
            map(SequencingRowInput::setAvgQScoreR2, "Avg Q Score Read 2", "avg_q_score_r2"),
            map(SequencingRowInput::setPhixErrorRateR1, "PhiX Error Rate Read 1", "phix_error_rate_r1"),
            map(SequencingRowInput::setPhixErrorRateR2, "PhiX Error Rate Read 2", "phix_error_rate_r2"),
            map(SequencingRowInput::setPctPassFilterR1, "% Pass Filter Clusters Read 1", "pct_pass_filter_r1"),
            map(SequencingRowInput::setPctPassFilterR2, "% Pass Filter Clusters Read 2", "pct_pass_filter_r2"),
            map(SequencingRowInput::setDateComplete, "Date Complete", "date_complete")
    );

    public List<SequencingRowInput> read(InputStream in) throws IOException {
        List<SequencingRowInput> rows = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            skipBom(reader);
            CSVFormat fmt = CSVFormat.DEFAULT.builder()
                    .setHeader()
                    .setSkipHeaderRecord(true)
                    .setIgnoreEmptyLines(true)
                    .setTrim(true)
                    .build();
            try (CSVParser parser = new CSVParser(reader, fmt)) {
                for (CSVRecord rec : parser) {
                    SequencingRowInput row = new SequencingRowInput();
                    for (ColumnMapping m : MAPPINGS) {
                        String value = first(rec, m.headers());
                        if (value != null) m.setter().accept(row, value);
                    }
                    if (row.getLibraryId() == null) row.setLibraryId(row.getFacilitySampleName());
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    private static ColumnMapping map(BiConsumer<SequencingRowInput, String> setter, String... headers) {
        return new ColumnMapping(headers, setter);
    }

    private static String first(CSVRecord rec, String[] headers) {
        for (String h : headers) {
            if (!rec.isMapped(h) || !rec.isSet(h)) continue;
            String v = rec.get(h);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    private static void skipBom(BufferedReader reader) throws IOException {
        reader.mark(1);
        int c = reader.read();
        if (c != BOM) reader.reset();
    }
}
