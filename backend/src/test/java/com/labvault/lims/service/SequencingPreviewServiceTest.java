package com.labvault.lims.service;

import com.labvault.lims.dto.SequencingPreviewDTO;
import com.labvault.lims.dto.SequencingRowInput;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequencingPreviewServiceTest {

    private final SequencingPreviewService service = new SequencingPreviewService(5);

    private static SequencingRowInput row(String name, String date) {
        SequencingRowInput r = new SequencingRowInput(name);
        r.setDateComplete(date);
        r.setLibraryType("WGS");
        return r;
    }

    @Test
    void countsWuidsAndPreviewsFirstRows() {
        List<SequencingRowInput> rows = new ArrayList<>();
        rows.add(row("X_1_a", "2024-03-15"));
        for (int i = 2; i <= 6; i++) rows.add(row("X_" + i + "_a", null));
        rows.add(row("NoWuid", null));

        SequencingPreviewDTO dto = service.preview(rows);

        assertThat(dto.getTotalSamples()).isEqualTo(7);
        assertThat(dto.getSamplesWithWuid()).isEqualTo(6);
        assertThat(dto.getCompletionDate()).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(dto.getSamplePreviews()).hasSize(5);
        assertThat(dto.getSamplePreviews().get(0).row()).isEqualTo(1);
        assertThat(dto.getSamplePreviews().get(0).wuid()).isEqualTo(1);
        assertThat(dto.getSamplePreviews().get(0).hasWuid()).isTrue();
        assertThat(dto.getSamplePreviews().get(0).libraryType()).isEqualTo("WGS");
        assertThat(dto.getWarnings()).containsExactly("1 samples may not link to specimens (no WUID found)");
    }

    @Test
    void suspiciousAndUnparseableDatesWarn() {
        assertThat(service.preview(List.of(row("X_1_a", "1/1/1990"))).getWarnings())
                .singleElement().asString().startsWith("Date looks suspicious");
        SequencingPreviewDTO unparsed = service.preview(List.of(row("X_1_a", "someday")));
        assertThat(unparsed.getCompletionDate()).isNull();
        assertThat(unparsed.getWarnings()).containsExactly("Could not parse completion date from file");
    }

    @Test
    void outOfRangeSerialDateWarnsInsteadOfFailing() {
        SequencingPreviewDTO dto = service.preview(List.of(row("X_1_a", "99999999999999")));
        assertThat(dto.getCompletionDate()).isNull();
        assertThat(dto.getWarnings()).containsExactly("Could not parse completion date from file");
    }

    @Test
    void emptySheetIsRejected() {
        assertThatThrownBy(() -> service.preview(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
