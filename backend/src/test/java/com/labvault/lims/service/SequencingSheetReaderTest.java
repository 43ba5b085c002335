package com.labvault.lims.service;

import com.labvault.lims.dto.SequencingRowInput;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequencingSheetReaderTest {

    private final SequencingSheetReader reader = new SequencingSheetReader();

    private List<SequencingRowInput> read(String csv) throws Exception {
        return reader.read(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void facilityHeadersAreMapped() throws Exception {
        String csv = "\uFEFFLibrary Name,ESP ID,Index Sequence,Flowcell Lane,Species,Library Type,Illumina Sample Type,Total Reads,% >Q30 Read 1,PhiX Error Rate Read 2,Date Complete\n" +
                "I13129_39552_Celiac,ESP-1,ACGT-TTGA,2,Human,WGS,DNA,\"1,613,040\",92.45,0.1234,3/15/2024\n";

        List<SequencingRowInput> rows = read(csv);

        assertThat(rows).hasSize(1);
        SequencingRowInput r = rows.get(0);
        assertThat(r.getFacilitySampleName()).isEqualTo("I13129_39552_Celiac");
        assertThat(r.getLibraryId()).isEqualTo("I13129_39552_Celiac");
        assertThat(r.getEspId()).isEqualTo("ESP-1");
        assertThat(r.getIndexSequence()).isEqualTo("ACGT-TTGA");
        assertThat(r.getFlowcellLane()).isEqualTo("2");
        assertThat(r.getSampleType()).isEqualTo("DNA");
        assertThat(r.getTotalReads()).isEqualTo("1,613,040");
        assertThat(r.getPctQ30R1()).isEqualTo("92.45");
        assertThat(r.getPhixErrorRateR2()).isEqualTo("0.1234");
        assertThat(r.getDateComplete()).isEqualTo("3/15/2024");
    }

    @Test
    void snakeCaseHeadersAndExplicitLibraryId() throws Exception {
        String csv = "facility_sample_name,library_id,sample_type,total_bases\n" +
                "X_101_a,LIB-9,RNA,42\n" +
                "\n" +
                "X_202_b,,RNA,\n";

        List<SequencingRowInput> rows = read(csv);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getLibraryId()).isEqualTo("LIB-9");
        assertThat(rows.get(0).getTotalBases()).isEqualTo("42");
        assertThat(rows.get(1).getLibraryId()).isEqualTo("X_202_b");
        assertThat(rows.get(1).getTotalBases()).isNull();
    }

    @Test
    void libraryNameWinsOverLibraryIdColumn() throws Exception {
        String csv = "Library Name,Library ID,Species\n" +
                "I13129_39552_Celiac,LIB-77,Human\n" +
                ",LIB-78,Human\n";

        List<SequencingRowInput> rows = read(csv);

        assertThat(rows.get(0).getLibraryId()).isEqualTo("I13129_39552_Celiac");
        assertThat(rows.get(1).getFacilitySampleName()).isNull();
        assertThat(rows.get(1).getLibraryId()).isEqualTo("LIB-78");
    }

    @Test
    void headerOnlySheetHasNoRows() throws Exception {
        assertThat(read("Library Name,Species\n")).isEmpty();
    }
}
