package com.labvault.lims.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Defaults applied to run metadata that the facility sheet or the caller leaves out.
 */
@Component
public class SequencingDefaults {
    public static final String SEQUENCER_TYPE = "NovaSeq";
    public static final String FILE_PATTERN_R1 = "_R1.fastq.gz";
    public static final String FILE_PATTERN_R2 = "_R2.fastq.gz";

    private final String sequencerType;
    private final String filePatternR1;
    private final String filePatternR2;

    public SequencingDefaults(@Value("${lims.sequencing.default-sequencer-type:" + SEQUENCER_TYPE + "}") String sequencerType,
                              @Value("${lims.sequencing.default-file-pattern-r1:" + FILE_PATTERN_R1 + "}") String filePatternR1,
                              @Value("${lims.sequencing.default-file-pattern-r2:" + FILE_PATTERN_R2 + "}") String filePatternR2) {
        this.sequencerType = sequencerType;
        this.filePatternR1 = filePatternR1;
        this.filePatternR2 = filePatternR2;
    }

    public static SequencingDefaults standard() {
        return new SequencingDefaults(SEQUENCER_TYPE, FILE_PATTERN_R1, FILE_PATTERN_R2);
    }

    public String getSequencerType() { return sequencerType; }
    public String getFilePatternR1() { return filePatternR1; }
    public String getFilePatternR2() { return filePatternR2; }
}
