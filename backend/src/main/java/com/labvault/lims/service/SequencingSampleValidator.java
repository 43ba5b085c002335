package com.labvault.lims.service;

import com.labvault.lims.model.SequencingSample;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a built sample against the sequencing_samples column limits before it is inserted, so a
 * single oversized value is reported on its row instead of failing the batch transaction.
 */
@Component
public class SequencingSampleValidator {

    static final int TEXT_LENGTH = 255;
    static final int INDEX_SEQUENCE_LENGTH = 100;
    static final int PATH_LENGTH = 2000;

    public List<String> validate(SequencingSample s) {
        List<String> errors = new ArrayList<>();
        checkLength(errors, "facility_sample_name", s.getFacilitySampleName(), TEXT_LENGTH);
        checkLength(errors, "library_id", s.getLibraryId(), TEXT_LENGTH);
        checkLength(errors, "esp_id", s.getEspId(), TEXT_LENGTH);
        checkLength(errors, "index_sequence", s.getIndexSequence(), INDEX_SEQUENCE_LENGTH);
        checkLength(errors, "species", s.getSpecies(), TEXT_LENGTH);
        checkLength(errors, "library_type", s.getLibraryType(), TEXT_LENGTH);
        checkLength(errors, "sample_type", s.getSampleType(), TEXT_LENGTH);
        checkLength(errors, "fastq_r1_path", s.getFastqR1Path(), PATH_LENGTH);
        checkLength(errors, "fastq_r2_path", s.getFastqR2Path(), PATH_LENGTH);

        checkDecimal(errors, "pct_q30_r1", s.getPctQ30R1(), 5, 2);
        checkDecimal(errors, "pct_q30_r2", s.getPctQ30R2(), 5, 2);
        checkDecimal(errors, "avg_q_score_r1", s.getAvgQScoreR1(), 5, 2);
        checkDecimal(errors, "avg_q_score_r2", s.getAvgQScoreR2(), 5, 2);
        checkDecimal(errors, "pct_pass_filter_r1", s.getPctPassFilterR1(), 5, 2);
        checkDecimal(errors, "pct_pass_filter_r2", s.getPctPassFilterR2(), 5, 2);
        checkDecimal(errors, "phix_error_rate_r1", s.getPhixErrorRateR1(), 8, 4);
        checkDecimal(errors, "phix_error_rate_r2", s.getPhixErrorRateR2(), 8, 4);
        return errors;
    }

    private static void checkLength(List<String> errors, String column, String value, int max) {
        if (value != null && value.length() > max) {
            errors.add(column + " exceeds " + max + " characters");
        }
    }

    // Extra fraction digits are rounded by the store; only the integer part can overflow
    private static void checkDecimal(List<String> errors, String column, BigDecimal value, int precision, int scale) {
        if (value == null) return;
        BigDecimal rounded = value.setScale(scale, RoundingMode.HALF_UP);
        if (rounded.precision() - rounded.scale() > precision - scale) {
            errors.add(column + " value " + value.toPlainString() + " is out of range");
        }
    }
}
