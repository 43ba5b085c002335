package com.labvault.lims.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WuidExtractorTest {

    @Test
    void secondTokenIsTheWuid() {
        assertThat(WuidExtractor.extract("I13129_39552_Celiac_Leonard_Stool_01_GEMM_068_12M")).isEqualTo(39552);
        assertThat(WuidExtractor.extract("X_101")).isEqualTo(101);
    }

    @Test
    void missingOrNonNumericTokenGivesNull() {
        assertThat(WuidExtractor.extract(null)).isNull();
        assertThat(WuidExtractor.extract("")).isNull();
        assertThat(WuidExtractor.extract("   ")).isNull();
        assertThat(WuidExtractor.extract("NoUnderscoresHere")).isNull();
        assertThat(WuidExtractor.extract("I1_abc_X")).isNull();
        assertThat(WuidExtractor.extract("I1__X")).isNull();
        assertThat(WuidExtractor.extract("I1_12.5_X")).isNull();
    }

    @Test
    void zeroAndNegativeAreNotWuids() {
        assertThat(WuidExtractor.extract("X_0_a")).isNull();
        assertThat(WuidExtractor.extract("X_000_a")).isNull();
        assertThat(WuidExtractor.extract("X_-7_a")).isNull();
    }

    @Test
    void surroundingWhitespaceIsIgnored() {
        assertThat(WuidExtractor.extract("  I1_ 42 _X ")).isEqualTo(42);
    }
}
