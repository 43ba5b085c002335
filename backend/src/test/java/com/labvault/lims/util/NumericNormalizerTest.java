package com.labvault.lims.util;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class NumericNormalizerTest {

    @Test
    void thousandsSeparatorsAreStripped() {
        assertThat(NumericNormalizer.normalize("1,613,040")).isEqualByComparingTo("1613040");
        assertThat(NumericNormalizer.toLong("1,613,040")).isEqualTo(1613040L);
        assertThat(NumericNormalizer.toLong("487,138,080")).isEqualTo(487138080L);
    }

    @Test
    void decimalsAreKept() {
        assertThat(NumericNormalizer.normalize("92.45")).isEqualByComparingTo("92.45");
        assertThat(NumericNormalizer.normalize(" 0.1234 ")).isEqualByComparingTo("0.1234");
    }

    @Test
    void absentOrTextualValuesBecomeNullNotZero() {
        assertThat(NumericNormalizer.normalize(null)).isNull();
        assertThat(NumericNormalizer.normalize("")).isNull();
        assertThat(NumericNormalizer.normalize("   ")).isNull();
        assertThat(NumericNormalizer.normalize("as needed")).isNull();
        assertThat(NumericNormalizer.normalize("N/A")).isNull();
        assertThat(NumericNormalizer.toLong("as needed")).isNull();
    }

    @Test
    void numericInputsPassThrough() {
        assertThat(NumericNormalizer.normalize(42)).isEqualByComparingTo(BigDecimal.valueOf(42));
        assertThat(NumericNormalizer.normalize(1.5d)).isEqualByComparingTo("1.5");
        assertThat(NumericNormalizer.normalize(Double.NaN)).isNull();
    }

    @Test
    void wholeNumberViewsRejectFractions() {
        assertThat(NumericNormalizer.toInteger("2")).isEqualTo(2);
        assertThat(NumericNormalizer.toInteger("2.0")).isEqualTo(2);
        assertThat(NumericNormalizer.toInteger("2.5")).isNull();
        assertThat(NumericNormalizer.toInteger("99999999999")).isNull();
    }
}
