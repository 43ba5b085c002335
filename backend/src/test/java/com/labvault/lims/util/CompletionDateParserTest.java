package com.labvault.lims.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionDateParserTest {

    @Test
    void isoDatesAndDateTimes() {
        assertThat(CompletionDateParser.parse("2024-03-15")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(CompletionDateParser.parse("2024-03-15T10:30:00")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30));
        assertThat(CompletionDateParser.parse("2024-03-15T10:30:00Z")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 30));
    }

    @Test
    void usStyleDates() {
        assertThat(CompletionDateParser.parse("3/15/2024")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(CompletionDateParser.parse("12/1/24")).isEqualTo(LocalDateTime.of(2024, 12, 1, 0, 0));
    }

    @Test
    void excelSerialDays() {
        assertThat(CompletionDateParser.parse("45366")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        assertThat(CompletionDateParser.parse(45366.5)).isEqualTo(LocalDateTime.of(2024, 3, 15, 12, 0));
    }

    @Test
    void serialPastTheCalendarRangeGivesNull() {
        assertThat(CompletionDateParser.parse("99999999999999")).isNull();
        assertThat(CompletionDateParser.parse(1.0e15)).isNull();
    }

    @Test
    void temporalValuesPassThrough() {
        assertThat(CompletionDateParser.parse(LocalDate.of(2024, 1, 2))).isEqualTo(LocalDateTime.of(2024, 1, 2, 0, 0));
    }

    @Test
    void garbageGivesNull() {
        assertThat(CompletionDateParser.parse(null)).isNull();
        assertThat(CompletionDateParser.parse("")).isNull();
        assertThat(CompletionDateParser.parse("next tuesday")).isNull();
    }
}
