package com.labvault.lims.util;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reads the "Date Complete" cell of a facility sheet: ISO dates and date-times, US style
 * month/day/year, or an Excel serial day number (days since 1899-12-30).
 */
public final class CompletionDateParser {

    private static final LocalDate EXCEL_EPOCH = LocalDate.of(1899, 12, 30);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy"),
            DateTimeFormatter.ofPattern("M/d/yy")
    );

    private CompletionDateParser() {}

    public static LocalDateTime parse(Object value) {
        if (value == null) return null;
        if (value instanceof LocalDateTime ldt) return ldt;
        if (value instanceof LocalDate ld) return ld.atStartOfDay();
        if (value instanceof Number n) return fromExcelSerial(n.doubleValue());

        String s = value.toString().trim();
        if (s.isEmpty()) return null;
        if (s.matches("^\\d+(\\.\\d+)?$")) {
            return fromExcelSerial(Double.parseDouble(s));
        }
        LocalDateTime parsed = attempt(() -> LocalDateTime.parse(s));
        if (parsed == null) parsed = attempt(() -> OffsetDateTime.parse(s).toLocalDateTime());
        for (DateTimeFormatter f : DATE_FORMATS) {
            if (parsed != null) break;
            parsed = attempt(() -> LocalDate.parse(s, f).atStartOfDay());
        }
        return parsed;
    }

    private static LocalDateTime attempt(Supplier<LocalDateTime> parser) {
        try {
            return parser.get();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static LocalDateTime fromExcelSerial(double serial) {
        if (serial <= 0 || Double.isNaN(serial) || Double.isInfinite(serial)) return null;
        long days = (long) Math.floor(serial);
        long seconds = Math.round((serial - days) * 24 * 60 * 60);
        try {
            return EXCEL_EPOCH.plusDays(days).atStartOfDay().plusSeconds(seconds);
        } catch (DateTimeException e) {
            // beyond the supported year range
            return null;
        }
    }
}
