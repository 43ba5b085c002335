package com.labvault.lims.util;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Parses facility numbers such as "1,613,040". Anything that is absent or not a number
 * ("", "as needed", "N/A") comes back as null, never zero.
 */
public final class NumericNormalizer {

    private NumericNormalizer() {}

    public static BigDecimal normalize(Object value) {
        if (value == null) return null;
        if (value instanceof BigDecimal bd) return bd;
        if (value instanceof BigInteger bi) return new BigDecimal(bi);
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) return null;
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number n) return BigDecimal.valueOf(n.longValue());

        String cleaned = value.toString().replace(",", "").trim();
        if (cleaned.isEmpty()) return null;
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Whole-number view; null when absent, fractional or outside the long range. */
    public static Long toLong(Object value) {
        BigDecimal bd = normalize(value);
        if (bd == null) return null;
        try {
            return bd.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }

    public static Integer toInteger(Object value) {
        BigDecimal bd = normalize(value);
        if (bd == null) return null;
        try {
            return bd.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            return null;
        }
    }
}
