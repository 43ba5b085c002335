package com.labvault.lims.util;

/**
 * Pulls the WUID out of a facility sample name.
 * Example: "I13129_39552_Celiac_Leonard_Stool_01_GEMM_068_12M" -> 39552
 */
public final class WuidExtractor {

    private WuidExtractor() {}

    /**
     * @return the integer in the second underscore-delimited token, or null when the name is empty,
     * has a single token, or the token is not a positive integer
     */
    public static Integer extract(String facilitySampleName) {
        if (facilitySampleName == null || facilitySampleName.isBlank()) return null;
        String[] parts = facilitySampleName.trim().split("_", -1);
        if (parts.length < 2) return null;
        String token = parts[1].trim();
        if (token.isEmpty()) return null;
        try {
            int wuid = Integer.parseInt(token);
            return wuid > 0 ? wuid : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
