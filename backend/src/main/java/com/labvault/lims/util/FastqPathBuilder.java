package com.labvault.lims.util;

/**
 * Builds FASTQ locations as {base_directory}/{run_identifier}_{library_name}{pattern}.
 * String construction only; the files are not checked.
 */
public final class FastqPathBuilder {

    private FastqPathBuilder() {}

    public static String build(String baseDirectory, String runIdentifier, String libraryName, String pattern) {
        if (isBlank(baseDirectory) || isBlank(libraryName)) return null;

        String base = baseDirectory.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        String suffix = pattern == null ? "" : pattern.trim();
        String library = libraryName.trim();

        if (isBlank(runIdentifier)) {
            return base + "/" + library + suffix;
        }
        return base + "/" + runIdentifier.trim() + "_" + library + suffix;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
