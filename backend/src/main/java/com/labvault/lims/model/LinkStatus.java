package com.labvault.lims.model;

import java.util.Arrays;

public enum LinkStatus {
    LINKED("linked"),
    NO_MATCH("no_match"),
    FAILED("failed");

    private final String code;

    LinkStatus(String code) {
        this.code = code;
    }

    /** Value stored in sequencing_samples.link_status and exposed over the API. */
    public String getCode() { return code; }

    public static LinkStatus fromCode(String code) {
        if (code == null) return null;
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(code.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown link status: " + code));
    }
}
