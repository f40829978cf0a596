package com.example.filingcontacts.service.contact;

import java.util.Arrays;

/**
 * How two contacts are judged to be the same party.
 */
public enum DedupMode {
    STRICT("strict"),
    NAME_ONLY("name-only"),
    NAME_COMPANY("name-company"),
    FUZZY("fuzzy");

    private final String label;

    DedupMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static DedupMode fromLabel(String label) {
        return Arrays.stream(values())
                .filter(m -> m.label.equalsIgnoreCase(label) || m.name().equalsIgnoreCase(label))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown dedup mode: " + label));
    }
}
