package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which growth rate fed the PEG ratio. EPS growth is preferred when both are present. */
public enum GrowthSource {
    EPS("eps"),
    REVENUE("revenue");

    private final String label;

    GrowthSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
