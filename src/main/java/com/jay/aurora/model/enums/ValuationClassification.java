package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValuationClassification {
    CHEAP("cheap"),
    FAIR("fair"),
    RICH("rich"),
    UNKNOWN("unknown");

    private final String label;

    ValuationClassification(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
