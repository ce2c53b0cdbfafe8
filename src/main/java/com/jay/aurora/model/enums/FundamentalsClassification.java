package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FundamentalsClassification {
    STRONG("strong"),
    OK("ok"),
    WEAK("weak"),
    UNKNOWN("unknown");

    private final String label;

    FundamentalsClassification(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
