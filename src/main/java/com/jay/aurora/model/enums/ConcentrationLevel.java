package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConcentrationLevel {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    private final String label;

    ConcentrationLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
