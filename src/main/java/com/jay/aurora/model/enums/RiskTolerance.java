package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RiskTolerance {
    LOW("low"),
    MODERATE("moderate"),
    HIGH("high");

    private final String label;

    RiskTolerance(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static RiskTolerance fromLabel(String label) {
        for (RiskTolerance value : values()) {
            if (value.label.equalsIgnoreCase(label) || value.name().equalsIgnoreCase(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown RiskTolerance: " + label);
    }
}
