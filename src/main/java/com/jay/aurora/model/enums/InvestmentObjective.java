package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum InvestmentObjective {
    GROWTH("growth"),
    INCOME("income"),
    BALANCED("balanced");

    private final String label;

    InvestmentObjective(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static InvestmentObjective fromLabel(String label) {
        for (InvestmentObjective value : values()) {
            if (value.label.equalsIgnoreCase(label) || value.name().equalsIgnoreCase(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown InvestmentObjective: " + label);
    }
}
