package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Investment horizon in years, as selected in the investor profile. */
public enum InvestmentHorizon {
    SHORT("1-3"),
    MEDIUM("5-10"),
    LONG("10+");

    private final String label;

    InvestmentHorizon(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static InvestmentHorizon fromLabel(String label) {
        for (InvestmentHorizon value : values()) {
            if (value.label.equalsIgnoreCase(label) || value.name().equalsIgnoreCase(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown InvestmentHorizon: " + label);
    }
}
