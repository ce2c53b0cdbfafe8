package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum HistoricalPeriod {
    ONE_MONTH("1M"),
    THREE_MONTHS("3M"),
    SIX_MONTHS("6M"),
    ONE_YEAR("1Y"),
    FIVE_YEARS("5Y");

    private final String label;

    HistoricalPeriod(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static HistoricalPeriod fromLabel(String label) {
        for (HistoricalPeriod value : values()) {
            if (value.label.equalsIgnoreCase(label) || value.name().equalsIgnoreCase(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown HistoricalPeriod: " + label);
    }
}
