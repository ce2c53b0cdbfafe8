package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Trend of a historical price series. */
public enum PriceTrend {
    UPTREND("uptrend"),
    DOWNTREND("downtrend"),
    SIDEWAYS("sideways");

    private final String label;

    PriceTrend(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
