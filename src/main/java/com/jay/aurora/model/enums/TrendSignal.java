package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Moving-average trend read. */
public enum TrendSignal {
    BULLISH("bullish"),
    BEARISH("bearish"),
    NEUTRAL("neutral");

    private final String label;

    TrendSignal(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
