package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** RSI14 momentum read. */
public enum MomentumSignal {
    OVERBOUGHT("overbought"),
    OVERSOLD("oversold"),
    NEUTRAL("neutral");

    private final String label;

    MomentumSignal(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
