package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Direction implied by the probability-weighted scenario return. */
public enum ReturnBias {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    private final String label;

    ReturnBias(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
