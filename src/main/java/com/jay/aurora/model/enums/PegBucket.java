package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PegBucket {
    DISCOUNT("discount"),
    BALANCED("balanced"),
    DEMANDING("demanding"),
    DISTORTED("distorted");

    private final String label;

    PegBucket(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
