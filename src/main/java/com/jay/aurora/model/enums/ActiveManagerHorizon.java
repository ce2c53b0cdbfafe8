package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActiveManagerHorizon {
    SHORT_TERM("short_term"),
    MEDIUM_TERM("medium_term"),
    LONG_TERM("long_term");

    private final String label;

    ActiveManagerHorizon(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
