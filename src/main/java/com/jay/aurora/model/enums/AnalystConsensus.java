package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnalystConsensus {
    STRONG_BUY("strong_buy"),
    BUY("buy"),
    HOLD("hold"),
    SELL("sell"),
    STRONG_SELL("strong_sell");

    private final String label;

    AnalystConsensus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static AnalystConsensus fromLabel(String label) {
        for (AnalystConsensus value : values()) {
            if (value.label.equalsIgnoreCase(label) || value.name().equalsIgnoreCase(label)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown AnalystConsensus: " + label);
    }
}
