package com.jay.aurora.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PortfolioAction {
    BUY("buy"),
    HOLD("hold"),
    TRIM("trim"),
    SELL("sell");

    private final String label;

    PortfolioAction(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
