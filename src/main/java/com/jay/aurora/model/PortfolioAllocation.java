package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioAllocation {
    String ticker;
    double value;
    double weightPct;
    double gainLoss;
    double gainLossPct;
}
