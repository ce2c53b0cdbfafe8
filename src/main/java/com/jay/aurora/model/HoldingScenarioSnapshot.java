package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HoldingScenarioSnapshot {
    String ticker;
    double shares;
    double currentPrice;
    ScenarioSummary scenarios;
}
