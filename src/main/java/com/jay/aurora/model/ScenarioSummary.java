package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

/** Bull/base/bear bands; the three probabilities always add up to 100. */
@Value
@Builder
public class ScenarioSummary {
    int horizonMonths;
    ScenarioBand bull;
    ScenarioBand base;
    ScenarioBand bear;
    double pointEstimateReturnPct;
    String uncertaintyComment;
}
