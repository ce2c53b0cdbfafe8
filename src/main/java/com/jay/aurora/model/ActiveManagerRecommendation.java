package com.jay.aurora.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.aurora.model.enums.ActiveManagerHorizon;
import com.jay.aurora.model.enums.PortfolioAction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Portfolio-aware action for one ticker. Read-only for the presentation layer.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActiveManagerRecommendation {
    String ticker;
    PortfolioAction primaryAction;
    ActiveManagerHorizon horizon;
    int confidenceScore;        // 0 – 100
    Double expectedReturn3m;
    String headline;
    @Builder.Default
    List<String> rationale = List.of();
    @Builder.Default
    List<String> riskFlags = List.of();
    @Builder.Default
    List<String> notes = List.of();
}
