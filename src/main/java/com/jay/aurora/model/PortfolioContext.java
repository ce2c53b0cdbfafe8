package com.jay.aurora.model;

import com.jay.aurora.model.enums.PortfolioAction;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Links an analysis request to the investor's existing position.
 * When {@code portfolio} is absent the action engine works on a single-holding portfolio
 * built from {@code existingHolding}.
 */
@Value
@Builder
public class PortfolioContext {
    String portfolioId;
    Portfolio portfolio;
    PortfolioHolding existingHolding;
    PortfolioMetrics portfolioMetrics;
    PortfolioAction suggestedAction;
    @Builder.Default
    List<String> reasoning = List.of();
    Double positionWeightPct;
}
