package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class PortfolioInsights {
    String portfolioId;
    PortfolioMetrics metrics;
    @Builder.Default
    List<PortfolioAllocation> allocations = List.of();
    ConcentrationRisk concentration;
    PortfolioStressTestResult stressTest;
    @Builder.Default
    Map<String, ActiveManagerRecommendation> recommendations = Map.of();
    @Builder.Default
    List<String> skippedTickers = List.of();
}
