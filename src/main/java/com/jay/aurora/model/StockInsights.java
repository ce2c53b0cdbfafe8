package com.jay.aurora.model;

import com.jay.aurora.model.enums.PriceTrend;
import lombok.Builder;
import lombok.Value;

/**
 * Single-stock analysis bundle returned by the analysis service: the composed analysis,
 * the recommendation, and price-history statistics when a series was available.
 */
@Value
@Builder
public class StockInsights {
    AnalysisResult analysis;
    ActiveManagerRecommendation recommendation;
    PortfolioContext portfolioContext;

    // ── Price history (null when no series was available) ────────────────────
    Double periodReturnPct;
    Double annualizedReturnPct;
    Double volatilityPct;
    PriceTrend priceTrend;
}
