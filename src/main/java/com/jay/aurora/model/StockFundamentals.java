package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw fundamental metrics. Every field is optional: an unknown value is {@code null}, never zero.
 */
@Value
@Builder
public class StockFundamentals {
    Double trailingPE;
    Double forwardPE;
    Double dividendYieldPct;
    Double revenueGrowthYoYPct;
    Double epsGrowthYoYPct;
    Double netMarginPct;
    Double freeCashFlowYieldPct;
    Double debtToEquity;
    Double roe;                 // Return on equity (%)
}
