package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PortfolioMetrics {
    double totalValue;
    double totalCost;
    double totalGainLoss;
    double totalGainLossPct;
    double beta;
    double volatility;          // estimated annualised %, concentration based
}
