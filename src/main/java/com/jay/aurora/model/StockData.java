package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

/**
 * Market snapshot for one ticker as handed over by the market-data provider.
 * Any of the three sections may be {@code null} when the provider has nothing for it.
 */
@Value
@Builder(toBuilder = true)
public class StockData {
    String ticker;
    String name;
    String currency;
    StockFundamentals fundamentals;
    StockTechnicals technicals;
    StockSentiment sentiment;
}
