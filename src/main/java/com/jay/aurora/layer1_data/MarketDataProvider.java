package com.jay.aurora.layer1_data;

import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.enums.HistoricalPeriod;

/**
 * Layer 1 — Market data source.
 * Implementations fill every numeric field they do not know with {@code null}, never zero,
 * and own their own retry and timeout policy.
 */
public interface MarketDataProvider {

    /**
     * @throws TickerNotFoundException when the provider does not know the ticker
     * @throws MarketDataException     on transport or decoding failures
     */
    StockData fetchStockData(String ticker);

    /**
     * Daily price history for the period. Points may come back in any order.
     *
     * @throws MarketDataException on transport or decoding failures
     */
    HistoricalData fetchHistoricalData(String ticker, HistoricalPeriod period);
}
