package com.jay.aurora.layer1_data;

import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.enums.HistoricalPeriod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default provider backed by registered snapshots. A real feed is wired in as a
 * {@code @Primary} {@link MarketDataProvider} bean.
 */
@Slf4j
@Component
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private final Map<String, StockData> snapshots = new ConcurrentHashMap<>();
    private final Map<String, HistoricalData> histories = new ConcurrentHashMap<>();

    public void register(StockData stock) {
        snapshots.put(key(stock.getTicker()), stock);
        log.debug("Registered snapshot for {}", stock.getTicker());
    }

    public void register(HistoricalData history) {
        histories.put(key(history.getTicker()), history);
    }

    @Override
    public StockData fetchStockData(String ticker) {
        StockData stock = snapshots.get(key(ticker));
        if (stock == null) {
            throw new TickerNotFoundException(ticker);
        }
        return stock;
    }

    /** The registered series regardless of the requested period, or an empty one. */
    @Override
    public HistoricalData fetchHistoricalData(String ticker, HistoricalPeriod period) {
        HistoricalData history = histories.get(key(ticker));
        if (history == null) {
            return HistoricalData.builder().ticker(key(ticker)).period(period).build();
        }
        return history;
    }

    private static String key(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        return ticker.trim().toUpperCase(Locale.ROOT);
    }
}
