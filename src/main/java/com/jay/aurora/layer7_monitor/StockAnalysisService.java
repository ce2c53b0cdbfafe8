package com.jay.aurora.layer7_monitor;

import com.jay.aurora.layer1_data.MarketDataException;
import com.jay.aurora.layer1_data.MarketDataProvider;
import com.jay.aurora.layer1_data.PortfolioStore;
import com.jay.aurora.layer1_data.TickerNotFoundException;
import com.jay.aurora.layer2_analysis.HistoricalSeriesAnalytics;
import com.jay.aurora.layer2_analysis.HistoricalSeriesAnalytics.SeriesReturns;
import com.jay.aurora.layer2_analysis.TechnicalIndicatorCalculator;
import com.jay.aurora.layer5_report.AnalysisComposer;
import com.jay.aurora.layer6_recommendation.ActiveManagerComposer;
import com.jay.aurora.model.ActiveManagerRecommendation;
import com.jay.aurora.model.AnalysisResult;
import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.PortfolioContext;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockInsights;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.HistoricalPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * On-demand single-stock analysis.
 * Fetches the snapshot and a one-year series, fills technicals the provider left empty,
 * composes the analysis and adds the portfolio-aware recommendation.
 * Provider failures on the snapshot propagate; a missing series only costs the price statistics.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockAnalysisService {

    private static final HistoricalPeriod HISTORY_PERIOD = HistoricalPeriod.ONE_YEAR;

    private final MarketDataProvider marketData;
    private final PortfolioStore portfolioStore;
    private final TechnicalIndicatorCalculator indicatorCalculator;
    private final HistoricalSeriesAnalytics seriesAnalytics;
    private final AnalysisComposer analysisComposer;
    private final ActiveManagerComposer activeManager;

    /**
     * @throws IllegalArgumentException when ticker or profile is missing
     * @throws TickerNotFoundException  when the provider does not know the ticker
     * @throws MarketDataException      when the snapshot cannot be fetched
     */
    public StockInsights analyse(String rawTicker, UserProfile profile) {
        if (rawTicker == null || rawTicker.isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        if (profile == null) {
            throw new IllegalArgumentException("User profile is required");
        }
        String ticker = rawTicker.trim().toUpperCase(Locale.ROOT);
        log.info("Analysis requested for {} ({} / {} / {})", ticker,
            profile.getRiskTolerance(), profile.getHorizon(), profile.getObjective());

        StockData stock = marketData.fetchStockData(ticker);
        if (stock == null) {
            throw new TickerNotFoundException(ticker);
        }

        HistoricalData history = fetchHistory(ticker);
        if (!seriesAnalytics.normalize(history).isEmpty()) {
            stock = stock.toBuilder()
                .technicals(indicatorCalculator.enrich(stock.getTechnicals(), history))
                .build();
        }

        AnalysisResult analysis = analysisComposer.analyzeStock(profile, stock);
        PortfolioContext context = portfolioStore.findContext(ticker).orElse(null);
        ActiveManagerRecommendation recommendation = activeManager.buildRecommendation(analysis, profile, context);

        StockInsights.StockInsightsBuilder insights = StockInsights.builder()
            .analysis(analysis)
            .recommendation(recommendation)
            .portfolioContext(context);

        if (history != null && seriesAnalytics.normalize(history).size() >= 2) {
            SeriesReturns returns = seriesAnalytics.calculateReturns(history);
            insights.periodReturnPct(returns.periodPct())
                .annualizedReturnPct(returns.annualizedPct())
                .volatilityPct(seriesAnalytics.calculateVolatility(history))
                .priceTrend(seriesAnalytics.detectTrend(history));
        }

        log.info("Analysis complete for {}: {} / confidence {}", ticker,
            recommendation == null ? "n/a" : recommendation.getPrimaryAction(),
            recommendation == null ? "n/a" : recommendation.getConfidenceScore());
        return insights.build();
    }

    private HistoricalData fetchHistory(String ticker) {
        try {
            return marketData.fetchHistoricalData(ticker, HISTORY_PERIOD);
        } catch (MarketDataException e) {
            log.warn("Price history unavailable for {}: {}", ticker, e.getMessage());
            return null;
        }
    }
}
