package com.jay.aurora.layer7_monitor;

import com.jay.aurora.layer1_data.MarketDataException;
import com.jay.aurora.layer1_data.MarketDataProvider;
import com.jay.aurora.layer4_risk.PortfolioActionEngine;
import com.jay.aurora.layer5_report.AnalysisComposer;
import com.jay.aurora.layer6_recommendation.ActiveManagerComposer;
import com.jay.aurora.model.ActiveManagerRecommendation;
import com.jay.aurora.model.AnalysisResult;
import com.jay.aurora.model.ConcentrationRisk;
import com.jay.aurora.model.HoldingScenarioSnapshot;
import com.jay.aurora.model.Portfolio;
import com.jay.aurora.model.PortfolioAllocation;
import com.jay.aurora.model.PortfolioContext;
import com.jay.aurora.model.PortfolioHolding;
import com.jay.aurora.model.PortfolioInsights;
import com.jay.aurora.model.PortfolioMetrics;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Portfolio-wide insights: every holding is analysed, then allocations, metrics, concentration,
 * a scenario stress test and a per-holding recommendation are assembled.
 * Holdings whose market data cannot be fetched are skipped and reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioInsightsService {

    static final UserProfile DEFAULT_PROFILE = UserProfile.builder()
        .riskTolerance(RiskTolerance.MODERATE)
        .horizon(InvestmentHorizon.MEDIUM)
        .objective(InvestmentObjective.BALANCED)
        .build();

    private final MarketDataProvider marketData;
    private final AnalysisComposer analysisComposer;
    private final ActiveManagerComposer activeManager;
    private final PortfolioActionEngine portfolioEngine;

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    /** Budget for fetching the whole portfolio. */
    Duration fetchTimeout = Duration.ofSeconds(30);

    public PortfolioInsights buildPortfolioInsights(Portfolio portfolio, UserProfile requestedProfile) {
        if (portfolio == null) {
            throw new IllegalArgumentException("Portfolio is required");
        }
        UserProfile profile = requestedProfile == null ? DEFAULT_PROFILE : requestedProfile;
        List<PortfolioHolding> holdings = portfolio.getHoldings() == null ? List.of() : portfolio.getHoldings();
        log.info("Portfolio insights requested for '{}' ({} holdings)", portfolio.getName(), holdings.size());

        // Fetch every distinct ticker in parallel
        Map<String, Future<StockData>> futures = new LinkedHashMap<>();
        for (PortfolioHolding holding : holdings) {
            String ticker = normalize(holding.getTicker());
            futures.computeIfAbsent(ticker, t -> executor.submit(() -> marketData.fetchStockData(t)));
        }

        // One deadline covers the whole batch
        long deadline = System.nanoTime() + fetchTimeout.toNanos();
        Map<String, StockData> stocks = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        futures.forEach((ticker, future) -> {
            StockData stock = await(ticker, future, deadline);
            if (stock == null) skipped.add(ticker);
            else stocks.put(ticker, stock);
        });

        Map<String, Double> prices = new HashMap<>();
        stocks.forEach((ticker, stock) -> {
            if (stock.getTechnicals() != null && stock.getTechnicals().getPrice() != null) {
                prices.put(ticker, stock.getTechnicals().getPrice());
            }
        });

        List<PortfolioAllocation> allocations = portfolioEngine.calculateAllocation(portfolio, prices);
        PortfolioMetrics metrics = portfolioEngine.calculatePortfolioMetrics(portfolio, prices, Map.of());
        ConcentrationRisk concentration = portfolioEngine.detectConcentrationRisk(allocations);

        Map<String, Double> weights = new HashMap<>();
        allocations.forEach(a -> weights.merge(a.getTicker(), a.getWeightPct(), Double::sum));

        Map<String, ActiveManagerRecommendation> recommendations = new LinkedHashMap<>();
        List<HoldingScenarioSnapshot> snapshots = new ArrayList<>();
        for (PortfolioHolding holding : holdings) {
            String ticker = normalize(holding.getTicker());
            StockData stock = stocks.get(ticker);
            if (stock == null) continue;

            AnalysisResult analysis = analysisComposer.analyzeStock(profile, stock);
            if (!recommendations.containsKey(ticker)) {
                PortfolioContext context = PortfolioContext.builder()
                    .portfolioId(portfolio.getId())
                    .portfolio(portfolio)
                    .existingHolding(holding)
                    .portfolioMetrics(metrics)
                    .positionWeightPct(weights.getOrDefault(ticker, 0.0))
                    .build();
                recommendations.put(ticker, activeManager.buildRecommendation(analysis, profile, context));
            }
            snapshots.add(HoldingScenarioSnapshot.builder()
                .ticker(ticker)
                .shares(holding.getShares())
                .currentPrice(prices.getOrDefault(ticker, holding.getAverageCostBasis()))
                .scenarios(analysis.getScenarios())
                .build());
        }

        log.info("Portfolio insights complete for '{}': value={} concentration={} skipped={}",
            portfolio.getName(), metrics.getTotalValue(), concentration.getLevel(), skipped);

        return PortfolioInsights.builder()
            .portfolioId(portfolio.getId())
            .metrics(metrics)
            .allocations(allocations)
            .concentration(concentration)
            .stressTest(portfolioEngine.calculatePortfolioStressTest(snapshots))
            .recommendations(recommendations)
            .skippedTickers(List.copyOf(skipped))
            .build();
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
    }

    /** Returns null when the provider failed for this ticker. */
    private StockData await(String ticker, Future<StockData> future, long deadline) {
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            StockData stock = future.get(remaining, TimeUnit.NANOSECONDS);
            if (stock == null) {
                log.warn("Skipping {}: provider returned no data", ticker);
            }
            return stock;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MarketDataException mde) {
                log.warn("Skipping {}: {}", ticker, mde.getMessage());
                return null;
            }
            throw new IllegalStateException("Unexpected failure fetching " + ticker, e.getCause());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Skipping {}: market data fetch exceeded the {}ms budget", ticker, fetchTimeout.toMillis());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MarketDataException("Interrupted while fetching " + ticker, e);
        }
    }

    private static String normalize(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }
}
