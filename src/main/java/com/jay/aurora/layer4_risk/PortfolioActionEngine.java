package com.jay.aurora.layer4_risk;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.ConcentrationRisk;
import com.jay.aurora.model.ConcentrationRisk.PositionWeight;
import com.jay.aurora.model.HoldingScenarioSnapshot;
import com.jay.aurora.model.Portfolio;
import com.jay.aurora.model.PortfolioActionSuggestion;
import com.jay.aurora.model.PortfolioAllocation;
import com.jay.aurora.model.PortfolioHolding;
import com.jay.aurora.model.PortfolioMetrics;
import com.jay.aurora.model.PortfolioStressTestResult;
import com.jay.aurora.model.ReturnRange;
import com.jay.aurora.model.ScenarioBand;
import com.jay.aurora.model.ScenarioSummary;
import com.jay.aurora.model.enums.ConcentrationLevel;
import com.jay.aurora.model.enums.PortfolioAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.jay.aurora.layer2_analysis.MetricScorer.finite;
import static com.jay.aurora.layer2_analysis.MetricScorer.round;

/**
 * Layer 4 — Portfolio Action Engine.
 * Position sizing rules for a single holding inside a portfolio: allocation weights,
 * aggregate metrics, concentration detection, stress testing and a buy / hold / trim / sell
 * suggestion. Oversized weights are checked before conviction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioActionEngine {

    private static final double DEFAULT_BETA = 1.0;
    private static final int LARGEST_POSITIONS = 3;

    private final AnalyzerConfig config;

    // ── Allocation & metrics ──────────────────────────────────────────────────

    /**
     * Value, weight and gain/loss per holding. Holdings without a usable current price
     * are valued at cost basis. Tickers are upper-cased.
     */
    public List<PortfolioAllocation> calculateAllocation(Portfolio portfolio, Map<String, Double> currentPrices) {
        if (portfolio == null || portfolio.getHoldings() == null || portfolio.getHoldings().isEmpty()) {
            return List.of();
        }
        Map<String, Double> prices = normalizePrices(currentPrices);

        double totalValue = 0;
        for (PortfolioHolding holding : portfolio.getHoldings()) {
            totalValue += holdingValue(holding, prices);
        }

        List<PortfolioAllocation> allocations = new ArrayList<>();
        for (PortfolioHolding holding : portfolio.getHoldings()) {
            double value = holdingValue(holding, prices);
            double cost = holding.getShares() * holding.getAverageCostBasis();
            double gainLoss = value - cost;
            allocations.add(PortfolioAllocation.builder()
                .ticker(normalizeTicker(holding.getTicker()))
                .value(round(value, 2))
                .weightPct(totalValue > 0 ? round(value / totalValue * 100, 2) : 0)
                .gainLoss(round(gainLoss, 2))
                .gainLossPct(cost > 0 ? round(gainLoss / cost * 100, 2) : 0)
                .build());
        }
        return allocations;
    }

    /** Value-weighted beta; tickers without a supplied beta count as 1.0. Empty portfolios return 0. */
    public double calculatePortfolioBeta(List<PortfolioHolding> holdings, Map<String, Double> stockBetas,
                                         Map<String, Double> currentPrices) {
        if (holdings == null || holdings.isEmpty()) return 0;
        Map<String, Double> prices = normalizePrices(currentPrices);
        Map<String, Double> betas = normalizePrices(stockBetas);

        double totalValue = 0;
        double weightedBeta = 0;
        for (PortfolioHolding holding : holdings) {
            String ticker = normalizeTicker(holding.getTicker());
            double price = prices.getOrDefault(ticker, holding.getAverageCostBasis());
            double value = holding.getShares() * price;
            if (value <= 0) continue;
            totalValue += value;
            weightedBeta += betas.getOrDefault(ticker, DEFAULT_BETA) * value;
        }
        return totalValue == 0 ? 0 : round(weightedBeta / totalValue, 2);
    }

    public PortfolioMetrics calculatePortfolioMetrics(Portfolio portfolio, Map<String, Double> currentPrices,
                                                      Map<String, Double> stockBetas) {
        List<PortfolioAllocation> allocations = calculateAllocation(portfolio, currentPrices);
        List<PortfolioHolding> holdings = portfolio == null || portfolio.getHoldings() == null
            ? List.of()
            : portfolio.getHoldings();

        double totalValue = allocations.stream().mapToDouble(PortfolioAllocation::getValue).sum();
        double totalCost = holdings.stream().mapToDouble(h -> h.getShares() * h.getAverageCostBasis()).sum();
        double totalGainLoss = totalValue - totalCost;

        return PortfolioMetrics.builder()
            .totalValue(round(totalValue, 2))
            .totalCost(round(totalCost, 2))
            .totalGainLoss(round(totalGainLoss, 2))
            .totalGainLossPct(totalCost > 0 ? round(totalGainLoss / totalCost * 100, 2) : 0)
            .beta(calculatePortfolioBeta(holdings, stockBetas, currentPrices))
            .volatility(estimateVolatility(allocations))
            .build();
    }

    /** 12% floor, plus a Herfindahl-style concentration term, plus a penalty above a 25% position. */
    double estimateVolatility(List<PortfolioAllocation> allocations) {
        if (allocations.isEmpty()) return 0;
        double weightSquares = 0;
        double maxWeight = 0;
        for (PortfolioAllocation allocation : allocations) {
            double w = allocation.getWeightPct() / 100;
            weightSquares += w * w;
            maxWeight = Math.max(maxWeight, allocation.getWeightPct());
        }
        double penalty = Math.max(0, maxWeight - 25);
        return round(12 + Math.sqrt(weightSquares) * 15 + penalty * 0.3, 2);
    }

    // ── Concentration ─────────────────────────────────────────────────────────

    public ConcentrationRisk detectConcentrationRisk(List<PortfolioAllocation> allocations) {
        if (allocations == null || allocations.isEmpty()) {
            return ConcentrationRisk.builder().level(ConcentrationLevel.LOW).build();
        }
        AnalyzerConfig.Portfolio cfg = config.portfolio();

        List<String> warnings = new ArrayList<>();
        ConcentrationLevel level = ConcentrationLevel.LOW;
        for (PortfolioAllocation allocation : allocations) {
            double weight = allocation.getWeightPct();
            if (weight >= cfg.getConcentrationHighPct()) {
                warnings.add(String.format(Locale.US,
                    "%s represents %.1f%% of portfolio value which exceeds typical %.0f%% guardrails.",
                    allocation.getTicker(), weight, cfg.getMaxSinglePositionPct()));
                level = ConcentrationLevel.HIGH;
            } else if (weight >= cfg.getConcentrationWarningPct() && level != ConcentrationLevel.HIGH) {
                warnings.add(String.format(Locale.US,
                    "%s is %.1f%% of the portfolio. Keep it under %.0f%% to avoid concentration risk.",
                    allocation.getTicker(), weight, cfg.getMaxSinglePositionPct()));
                level = ConcentrationLevel.MODERATE;
            }
        }

        List<PositionWeight> largest = allocations.stream()
            .sorted(Comparator.comparingDouble(PortfolioAllocation::getWeightPct).reversed())
            .limit(LARGEST_POSITIONS)
            .map(a -> new PositionWeight(a.getTicker(), round(a.getWeightPct(), 2)))
            .toList();

        return ConcentrationRisk.builder()
            .level(level)
            .warnings(List.copyOf(warnings))
            .largestPositions(largest)
            .build();
    }

    // ── Action suggestion ─────────────────────────────────────────────────────

    /**
     * Suggests an action for {@code ticker} at its current weight.
     * Weight thresholds win over conviction; a {@code null} conviction counts as moderate.
     */
    public PortfolioActionSuggestion suggestPortfolioAction(String ticker, Portfolio portfolio,
                                                            double weightPct, Integer conviction) {
        AnalyzerConfig.Portfolio cfg = config.portfolio();
        String symbol = normalizeTicker(ticker);
        double weight = Double.isFinite(weightPct) ? weightPct : 0;
        double score = conviction == null ? cfg.getModerateConviction() : conviction;
        List<String> reasoning = new ArrayList<>();

        if (weight >= cfg.getSellWeightPct()) {
            reasoning.add(String.format(Locale.US,
                "%s accounts for %.1f%% of your portfolio, at or above the %.0f%% single-position ceiling.",
                symbol, weight, cfg.getSellWeightPct()));
            reasoning.add("Taking profits and redeploying into other ideas can reduce single-stock risk.");
            return suggestion(symbol, PortfolioAction.SELL, reasoning);
        }
        if (weight >= cfg.getTrimWeightPct()) {
            reasoning.add(String.format(Locale.US,
                "%s represents %.1f%% of the portfolio, above the %.0f%% trim threshold. Consider trimming to stay diversified.",
                symbol, weight, cfg.getTrimWeightPct()));
            return suggestion(symbol, PortfolioAction.TRIM, reasoning);
        }

        List<PortfolioHolding> holdings = portfolio == null || portfolio.getHoldings() == null
            ? List.of()
            : portfolio.getHoldings();
        Optional<PortfolioHolding> holding = holdings.stream()
            .filter(h -> normalizeTicker(h.getTicker()).equals(symbol))
            .findFirst();

        if (holding.isEmpty()) {
            reasoning.add(symbol + " is not currently held in the portfolio.");
            reasoning.add(holdings.isEmpty()
                ? "Adding the first holding will establish your portfolio baseline."
                : "Consider how this addition fits alongside existing positions.");
            if (score >= cfg.getHighConviction()) {
                reasoning.add(String.format(Locale.US,
                    "Conviction %.0f/100 clears the %.0f high-conviction bar for opening a position.",
                    score, cfg.getHighConviction()));
                return suggestion(symbol, PortfolioAction.BUY, reasoning);
            }
            reasoning.add(String.format(Locale.US,
                "Conviction %.0f/100 is below the %.0f high-conviction bar for opening a position.",
                score, cfg.getHighConviction()));
            return suggestion(symbol, PortfolioAction.HOLD, reasoning);
        }

        if (weight <= cfg.getMinMeaningfulWeightPct() && score >= cfg.getModerateConviction()) {
            reasoning.add(String.format(Locale.US,
                "Position size is only %.1f%%, at or below the %.0f%% minimum meaningful weight. "
                    + "With conviction at %.0f/100 you could add to reach a 5-10%% allocation.",
                weight, cfg.getMinMeaningfulWeightPct(), score));
            return suggestion(symbol, PortfolioAction.BUY, reasoning);
        }
        if (score < cfg.getLowConviction()) {
            reasoning.add(String.format(Locale.US,
                "Conviction %.0f/100 is below the %.0f low-conviction floor. Trimming reduces exposure while the outlook is weak.",
                score, cfg.getLowConviction()));
            return suggestion(symbol, PortfolioAction.TRIM, reasoning);
        }

        reasoning.add(String.format(Locale.US,
            "%s sits at %.1f%% which is below the %.0f%% trim threshold for single positions.",
            symbol, weight, cfg.getTrimWeightPct()));
        reasoning.add("Maintain current size while monitoring fundamentals and risk exposure.");
        return suggestion(symbol, PortfolioAction.HOLD, reasoning);
    }

    // ── Stress test ───────────────────────────────────────────────────────────

    /** Projects each holding onto the midpoint of its bull, base and bear bands. */
    public PortfolioStressTestResult calculatePortfolioStressTest(List<HoldingScenarioSnapshot> snapshots) {
        if (snapshots == null || snapshots.isEmpty()) {
            return PortfolioStressTestResult.empty();
        }

        List<PortfolioStressTestResult.Entry> entries = new ArrayList<>();
        double current = 0;
        double bull = 0;
        double base = 0;
        double bear = 0;
        for (HoldingScenarioSnapshot snapshot : snapshots) {
            double value = round(snapshot.getShares() * snapshot.getCurrentPrice(), 2);
            ScenarioSummary scenarios = snapshot.getScenarios();
            double bullValue = project(value, scenarios == null ? null : scenarios.getBull());
            double baseValue = project(value, scenarios == null ? null : scenarios.getBase());
            double bearValue = project(value, scenarios == null ? null : scenarios.getBear());
            entries.add(new PortfolioStressTestResult.Entry(
                normalizeTicker(snapshot.getTicker()), value, bullValue, baseValue, bearValue));
            current += value;
            bull += bullValue;
            base += baseValue;
            bear += bearValue;
        }

        return PortfolioStressTestResult.builder()
            .currentValue(round(current, 2))
            .bullValue(round(bull, 2))
            .baseValue(round(base, 2))
            .bearValue(round(bear, 2))
            .bullChangePct(changePct(bull, current))
            .baseChangePct(changePct(base, current))
            .bearChangePct(changePct(bear, current))
            .entries(List.copyOf(entries))
            .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private PortfolioActionSuggestion suggestion(String ticker, PortfolioAction action, List<String> reasoning) {
        log.debug("Portfolio action {}: {} ({} reasons)", ticker, action, reasoning.size());
        return new PortfolioActionSuggestion(action, List.copyOf(reasoning));
    }

    private static double project(double value, ScenarioBand band) {
        ReturnRange range = band == null ? null : band.getExpectedReturnPctRange();
        double midpoint = range == null ? 0 : range.midpoint();
        return round(value * (1 + midpoint / 100), 2);
    }

    private static double changePct(double scenarioValue, double currentValue) {
        return currentValue == 0 ? 0 : round((scenarioValue - currentValue) / currentValue * 100, 2);
    }

    private static double holdingValue(PortfolioHolding holding, Map<String, Double> prices) {
        Double price = prices.get(normalizeTicker(holding.getTicker()));
        if (price != null && price > 0) {
            return holding.getShares() * price;
        }
        return holding.getShares() * holding.getAverageCostBasis();
    }

    static String normalizeTicker(String ticker) {
        return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
    }

    private static Map<String, Double> normalizePrices(Map<String, Double> values) {
        Map<String, Double> normalized = new HashMap<>();
        if (values == null) return normalized;
        values.forEach((key, value) -> {
            Double v = finite(value);
            if (key != null && v != null) normalized.put(normalizeTicker(key), v);
        });
        return normalized;
    }
}
