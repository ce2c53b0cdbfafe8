package com.jay.aurora.layer4_risk;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.layer3_outlook.ScenarioProjector;
import com.jay.aurora.model.ConcentrationRisk;
import com.jay.aurora.model.HoldingScenarioSnapshot;
import com.jay.aurora.model.Portfolio;
import com.jay.aurora.model.PortfolioActionSuggestion;
import com.jay.aurora.model.PortfolioAllocation;
import com.jay.aurora.model.PortfolioHolding;
import com.jay.aurora.model.PortfolioMetrics;
import com.jay.aurora.model.PortfolioStressTestResult;
import com.jay.aurora.model.enums.ConcentrationLevel;
import com.jay.aurora.model.enums.PortfolioAction;
import com.jay.aurora.util.TestStocks;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PortfolioActionEngineTest {

    private final PortfolioActionEngine engine = new PortfolioActionEngine(new AnalyzerConfig());

    private static PortfolioHolding holding(String ticker, double shares, double cost) {
        return PortfolioHolding.builder().ticker(ticker).shares(shares).averageCostBasis(cost).build();
    }

    private static Portfolio portfolio(PortfolioHolding... holdings) {
        return Portfolio.builder().id("p-1").name("Core").holdings(List.of(holdings)).build();
    }

    private static PortfolioAllocation allocation(String ticker, double weight) {
        return PortfolioAllocation.builder().ticker(ticker).weightPct(weight).value(weight * 100).build();
    }

    // ── Metrics ───────────────────────────────────────────────────────────────

    @Test
    void calculatePortfolioMetrics_shouldAggregateValueCostAndGain() {
        Portfolio p = portfolio(holding("AAPL", 10, 150), holding("MSFT", 5, 300));

        PortfolioMetrics metrics = engine.calculatePortfolioMetrics(p,
            Map.of("AAPL", 180.0, "MSFT", 350.0), Map.of("AAPL", 1.2));

        assertEquals(3550.0, metrics.getTotalValue(), 1e-9);
        assertEquals(3000.0, metrics.getTotalCost(), 1e-9);
        assertEquals(550.0, metrics.getTotalGainLoss(), 1e-9);
        assertEquals(18.33, metrics.getTotalGainLossPct(), 1e-9);
        assertEquals(1.10, metrics.getBeta(), 1e-9);
        assertEquals(30.32, metrics.getVolatility(), 1e-9);
    }

    @Test
    void calculateAllocation_shouldFallBackToCostBasisWithoutPrice() {
        Portfolio p = portfolio(holding("aapl", 10, 150), holding("MSFT", 5, 300));

        List<PortfolioAllocation> allocations = engine.calculateAllocation(p, Map.of("AAPL", 180.0));

        assertEquals("AAPL", allocations.get(0).getTicker());
        assertEquals(1800.0, allocations.get(0).getValue(), 1e-9);
        assertEquals(20.0, allocations.get(0).getGainLossPct(), 1e-9);
        assertEquals(1500.0, allocations.get(1).getValue(), 1e-9);
        assertEquals(0.0, allocations.get(1).getGainLoss(), 1e-9);
        assertEquals(100.0, allocations.get(0).getWeightPct() + allocations.get(1).getWeightPct(), 0.011);
    }

    @Test
    void calculatePortfolioMetrics_shouldReturnZerosForEmptyPortfolio() {
        PortfolioMetrics metrics = engine.calculatePortfolioMetrics(portfolio(), Map.of(), Map.of());

        assertEquals(0.0, metrics.getTotalValue());
        assertEquals(0.0, metrics.getTotalGainLossPct());
        assertEquals(0.0, metrics.getBeta());
        assertEquals(0.0, metrics.getVolatility());
    }

    // ── Concentration ─────────────────────────────────────────────────────────

    @Test
    void detectConcentrationRisk_shouldFlagHighWhenPositionReachesThirtyPercent() {
        ConcentrationRisk risk = engine.detectConcentrationRisk(List.of(
            allocation("AAA", 35), allocation("BBB", 25), allocation("CCC", 20), allocation("DDD", 20)));

        assertEquals(ConcentrationLevel.HIGH, risk.getLevel());
        assertEquals(1, risk.getWarnings().size());
        assertTrue(risk.getWarnings().get(0).startsWith("AAA represents 35.0%"));
        assertEquals(List.of("AAA", "BBB", "CCC"),
            risk.getLargestPositions().stream().map(ConcentrationRisk.PositionWeight::ticker).toList());
    }

    @Test
    void detectConcentrationRisk_shouldFlagModerateBetweenWarningAndHigh() {
        ConcentrationRisk risk = engine.detectConcentrationRisk(List.of(
            allocation("AAA", 22), allocation("BBB", 21), allocation("CCC", 21), allocation("DDD", 20),
            allocation("EEE", 16)));

        assertEquals(ConcentrationLevel.MODERATE, risk.getLevel());
        assertEquals(List.of("AAA is 22.0% of the portfolio. Keep it under 25% to avoid concentration risk."),
            risk.getWarnings());
    }

    @Test
    void detectConcentrationRisk_shouldKeepEarlierWarningsWhenEscalatingToHigh() {
        ConcentrationRisk risk = engine.detectConcentrationRisk(List.of(
            allocation("AAA", 22), allocation("BBB", 21), allocation("CCC", 57)));

        assertEquals(ConcentrationLevel.HIGH, risk.getLevel());
        assertEquals(2, risk.getWarnings().size());
        assertEquals("CCC", risk.getLargestPositions().get(0).ticker());
    }

    @Test
    void detectConcentrationRisk_shouldReportLowForDiversifiedOrEmptyPortfolio() {
        ConcentrationRisk diversified = engine.detectConcentrationRisk(List.of(
            allocation("AAA", 20), allocation("BBB", 20), allocation("CCC", 20), allocation("DDD", 20),
            allocation("EEE", 20)));

        assertEquals(ConcentrationLevel.LOW, diversified.getLevel());
        assertTrue(diversified.getWarnings().isEmpty());
        assertEquals(ConcentrationLevel.LOW, engine.detectConcentrationRisk(List.of()).getLevel());
    }

    // ── Suggestions ───────────────────────────────────────────────────────────

    @Test
    void suggestPortfolioAction_shouldSellAtOrAboveCeilingRegardlessOfConviction() {
        PortfolioActionSuggestion suggestion =
            engine.suggestPortfolioAction("AAPL", portfolio(holding("AAPL", 10, 150)), 25, 95);

        assertEquals(PortfolioAction.SELL, suggestion.action());
        assertTrue(suggestion.reasoning().get(0).contains("25% single-position ceiling"));
    }

    @Test
    void suggestPortfolioAction_shouldTrimAtTrimThreshold() {
        PortfolioActionSuggestion suggestion =
            engine.suggestPortfolioAction("AAPL", portfolio(holding("AAPL", 10, 150)), 20, 95);

        assertEquals(PortfolioAction.TRIM, suggestion.action());
        assertTrue(suggestion.reasoning().get(0).contains("20% trim threshold"));
    }

    @Test
    void suggestPortfolioAction_shouldNeedHighConvictionToOpenPosition() {
        Portfolio p = portfolio(holding("MSFT", 5, 300));

        assertEquals(PortfolioAction.BUY, engine.suggestPortfolioAction("AAPL", p, 0, 70).action());
        assertEquals(PortfolioAction.HOLD, engine.suggestPortfolioAction("AAPL", p, 0, 69).action());
        assertEquals(PortfolioAction.HOLD, engine.suggestPortfolioAction("AAPL", p, 0, null).action());
        assertEquals("AAPL is not currently held in the portfolio.",
            engine.suggestPortfolioAction("aapl", p, 0, 10).reasoning().get(0));
    }

    @Test
    void suggestPortfolioAction_shouldMentionBaselineForEmptyPortfolio() {
        PortfolioActionSuggestion suggestion = engine.suggestPortfolioAction("AAPL", portfolio(), 0, 80);

        assertEquals(PortfolioAction.BUY, suggestion.action());
        assertEquals("Adding the first holding will establish your portfolio baseline.", suggestion.reasoning().get(1));
    }

    @Test
    void suggestPortfolioAction_shouldSizeHeldPositionsByConviction() {
        Portfolio p = portfolio(holding("aapl", 10, 150));

        assertEquals(PortfolioAction.BUY, engine.suggestPortfolioAction("AAPL", p, 3, 50).action());
        assertEquals(PortfolioAction.BUY, engine.suggestPortfolioAction("AAPL", p, 2, null).action());
        assertEquals(PortfolioAction.TRIM, engine.suggestPortfolioAction("AAPL", p, 10, 39).action());
        assertEquals(PortfolioAction.HOLD, engine.suggestPortfolioAction("AAPL", p, 10, 60).action());
        assertEquals(PortfolioAction.HOLD, engine.suggestPortfolioAction("AAPL", p, 2, 45).action());
    }

    // ── Stress test ───────────────────────────────────────────────────────────

    @Test
    void calculatePortfolioStressTest_shouldProjectBandMidpoints() {
        HoldingScenarioSnapshot snapshot = HoldingScenarioSnapshot.builder()
            .ticker("aapl")
            .shares(10)
            .currentPrice(100)
            .scenarios(new ScenarioProjector().project(TestStocks.moderateProfile(), 3))
            .build();

        PortfolioStressTestResult result = engine.calculatePortfolioStressTest(List.of(snapshot));

        assertEquals(1000.0, result.getCurrentValue(), 1e-9);
        assertEquals(1115.0, result.getBullValue(), 1e-9);
        assertEquals(1005.0, result.getBaseValue(), 1e-9);
        assertEquals(900.0, result.getBearValue(), 1e-9);
        assertEquals(11.5, result.getBullChangePct(), 1e-9);
        assertEquals(-10.0, result.getBearChangePct(), 1e-9);
        assertEquals("AAPL", result.getEntries().get(0).ticker());
    }

    @Test
    void calculatePortfolioStressTest_shouldReturnEmptyResultWithoutHoldings() {
        assertEquals(PortfolioStressTestResult.empty(), engine.calculatePortfolioStressTest(List.of()));
    }
}
