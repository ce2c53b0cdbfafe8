package com.jay.aurora.layer5_report;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.AnalysisOptions;
import com.jay.aurora.model.AnalysisResult;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.FundamentalsClassification;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;
import com.jay.aurora.model.enums.TrendSignal;
import com.jay.aurora.model.enums.ValuationClassification;
import com.jay.aurora.util.TestStocks;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisComposerTest {

    private final AnalysisComposer composer = TestStocks.composer(new AnalyzerConfig(), TestStocks.fixedClock());

    @Test
    void analyzeStock_shouldSummariseStrongCheapBullishStock() {
        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), TestStocks.qualityCompounder());

        assertEquals("QLTY", result.getTicker());
        assertEquals(FundamentalsClassification.STRONG, result.getFundamentalsInsight().getClassification());
        assertEquals(ValuationClassification.CHEAP, result.getValuationInsight().getClassification());
        assertEquals(4, result.getSummary().getRiskScore());
        assertEquals(60, result.getSummary().getConvictionScore3m());
        assertTrue(result.getSummary().getHeadlineView()
            .startsWith("Quality Corp (QLTY) shows strong fundamentals with cheap valuation. Multiples screen at a discount"));
        assertEquals(AnalysisComposer.DISCLAIMER, result.getDisclaimer());
        assertEquals(3, result.getScenarios().getHorizonMonths());
    }

    @Test
    void analyzeStock_shouldStampGeneratedAtFromClock() {
        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), TestStocks.qualityCompounder());

        assertEquals("2025-01-02T15:30:00Z", result.getGeneratedAt());
    }

    @Test
    void analyzeStock_shouldBeDeterministicForFixedInputs() {
        UserProfile profile = TestStocks.moderateProfile();
        StockData stock = TestStocks.qualityCompounder();

        assertEquals(composer.analyzeStock(profile, stock), composer.analyzeStock(profile, stock));
    }

    @Test
    void analyzeStock_shouldOnlyDifferInTimestampAcrossClocks() {
        AnalysisComposer later = TestStocks.composer(new AnalyzerConfig(),
            Clock.offset(TestStocks.fixedClock(), Duration.ofHours(1)));
        UserProfile profile = TestStocks.moderateProfile();
        StockData stock = TestStocks.qualityCompounder();

        AnalysisResult first = composer.analyzeStock(profile, stock);
        AnalysisResult second = later.analyzeStock(profile, stock);

        assertNotEquals(first.getGeneratedAt(), second.getGeneratedAt());
        assertEquals(first.toBuilder().generatedAt(null).build(), second.toBuilder().generatedAt(null).build());
    }

    @Test
    void analyzeStock_shouldRenderViews() {
        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), TestStocks.qualityCompounder());

        assertTrue(result.getFundamentalsView().startsWith("Classification: STRONG | Quality Score: 100/100 | Drivers: "));
        assertTrue(result.getFundamentalsView().contains("Debt/Equity: 0.3x"));
        assertTrue(result.getValuationView().contains("PEG Ratio: 0.80"));
        assertEquals("Trend: bullish | Momentum: neutral | Position: Near 52-week high | RSI(14): 62.0",
            result.getTechnicalView());
        assertEquals("Analyst Consensus: Buy | Target vs Price: Significant upside (18.2%)"
                + " | News: Record cloud revenue. New buyback program. CFO transition.",
            result.getSentimentView());
    }

    @Test
    void analyzeStock_shouldDegradeGracefullyForBareStock() {
        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), TestStocks.bareStock("BARE"));

        assertEquals(FundamentalsClassification.UNKNOWN, result.getFundamentalsInsight().getClassification());
        assertEquals("Fundamentals data not available.", result.getFundamentalsView());
        assertEquals("Valuation data not available.", result.getValuationView());
        assertEquals("Technical data not available.", result.getTechnicalView());
        assertEquals("BARE Inc (BARE) shows unknown fundamentals with unknown valuation.",
            result.getSummary().getHeadlineView());
        assertEquals(5, result.getSummary().getRiskScore());
        assertEquals(50, result.getSummary().getConvictionScore3m());
    }

    @Test
    void analyzeStock_shouldSubstituteUnknownForBlankTicker() {
        StockData stock = TestStocks.bareStock(" ").toBuilder().name(null).build();

        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), stock);

        assertEquals("UNKNOWN", result.getTicker());
    }

    @Test
    void analyzeStock_shouldHonourRequestedHorizon() {
        AnalysisResult result = composer.analyzeStock(TestStocks.moderateProfile(), TestStocks.qualityCompounder(),
            AnalysisOptions.builder().horizonMonths(12).build());

        assertEquals(12, result.getScenarios().getHorizonMonths());
    }

    @Test
    void analyzeStock_shouldRejectMissingInputs() {
        UserProfile incomplete = UserProfile.builder().riskTolerance(RiskTolerance.LOW).build();

        assertThrows(IllegalArgumentException.class,
            () -> composer.analyzeStock(null, TestStocks.qualityCompounder()));
        assertThrows(IllegalArgumentException.class,
            () -> composer.analyzeStock(TestStocks.moderateProfile(), null));
        assertThrows(IllegalArgumentException.class,
            () -> composer.analyzeStock(incomplete, TestStocks.qualityCompounder()));
    }

    @Test
    void riskScore_shouldStartFromToleranceAndStayInRange() {
        UserProfile low = TestStocks.profile(RiskTolerance.LOW, InvestmentHorizon.LONG, InvestmentObjective.INCOME);
        UserProfile high = TestStocks.profile(RiskTolerance.HIGH, InvestmentHorizon.SHORT, InvestmentObjective.GROWTH);

        assertEquals(2, AnalysisComposer.riskScore(low, ValuationClassification.CHEAP));
        assertEquals(3, AnalysisComposer.riskScore(low, ValuationClassification.FAIR));
        assertEquals(9, AnalysisComposer.riskScore(high, ValuationClassification.RICH));
        assertEquals(7, AnalysisComposer.riskScore(high, ValuationClassification.UNKNOWN));
    }

    @Test
    void convictionScore_shouldFavourStrongBullishAndPenaliseWeakOrBearish() {
        assertEquals(60, AnalysisComposer.convictionScore(FundamentalsClassification.STRONG, TrendSignal.BULLISH));
        assertEquals(50, AnalysisComposer.convictionScore(FundamentalsClassification.OK, TrendSignal.BULLISH));
        assertEquals(40, AnalysisComposer.convictionScore(FundamentalsClassification.WEAK, TrendSignal.BULLISH));
        assertEquals(40, AnalysisComposer.convictionScore(FundamentalsClassification.STRONG, TrendSignal.BEARISH));
    }
}
