package com.jay.aurora.util;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.layer2_analysis.FundamentalAnalysisModule;
import com.jay.aurora.layer2_analysis.SentimentAnalysisModule;
import com.jay.aurora.layer2_analysis.TechnicalAnalysisModule;
import com.jay.aurora.layer2_analysis.ValuationAnalysisModule;
import com.jay.aurora.layer3_outlook.PlanningGuidanceGenerator;
import com.jay.aurora.layer3_outlook.ScenarioProjector;
import com.jay.aurora.layer5_report.AnalysisComposer;
import com.jay.aurora.layer5_report.AnalysisViewFormatter;
import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.HistoricalDataPoint;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockFundamentals;
import com.jay.aurora.model.StockSentiment;
import com.jay.aurora.model.StockTechnicals;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.AnalystConsensus;
import com.jay.aurora.model.enums.HistoricalPeriod;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntToDoubleFunction;

/** Shared fixtures for analysis tests. */
public final class TestStocks {

    public static final Instant FIXED_NOW = Instant.parse("2025-01-02T15:30:00Z");

    private TestStocks() {}

    public static UserProfile profile(RiskTolerance tolerance, InvestmentHorizon horizon, InvestmentObjective objective) {
        return UserProfile.builder().riskTolerance(tolerance).horizon(horizon).objective(objective).build();
    }

    public static UserProfile moderateProfile() {
        return profile(RiskTolerance.MODERATE, InvestmentHorizon.MEDIUM, InvestmentObjective.GROWTH);
    }

    /** High-quality compounder: every fundamentals driver fires, no caution. */
    public static StockData qualityCompounder() {
        return StockData.builder()
            .ticker("QLTY")
            .name("Quality Corp")
            .currency("USD")
            .fundamentals(StockFundamentals.builder()
                .trailingPE(24.0)
                .forwardPE(20.0)
                .dividendYieldPct(1.2)
                .epsGrowthYoYPct(25.0)
                .revenueGrowthYoYPct(14.0)
                .netMarginPct(28.0)
                .freeCashFlowYieldPct(6.0)
                .debtToEquity(0.3)
                .roe(30.0)
                .build())
            .technicals(StockTechnicals.builder()
                .price(110.0)
                .price52wHigh(115.0)
                .price52wLow(70.0)
                .sma20(108.0)
                .sma50(100.0)
                .sma200(90.0)
                .rsi14(62.0)
                .build())
            .sentiment(StockSentiment.builder()
                .analystConsensus(AnalystConsensus.BUY)
                .analystTargetMean(130.0)
                .newsThemes(List.of("Record cloud revenue", "New buyback program", "CFO transition", "Product launch"))
                .build())
            .build();
    }

    /** Ticker with nothing but a name. */
    public static StockData bareStock(String ticker) {
        return StockData.builder().ticker(ticker).name(ticker + " Inc").build();
    }

    public static StockData withFundamentals(StockFundamentals fundamentals) {
        return StockData.builder().ticker("TEST").name("Test Co").fundamentals(fundamentals).build();
    }

    public static AnalysisComposer composer(AnalyzerConfig config, Clock clock) {
        return new AnalysisComposer(
            new FundamentalAnalysisModule(config),
            new ValuationAnalysisModule(config),
            new TechnicalAnalysisModule(config),
            new SentimentAnalysisModule(config),
            new ScenarioProjector(),
            new PlanningGuidanceGenerator(),
            new AnalysisViewFormatter(),
            clock);
    }

    public static Clock fixedClock() {
        return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }

    /** Daily series starting 2024-01-01 with price(i) for each index. */
    public static HistoricalData series(String ticker, HistoricalPeriod period, int days, IntToDoubleFunction price) {
        List<HistoricalDataPoint> points = new ArrayList<>();
        LocalDate start = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < days; i++) {
            points.add(new HistoricalDataPoint(start.plusDays(i), price.applyAsDouble(i), 1_000_000.0 + i));
        }
        return HistoricalData.builder().ticker(ticker).period(period).dataPoints(points).build();
    }
}
