package com.jay.aurora.layer5_report;

import com.jay.aurora.layer2_analysis.FundamentalAnalysisModule;
import com.jay.aurora.layer2_analysis.SentimentAnalysisModule;
import com.jay.aurora.layer2_analysis.SentimentAnalysisModule.SentimentRead;
import com.jay.aurora.layer2_analysis.TechnicalAnalysisModule;
import com.jay.aurora.layer2_analysis.TechnicalAnalysisModule.TechnicalRead;
import com.jay.aurora.layer2_analysis.ValuationAnalysisModule;
import com.jay.aurora.layer3_outlook.PlanningGuidanceGenerator;
import com.jay.aurora.layer3_outlook.ScenarioProjector;
import com.jay.aurora.model.AnalysisOptions;
import com.jay.aurora.model.AnalysisResult;
import com.jay.aurora.model.AnalysisSummary;
import com.jay.aurora.model.FundamentalsInsight;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.ValuationInsight;
import com.jay.aurora.model.enums.FundamentalsClassification;
import com.jay.aurora.model.enums.TrendSignal;
import com.jay.aurora.model.enums.ValuationClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Layer 5 — Analysis Composer.
 * Runs every analysis module for one stock and one investor profile and assembles the
 * {@link AnalysisResult}. Deterministic for fixed inputs; the only clock read is {@code generatedAt}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisComposer {

    static final String DISCLAIMER =
        "This analysis is educational only and does not constitute financial advice. "
            + "Past performance is not a guide to future results. "
            + "Consider consulting a licensed financial professional before making investment decisions.";

    private final FundamentalAnalysisModule fundamentalModule;
    private final ValuationAnalysisModule valuationModule;
    private final TechnicalAnalysisModule technicalModule;
    private final SentimentAnalysisModule sentimentModule;
    private final ScenarioProjector scenarioProjector;
    private final PlanningGuidanceGenerator guidanceGenerator;
    private final AnalysisViewFormatter viewFormatter;
    private final Clock clock;

    public AnalysisResult analyzeStock(UserProfile profile, StockData stock) {
        return analyzeStock(profile, stock, AnalysisOptions.defaults());
    }

    /**
     * @throws IllegalArgumentException when the profile (or any of its fields) or the stock data is missing
     */
    public AnalysisResult analyzeStock(UserProfile profile, StockData stock, AnalysisOptions options) {
        if (profile == null || stock == null) {
            throw new IllegalArgumentException("User profile and stock data are required");
        }
        if (profile.getRiskTolerance() == null || profile.getHorizon() == null || profile.getObjective() == null) {
            throw new IllegalArgumentException("User profile requires risk tolerance, horizon and objective");
        }
        int horizonMonths = options == null ? AnalysisOptions.defaults().getHorizonMonths() : options.getHorizonMonths();
        String ticker = stock.getTicker() == null || stock.getTicker().isBlank() ? "UNKNOWN" : stock.getTicker();

        FundamentalsInsight fundamentals = fundamentalModule.analyse(stock);
        ValuationInsight valuation = valuationModule.analyse(stock);
        TechnicalRead technical = technicalModule.analyse(stock);
        SentimentRead sentiment = sentimentModule.analyse(stock);

        AnalysisSummary summary = summarise(profile, ticker, stock.getName(), fundamentals, valuation, technical, sentiment);
        log.debug("Analysis {}: fundamentals={} valuation={} risk={} conviction={}", ticker,
            fundamentals.getClassification(), valuation.getClassification(),
            summary.getRiskScore(), summary.getConvictionScore3m());

        return AnalysisResult.builder()
            .ticker(ticker)
            .name(stock.getName())
            .summary(summary)
            .fundamentalsView(viewFormatter.fundamentalsView(stock.getFundamentals(), fundamentals))
            .valuationView(viewFormatter.valuationView(stock.getFundamentals(), valuation))
            .technicalView(viewFormatter.technicalView(stock.getTechnicals(), technical))
            .sentimentView(viewFormatter.sentimentView(sentiment))
            .scenarios(scenarioProjector.project(profile, horizonMonths))
            .planningGuidance(guidanceGenerator.generate(profile))
            .fundamentalsInsight(fundamentals)
            .valuationInsight(valuation)
            .disclaimer(DISCLAIMER)
            .generatedAt(DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock)))
            .build();
    }

    // ── Summary ───────────────────────────────────────────────────────────────

    AnalysisSummary summarise(UserProfile profile, String ticker, String name,
                              FundamentalsInsight fundamentals, ValuationInsight valuation,
                              TechnicalRead technical, SentimentRead sentiment) {
        FundamentalsClassification fClass = fundamentals.getClassification();
        ValuationClassification vClass = valuation.getClassification();

        String headline = String.format("%s (%s) shows %s fundamentals with %s valuation.",
            name == null ? ticker : name, ticker, fClass.label(), vClass.label());
        if (vClass != ValuationClassification.UNKNOWN && valuation.getCommentary() != null) {
            headline = headline + " " + valuation.getCommentary();
        }

        return AnalysisSummary.builder()
            .headlineView(headline)
            .riskScore(riskScore(profile, vClass))
            .convictionScore3m(convictionScore(fClass, technical.trend()))
            .keyTakeaways(keyTakeaways(fundamentals, valuation, technical, sentiment))
            .build();
    }

    /** 1-10. Starts from the investor's tolerance, +2 for rich valuations, -1 for cheap ones. */
    static int riskScore(UserProfile profile, ValuationClassification valuation) {
        int score = switch (profile.getRiskTolerance()) {
            case LOW -> 3;
            case MODERATE -> 5;
            case HIGH -> 7;
        };
        if (valuation == ValuationClassification.RICH)  score += 2;
        if (valuation == ValuationClassification.CHEAP) score -= 1;
        return Math.max(1, Math.min(10, score));
    }

    static int convictionScore(FundamentalsClassification fundamentals, TrendSignal trend) {
        int conviction = 50;
        if (fundamentals == FundamentalsClassification.STRONG && trend == TrendSignal.BULLISH) conviction = 60;
        if (fundamentals == FundamentalsClassification.WEAK || trend == TrendSignal.BEARISH)  conviction = 40;
        return conviction;
    }

    private List<String> keyTakeaways(FundamentalsInsight fundamentals, ValuationInsight valuation,
                                      TechnicalRead technical, SentimentRead sentiment) {
        List<String> takeaways = new ArrayList<>();
        takeaways.add("Fundamentals: " + fundamentals.getClassification().label());
        takeaways.add("Quality score: " + fundamentals.getQualityScore() + "/100");
        takeaways.add("Valuation: " + valuation.getClassification().label());
        if (!fundamentals.getDrivers().isEmpty()) {
            takeaways.add("Key driver: " + fundamentals.getDrivers().get(0));
        }
        if (!fundamentals.getCautionaryNotes().isEmpty()) {
            takeaways.add("Watch list: " + fundamentals.getCautionaryNotes().get(0));
        }
        if (valuation.getCommentary() != null) {
            takeaways.add("Valuation context: " + valuation.getCommentary());
        }
        takeaways.add("Technical trend: " + technical.trend().label());
        takeaways.add("Analyst consensus: " + sentiment.consensusText());
        if (sentiment.hasTargetGap()) {
            takeaways.add("Analyst targets suggest " + sentiment.targetVsPrice());
        }
        return List.copyOf(takeaways);
    }
}
