package com.jay.aurora.layer5_report;

import com.jay.aurora.layer2_analysis.MetricScorer;
import com.jay.aurora.layer2_analysis.SentimentAnalysisModule.SentimentRead;
import com.jay.aurora.layer2_analysis.TechnicalAnalysisModule.TechnicalRead;
import com.jay.aurora.model.FundamentalsInsight;
import com.jay.aurora.model.StockFundamentals;
import com.jay.aurora.model.StockTechnicals;
import com.jay.aurora.model.ValuationInsight;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Layer 5 — Human-readable one-line views, parts separated by {@code " | "}.
 * Only typed values go in; no currency formatting or colour decisions happen here.
 */
@Component
public class AnalysisViewFormatter {

    private static final String SEPARATOR = " | ";

    public String fundamentalsView(StockFundamentals f, FundamentalsInsight insight) {
        if (f == null) return "Fundamentals data not available.";

        List<String> parts = new ArrayList<>();
        parts.add("Classification: " + upper(insight.getClassification().label()));
        if (insight.getQualityScore() > 0)         parts.add("Quality Score: " + insight.getQualityScore() + "/100");
        if (!insight.getDrivers().isEmpty())        parts.add("Drivers: " + String.join(", ", insight.getDrivers()));
        if (!insight.getCautionaryNotes().isEmpty()) parts.add("Watch: " + String.join(", ", insight.getCautionaryNotes()));

        metric(parts, "Trailing P/E", f.getTrailingPE(), "");
        metric(parts, "Forward P/E", f.getForwardPE(), "");
        metric(parts, "EPS Growth (YoY)", f.getEpsGrowthYoYPct(), "%");
        metric(parts, "Revenue Growth (YoY)", f.getRevenueGrowthYoYPct(), "%");
        metric(parts, "Net Margin", f.getNetMarginPct(), "%");
        metric(parts, "FCF Yield", f.getFreeCashFlowYieldPct(), "%");
        metric(parts, "ROE", f.getRoe(), "%");
        metric(parts, "Debt/Equity", f.getDebtToEquity(), "x");
        return String.join(SEPARATOR, parts);
    }

    public String valuationView(StockFundamentals f, ValuationInsight insight) {
        if (f == null) return "Valuation data not available.";

        List<String> parts = new ArrayList<>();
        parts.add("Classification: " + upper(insight.getClassification().label()));
        if (insight.getValuationScore() > 0)        parts.add("Composite Score: " + insight.getValuationScore() + "/100");
        if (insight.getCommentary() != null)         parts.add("Notes: " + insight.getCommentary());
        if (!insight.getDrivers().isEmpty())         parts.add("Drivers: " + String.join(", ", insight.getDrivers()));
        if (!insight.getCautionaryNotes().isEmpty()) parts.add("Watch: " + String.join(", ", insight.getCautionaryNotes()));

        if (insight.getPegRatio() != null) {
            parts.add(String.format(Locale.US, "PEG Ratio: %.2f", insight.getPegRatio()));
        }
        metric(parts, "Earnings Yield", insight.getEarningsYieldPct(), "%");
        metric(parts, "FCF Yield", insight.getFreeCashFlowYieldPct(), "%");
        if (insight.getDividendYieldPct() != null) {
            parts.add(String.format(Locale.US, "Dividend Yield: %.2f%%", insight.getDividendYieldPct()));
        }
        return String.join(SEPARATOR, parts);
    }

    public String technicalView(StockTechnicals t, TechnicalRead read) {
        if (t == null) return "Technical data not available.";

        List<String> parts = new ArrayList<>();
        parts.add("Trend: " + read.trend().label());
        parts.add("Momentum: " + read.momentum().label());
        parts.add("Position: " + read.pricePosition());
        metric(parts, "RSI(14)", t.getRsi14(), "");
        return String.join(SEPARATOR, parts);
    }

    public String sentimentView(SentimentRead read) {
        return String.join(SEPARATOR,
            "Analyst Consensus: " + read.consensusText(),
            "Target vs Price: " + read.targetVsPrice(),
            "News: " + read.newsHighlight());
    }

    private static void metric(List<String> parts, String label, Double value, String suffix) {
        Double v = MetricScorer.finite(value);
        if (v != null) {
            parts.add(String.format(Locale.US, "%s: %.1f%s", label, v, suffix));
        }
    }

    private static String upper(String label) {
        return label.toUpperCase(Locale.ROOT);
    }
}
