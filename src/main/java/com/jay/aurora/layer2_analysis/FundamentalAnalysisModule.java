package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.FundamentalsInsight;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockFundamentals;
import com.jay.aurora.model.enums.FundamentalsClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.jay.aurora.layer2_analysis.MetricScorer.finite;
import static com.jay.aurora.layer2_analysis.MetricScorer.scoreNegativeOrZero;
import static com.jay.aurora.layer2_analysis.MetricScorer.scorePositiveOrZero;

/**
 * Layer 2 — Fundamental Analysis Module.
 * Scores business quality 0-100 from growth, profitability, cash generation and leverage.
 *
 * Weighting:
 *   EPS growth 25% | Net margin 20% | FCF yield 20% | ROE 15% | Revenue growth 10% | Debt/equity 10%
 *
 * A metric missing from the input contributes zero to the composite.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FundamentalAnalysisModule {

    static final String DATA_NOT_AVAILABLE = "Fundamentals data not available.";
    private static final int MAX_DRIVERS = 3;

    private final AnalyzerConfig config;

    public FundamentalsInsight analyse(StockData stock) {
        StockFundamentals f = stock == null ? null : stock.getFundamentals();
        if (f == null || !hasScoredMetric(f)) {
            return unknown();
        }

        int qualityScore = qualityScore(f);
        AnalyzerConfig.Fundamental cfg = config.fundamental();

        FundamentalsClassification classification = FundamentalsClassification.OK;
        if (qualityScore >= cfg.getStrongScore()) classification = FundamentalsClassification.STRONG;
        if (qualityScore < cfg.getWeakScore())    classification = FundamentalsClassification.WEAK;

        Double eps      = finite(f.getEpsGrowthYoYPct());
        Double margin   = finite(f.getNetMarginPct());
        Double fcf      = finite(f.getFreeCashFlowYieldPct());
        Double roe      = finite(f.getRoe());
        Double revenue  = finite(f.getRevenueGrowthYoYPct());
        Double leverage = finite(f.getDebtToEquity());

        // ── Drivers ───────────────────────────────────────────────────────────
        List<String> drivers = new ArrayList<>();
        if (eps != null && eps >= 18)         drivers.add("EPS growth is running above 18%");
        if (margin != null && margin >= 22)   drivers.add("Margins exceed 22%");
        if (fcf != null && fcf >= 4)          drivers.add("Free cash flow yield surpasses 4%");
        if (roe != null && roe >= 25)         drivers.add("ROE is north of 25%");
        if (revenue != null && revenue >= 12) drivers.add("Revenue is compounding at double-digit rates");

        // ── Cautions ──────────────────────────────────────────────────────────
        List<String> cautions = new ArrayList<>();
        if (leverage != null && leverage > 2.5) cautions.add("Leverage is elevated (debt-to-equity > 2.5x)");
        if (fcf != null && fcf < 0.5)           cautions.add("Limited free cash flow support (< 0.5%)");
        if (eps != null && eps < 0)             cautions.add("Recent EPS trend turned negative");
        if (margin != null && margin < 8)       cautions.add("Net margins are below 8%");

        if (classification == FundamentalsClassification.STRONG && !cautions.isEmpty()) {
            classification = FundamentalsClassification.OK;
        }

        log.debug("Fundamentals {}: score={} class={} drivers={} cautions={}",
            stock.getTicker(), qualityScore, classification, drivers.size(), cautions.size());

        return FundamentalsInsight.builder()
            .classification(classification)
            .qualityScore(qualityScore)
            .drivers(List.copyOf(drivers.subList(0, Math.min(MAX_DRIVERS, drivers.size()))))
            .cautionaryNotes(List.copyOf(cautions))
            .build();
    }

    /** Weighted composite 0-100; absent metrics score zero. */
    public int qualityScore(StockFundamentals f) {
        if (f == null) return 0;
        double weighted =
              scorePositiveOrZero(f.getEpsGrowthYoYPct(), 20, 0)        * 0.25
            + scorePositiveOrZero(f.getNetMarginPct(), 22, 5)           * 0.20
            + scorePositiveOrZero(f.getFreeCashFlowYieldPct(), 5, 0.5)  * 0.20
            + scorePositiveOrZero(f.getRoe(), 25, 8)                    * 0.15
            + scorePositiveOrZero(f.getRevenueGrowthYoYPct(), 12, -5)   * 0.10
            + scoreNegativeOrZero(f.getDebtToEquity(), 0.8, 3)          * 0.10;
        return MetricScorer.roundScore(weighted * 100);
    }

    public static FundamentalsInsight unknown() {
        return FundamentalsInsight.builder()
            .classification(FundamentalsClassification.UNKNOWN)
            .qualityScore(0)
            .cautionaryNotes(List.of(DATA_NOT_AVAILABLE))
            .build();
    }

    private boolean hasScoredMetric(StockFundamentals f) {
        return MetricScorer.isPresent(f.getEpsGrowthYoYPct())
            || MetricScorer.isPresent(f.getNetMarginPct())
            || MetricScorer.isPresent(f.getFreeCashFlowYieldPct())
            || MetricScorer.isPresent(f.getRoe())
            || MetricScorer.isPresent(f.getRevenueGrowthYoYPct())
            || MetricScorer.isPresent(f.getDebtToEquity());
    }
}
