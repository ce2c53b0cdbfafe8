package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.PegAssessment;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockFundamentals;
import com.jay.aurora.model.ValuationInsight;
import com.jay.aurora.model.enums.GrowthSource;
import com.jay.aurora.model.enums.PegBucket;
import com.jay.aurora.model.enums.ValuationClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.jay.aurora.layer2_analysis.MetricScorer.finite;

/**
 * Layer 2 — Valuation Analysis Module.
 * Balances growth-adjusted P/E (PEG) against earnings, free-cash-flow and dividend yields.
 *
 * Weighting (absent inputs drop out of numerator and denominator):
 *   PEG bucket 35% | Earnings yield 25% | FCF yield 25% | Dividend yield 15%
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ValuationAnalysisModule {

    static final String DATA_NOT_AVAILABLE = "Valuation data not available.";
    private static final int MAX_NOTES = 3;

    private final AnalyzerConfig config;

    private record GrowthMetric(double value, GrowthSource source) {}

    public ValuationInsight analyse(StockData stock) {
        StockFundamentals f = stock == null ? null : stock.getFundamentals();
        if (f == null) {
            return unknown();
        }

        Double pe            = priceToEarnings(f);
        PegAssessment peg    = assessPeg(f);
        Double earningsYield = pe != null && pe > 0 ? 100 / pe : null;
        Double fcfYield      = finite(f.getFreeCashFlowYieldPct());
        Double dividendYield = finite(f.getDividendYieldPct());

        // ── Composite score ───────────────────────────────────────────────────
        double weighted = 0;
        double totalWeight = 0;
        if (peg != null) {
            weighted += bucketScore(peg.getBucket()) * 0.35;
            totalWeight += 0.35;
        } else if (pe != null && pe > 0) {
            weighted += MetricScorer.scoreNegativeMetric(pe, 15, 35) * 0.35;
            totalWeight += 0.35;
        }
        if (earningsYield != null) {
            weighted += MetricScorer.scorePositiveMetric(earningsYield, 6, 2) * 0.25;
            totalWeight += 0.25;
        }
        if (fcfYield != null) {
            weighted += MetricScorer.scorePositiveMetric(fcfYield, 5, 1) * 0.25;
            totalWeight += 0.25;
        }
        if (dividendYield != null) {
            weighted += MetricScorer.scorePositiveMetric(dividendYield, 3, 0.2) * 0.15;
            totalWeight += 0.15;
        }
        if (totalWeight == 0) {
            return unknown();
        }

        int valuationScore = MetricScorer.roundScore(weighted / totalWeight * 100);
        AnalyzerConfig.Valuation cfg = config.valuation();

        ValuationClassification classification = ValuationClassification.FAIR;
        if (valuationScore >= cfg.getCheapScore()) classification = ValuationClassification.CHEAP;
        if (valuationScore < cfg.getRichScore())   classification = ValuationClassification.RICH;

        String commentary = switch (classification) {
            case CHEAP -> "Multiples screen at a discount relative to growth and cash generation";
            case RICH -> "Premium multiples rely on sustained growth to be justified";
            case FAIR, UNKNOWN -> "Valuation metrics look balanced versus growth profile";
        };

        // ── Drivers & cautions ────────────────────────────────────────────────
        List<String> drivers = new ArrayList<>();
        List<String> cautions = new ArrayList<>();

        if (peg != null) {
            switch (peg.getBucket()) {
                case DISCOUNT -> drivers.add("PEG screens below 1x relative to growth inputs");
                case BALANCED -> drivers.add("PEG roughly aligned with growth trajectory");
                case DEMANDING -> cautions.add("Growth-adjusted PEG above 1.8x carries premium expectations");
                case DISTORTED -> cautions.add("PEG distorted because growth is limited or negative");
            }
            if (peg.getNormalizedGrowthPct() != null && peg.getNormalizedGrowthPct() >= 20) {
                drivers.add(String.format(Locale.US, "%s running near %.0f%%",
                    capitalize(sourceText(peg.getGrowthSource())), peg.getNormalizedGrowthPct()));
            }
        }
        if (earningsYield != null) {
            if (earningsYield >= 6.5) {
                drivers.add(String.format(Locale.US, "Earnings yield %.1f%% clears 6%% hurdle", earningsYield));
            } else if (earningsYield < 3) {
                cautions.add("Earnings yield below 3% offers thin cash support");
            }
        }
        if (fcfYield != null) {
            if (fcfYield >= 5) {
                drivers.add("Free cash flow yield exceeds 5%");
            } else if (fcfYield < 1) {
                cautions.add("Free cash flow yield under 1% provides little downside protection");
            }
        }
        if (dividendYield != null && dividendYield >= 3) {
            drivers.add("Dividend yield north of 3% adds income support");
        }
        if (pe != null && pe >= 35) {
            cautions.add("Earnings multiples above 35x embed perfection");
        }

        // ── Commentary detail ─────────────────────────────────────────────────
        Double pegRatio = peg == null ? null : peg.getRatio();
        List<String> details = new ArrayList<>();
        if (pegRatio != null)      details.add(String.format(Locale.US, "PEG %.2f", pegRatio));
        if (peg != null)           details.add(peg.getCommentary());
        if (earningsYield != null) details.add(String.format(Locale.US, "Earnings yield %.1f%%", earningsYield));
        if (fcfYield != null)      details.add(String.format(Locale.US, "FCF yield %.1f%%", fcfYield));
        if (dividendYield != null) details.add(String.format(Locale.US, "Dividend yield %.2f%%", dividendYield));
        if (!details.isEmpty()) {
            commentary = commentary + " (" + String.join(" | ", details) + ")";
        }

        log.debug("Valuation {}: score={} class={} peg={}", stock.getTicker(), valuationScore, classification,
            peg == null ? "n/a" : peg.getBucket().label());

        return ValuationInsight.builder()
            .classification(classification)
            .valuationScore(valuationScore)
            .commentary(commentary)
            .pegRatio(pegRatio)
            .pegAssessment(peg)
            .earningsYieldPct(earningsYield)
            .freeCashFlowYieldPct(fcfYield)
            .dividendYieldPct(dividendYield)
            .drivers(MetricScorer.dedupe(drivers, MAX_NOTES))
            .cautionaryNotes(MetricScorer.dedupe(cautions, MAX_NOTES))
            .build();
    }

    /**
     * Buckets the growth-adjusted P/E. Returns {@code null} when no growth metric is known,
     * or when growth is reliable but no P/E is available.
     */
    public PegAssessment assessPeg(StockFundamentals f) {
        if (f == null) return null;
        GrowthMetric growth = selectGrowth(f);
        if (growth == null) return null;

        AnalyzerConfig.Valuation cfg = config.valuation();
        double g = growth.value();
        Double pe = priceToEarnings(f);
        String source = sourceText(growth.source());

        if (g <= 0) {
            return distorted(null, growth, capitalize(source) + " turned negative, so PEG loses meaning.");
        }
        if (g < cfg.getMinReliableGrowthPct()) {
            Double ratio = pe != null && pe > 0 ? pe / Math.max(g, 0.1) : null;
            return distorted(ratio, growth, String.format(Locale.US,
                "%s below %.0f%% makes PEG less reliable.", capitalize(source), cfg.getMinReliableGrowthPct()));
        }
        if (pe == null) return null;
        if (pe <= 0) {
            return distorted(null, growth, "Negative earnings multiple leaves PEG without meaning.");
        }

        double ratio = pe / g;
        PegBucket bucket = PegBucket.BALANCED;
        String commentary = "PEG indicates valuation is broadly aligned with growth.";
        if (ratio <= cfg.getPegDiscountRatio()) {
            bucket = PegBucket.DISCOUNT;
            commentary = "PEG below 1 suggests valuation is discounting future growth.";
        } else if (ratio >= cfg.getPegDemandingRatio()) {
            bucket = PegBucket.DEMANDING;
            commentary = ratio >= cfg.getPegStretchedRatio()
                ? "PEG above 3 signals stretched multiples relative to growth."
                : "PEG above 1.8 requires flawless execution to justify.";
        }

        return PegAssessment.builder()
            .bucket(bucket)
            .ratio(ratio)
            .normalizedGrowthPct(g)
            .growthSource(growth.source())
            .commentary(commentary)
            .build();
    }

    public static ValuationInsight unknown() {
        return ValuationInsight.builder()
            .classification(ValuationClassification.UNKNOWN)
            .valuationScore(0)
            .commentary(DATA_NOT_AVAILABLE)
            .build();
    }

    static double bucketScore(PegBucket bucket) {
        return switch (bucket) {
            case DISCOUNT -> 1.0;
            case BALANCED -> 0.7;
            case DEMANDING -> 0.25;
            case DISTORTED -> 0.45;
        };
    }

    private PegAssessment distorted(Double ratio, GrowthMetric growth, String commentary) {
        return PegAssessment.builder()
            .bucket(PegBucket.DISTORTED)
            .ratio(ratio)
            .normalizedGrowthPct(growth.value())
            .growthSource(growth.source())
            .commentary(commentary)
            .build();
    }

    private GrowthMetric selectGrowth(StockFundamentals f) {
        Double eps = finite(f.getEpsGrowthYoYPct());
        if (eps != null) return new GrowthMetric(eps, GrowthSource.EPS);
        Double revenue = finite(f.getRevenueGrowthYoYPct());
        if (revenue != null) return new GrowthMetric(revenue, GrowthSource.REVENUE);
        return null;
    }

    /** Forward P/E, falling back to trailing. */
    private Double priceToEarnings(StockFundamentals f) {
        Double forward = finite(f.getForwardPE());
        return forward != null ? forward : finite(f.getTrailingPE());
    }

    private static String sourceText(GrowthSource source) {
        return switch (source) {
            case EPS -> "EPS growth";
            case REVENUE -> "revenue growth";
        };
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
