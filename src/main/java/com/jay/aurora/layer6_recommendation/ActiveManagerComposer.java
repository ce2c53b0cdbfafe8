package com.jay.aurora.layer6_recommendation;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.layer2_analysis.MetricScorer;
import com.jay.aurora.layer4_risk.PortfolioActionEngine;
import com.jay.aurora.model.ActiveManagerRecommendation;
import com.jay.aurora.model.AnalysisResult;
import com.jay.aurora.model.Portfolio;
import com.jay.aurora.model.PortfolioActionSuggestion;
import com.jay.aurora.model.PortfolioContext;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.ActiveManagerHorizon;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.PortfolioAction;
import com.jay.aurora.model.enums.ReturnBias;
import com.jay.aurora.model.enums.RiskTolerance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Layer 6 — Active Manager recommendation.
 * Turns an {@link AnalysisResult} into one buy / hold / trim / sell call for the investor.
 *
 * Pipeline (each stage may only reduce exposure):
 *   1. return bias from the scenario point estimate
 *   2. base action from bias
 *   3. risk guardrails (risk score, buy cap, forced trim)
 *   4. portfolio override from the action engine, then guardrails again
 *   5. profile adjustment for low / high tolerance
 *   6. final guardrail pass
 *
 * Guardrails always have the last word.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActiveManagerComposer {

    static final String EDUCATIONAL_NOTE =
        "Framework-based output for education only. It is not personalized financial advice.";

    private final AnalyzerConfig config;
    private final PortfolioActionEngine portfolioEngine;

    /** Mutable working state for one recommendation. */
    private static final class Draft {
        PortfolioAction action;
        final List<String> rationale = new ArrayList<>();
        final List<String> riskFlags = new ArrayList<>();
        final List<String> notes = new ArrayList<>();
    }

    public ActiveManagerRecommendation buildRecommendation(AnalysisResult analysis, UserProfile profile) {
        return buildRecommendation(analysis, profile, null);
    }

    /**
     * @return the recommendation, or {@code null} when the analysis or its ticker is missing
     * @throws IllegalArgumentException when the profile is missing
     */
    public ActiveManagerRecommendation buildRecommendation(AnalysisResult analysis, UserProfile profile,
                                                           PortfolioContext context) {
        if (profile == null || profile.getRiskTolerance() == null || profile.getHorizon() == null) {
            throw new IllegalArgumentException("User profile is required for an active manager recommendation");
        }
        if (analysis == null || analysis.getTicker() == null || analysis.getTicker().isBlank()) {
            log.warn("Active manager recommendation skipped: analysis or ticker missing");
            return null;
        }

        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        String ticker = analysis.getTicker();
        Double pointEstimate = pointEstimate(analysis);
        int riskScore = analysis.getSummary() == null ? 5 : analysis.getSummary().getRiskScore();
        Integer conviction = analysis.getSummary() == null ? null : analysis.getSummary().getConvictionScore3m();
        int baseConviction = conviction == null ? cfg.getDefaultConviction() : conviction;
        double weight = positionWeight(context);

        Draft draft = new Draft();

        // ── 1. Return bias ────────────────────────────────────────────────────
        ReturnBias bias = returnBias(pointEstimate);
        draft.rationale.add(biasRationale(bias, pointEstimate));

        // ── 2. Base action ────────────────────────────────────────────────────
        draft.action = switch (bias) {
            case POSITIVE -> PortfolioAction.BUY;
            case NEGATIVE -> pointEstimate <= cfg.getSellReturnPct() ? PortfolioAction.SELL : PortfolioAction.TRIM;
            case NEUTRAL -> PortfolioAction.HOLD;
        };

        // ── 3. Risk guardrails ────────────────────────────────────────────────
        applyGuardrails(draft, riskScore, weight);

        // ── 4. Portfolio override ─────────────────────────────────────────────
        if (context != null) {
            PortfolioActionSuggestion suggestion = portfolioEngine.suggestPortfolioAction(
                ticker, portfolioFor(context), weight, baseConviction);
            if (suggestion.action() != draft.action) {
                draft.notes.add(String.format("Portfolio context changed the call from %s to %s.",
                    draft.action.label(), suggestion.action().label()));
            }
            draft.action = suggestion.action();
            draft.rationale.addAll(suggestion.reasoning());
            if (context.getReasoning() != null) {
                draft.rationale.addAll(context.getReasoning());
            }
            applyGuardrails(draft, riskScore, weight);
        }

        // ── 5. Profile adjustment ─────────────────────────────────────────────
        RiskTolerance tolerance = profile.getRiskTolerance();
        if (tolerance == RiskTolerance.LOW && draft.action == PortfolioAction.BUY && bias != ReturnBias.POSITIVE) {
            draft.action = PortfolioAction.HOLD;
            draft.notes.add("Low risk tolerance: buy softened to hold because the return bias is not positive.");
        }
        if (tolerance == RiskTolerance.HIGH && draft.action == PortfolioAction.TRIM && bias != ReturnBias.NEGATIVE) {
            draft.action = PortfolioAction.HOLD;
            draft.notes.add("High risk tolerance: trim relaxed to hold because the return bias is not negative.");
        }

        // ── 6. Final guardrail pass ───────────────────────────────────────────
        applyGuardrails(draft, riskScore, weight);

        collectRiskFlags(draft, profile, riskScore, weight);
        draft.rationale.add(convictionRationale(baseConviction));
        draft.notes.add(EDUCATIONAL_NOTE);

        int confidence = confidenceScore(baseConviction, bias, riskScore, weight, tolerance);
        ActiveManagerRecommendation recommendation = ActiveManagerRecommendation.builder()
            .ticker(ticker)
            .primaryAction(draft.action)
            .horizon(horizon(profile.getHorizon()))
            .confidenceScore(confidence)
            .expectedReturn3m(pointEstimate)
            .headline(headline(draft.action, pointEstimate))
            .rationale(MetricScorer.dedupe(draft.rationale))
            .riskFlags(MetricScorer.dedupe(draft.riskFlags))
            .notes(MetricScorer.dedupe(draft.notes))
            .build();

        log.debug("Active manager {}: bias={} action={} confidence={} weight={}%",
            ticker, bias, draft.action, confidence, weight);
        return recommendation;
    }

    // ── Stages ────────────────────────────────────────────────────────────────

    ReturnBias returnBias(Double pointEstimate) {
        if (pointEstimate == null) return ReturnBias.NEUTRAL;
        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        if (pointEstimate >= cfg.getPositiveReturnPct()) return ReturnBias.POSITIVE;
        if (pointEstimate <= cfg.getNegativeReturnPct()) return ReturnBias.NEGATIVE;
        return ReturnBias.NEUTRAL;
    }

    /** Action left after the risk guardrails alone. */
    PortfolioAction guard(PortfolioAction action, int riskScore, double weight) {
        Draft draft = new Draft();
        draft.action = action;
        applyGuardrails(draft, riskScore, weight);
        return draft.action;
    }

    /** Rules run in order; a buy blocked by risk is then eligible for the forced trim. */
    private void applyGuardrails(Draft draft, int riskScore, double weight) {
        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        if (riskScore >= cfg.getHighRiskScore() && draft.action == PortfolioAction.BUY) {
            draft.action = PortfolioAction.HOLD;
            draft.notes.add(String.format("Guardrail: buy held back because risk score %d/10 is at or above %d.",
                riskScore, cfg.getHighRiskScore()));
        }
        if (weight >= cfg.getBuyCapWeightPct() && draft.action == PortfolioAction.BUY) {
            draft.action = PortfolioAction.HOLD;
            draft.notes.add(String.format(Locale.US,
                "Guardrail: buy held back because the position is already %.1f%% of the portfolio (cap %.0f%%).",
                weight, cfg.getBuyCapWeightPct()));
        }
        if (weight >= cfg.getForcedTrimWeightPct() && draft.action == PortfolioAction.HOLD) {
            draft.action = PortfolioAction.TRIM;
            draft.notes.add(String.format(Locale.US,
                "Guardrail: hold moved to trim because %.1f%% exceeds the %.0f%% concentration limit.",
                weight, cfg.getForcedTrimWeightPct()));
        }
    }

    private void collectRiskFlags(Draft draft, UserProfile profile, int riskScore, double weight) {
        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        if (riskScore >= cfg.getHighRiskScore()) {
            draft.riskFlags.add(String.format("Risk score %d/10 signals significant uncertainty in return estimates.",
                riskScore));
        } else if (riskScore >= cfg.getElevatedRiskScore()) {
            draft.riskFlags.add(String.format("Risk score %d/10 is elevated for this holding.", riskScore));
        }
        if (weight >= cfg.getForcedTrimWeightPct()) {
            draft.riskFlags.add(String.format(Locale.US,
                "Position weight of %.1f%% exceeds the %.0f%% concentration limit for diversified portfolios.",
                weight, cfg.getForcedTrimWeightPct()));
        } else if (weight >= cfg.getBuyCapWeightPct()) {
            draft.riskFlags.add(String.format(Locale.US,
                "Position weight of %.1f%% is above the %.0f%% cap for adding more.",
                weight, cfg.getBuyCapWeightPct()));
        }
        if (profile.getRiskTolerance() == RiskTolerance.LOW && riskScore >= cfg.getElevatedRiskScore()) {
            draft.riskFlags.add("Risk level may exceed tolerance parameters for conservative profiles.");
        }
    }

    /** Starts from conviction and adjusts for bias, risk, weight and tolerance; clamped to 0-100. */
    int confidenceScore(int conviction, ReturnBias bias, int riskScore, double weight, RiskTolerance tolerance) {
        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        double score = conviction;
        if (bias == ReturnBias.POSITIVE) score += 5;
        if (bias == ReturnBias.NEGATIVE) score -= 10;
        if (riskScore >= cfg.getHighRiskScore()) score -= 15;
        else if (riskScore >= cfg.getElevatedRiskScore()) score -= 5;
        if (weight >= cfg.getBuyCapWeightPct()) score -= 10;
        if (tolerance == RiskTolerance.HIGH && bias == ReturnBias.POSITIVE && riskScore < cfg.getHighRiskScore()) {
            score += 5;
        }
        if (tolerance == RiskTolerance.LOW && bias == ReturnBias.POSITIVE) score -= 5;
        return MetricScorer.roundScore(score);
    }

    static ActiveManagerHorizon horizon(InvestmentHorizon horizon) {
        return switch (horizon) {
            case SHORT -> ActiveManagerHorizon.SHORT_TERM;
            case MEDIUM -> ActiveManagerHorizon.MEDIUM_TERM;
            case LONG -> ActiveManagerHorizon.LONG_TERM;
        };
    }

    static String headline(PortfolioAction action, Double pointEstimate) {
        String verb = actionVerb(action);
        if (pointEstimate == null) {
            return verb + " – no 3M return estimate available";
        }
        return String.format(Locale.US, "%s – %s%.1f%% expected over 3M",
            verb, pointEstimate >= 0 ? "+" : "", pointEstimate);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String actionVerb(PortfolioAction action) {
        return switch (action) {
            case BUY -> "Buy";
            case HOLD -> "Hold";
            case TRIM -> "Trim";
            case SELL -> "Sell";
        };
    }

    private String biasRationale(ReturnBias bias, Double pointEstimate) {
        AnalyzerConfig.ActiveManager cfg = config.activeManager();
        if (pointEstimate == null) {
            return "No scenario estimate is available, so the return bias is treated as neutral.";
        }
        return switch (bias) {
            case POSITIVE -> String.format(Locale.US,
                "Probability-weighted 3M estimate of %+.1f%% clears the %+.0f%% positive-bias threshold.",
                pointEstimate, cfg.getPositiveReturnPct());
            case NEGATIVE -> String.format(Locale.US,
                "Probability-weighted 3M estimate of %+.1f%% is at or below the %+.0f%% negative-bias threshold.",
                pointEstimate, cfg.getNegativeReturnPct());
            case NEUTRAL -> String.format(Locale.US,
                "Probability-weighted 3M estimate of %+.1f%% sits between the bias thresholds, so the outlook is neutral.",
                pointEstimate);
        };
    }

    private String convictionRationale(int conviction) {
        AnalyzerConfig.Portfolio cfg = config.portfolio();
        if (conviction >= cfg.getHighConviction()) {
            return String.format("Framework conviction score of %d suggests the outlook aligns with similar investor profiles.",
                conviction);
        }
        if (conviction >= cfg.getModerateConviction()) {
            return String.format("Moderate conviction level (%d/100) indicates a balanced opportunity-risk profile.",
                conviction);
        }
        return String.format("Lower conviction score (%d/100) suggests cautious positioning may be prudent.", conviction);
    }

    private static Double pointEstimate(AnalysisResult analysis) {
        if (analysis.getScenarios() == null) return null;
        return MetricScorer.finite(analysis.getScenarios().getPointEstimateReturnPct());
    }

    private static double positionWeight(PortfolioContext context) {
        if (context == null) return 0;
        Double weight = MetricScorer.finite(context.getPositionWeightPct());
        return weight == null ? 0 : weight;
    }

    /** The stored portfolio, or a single-holding portfolio built from the existing position. */
    private static Portfolio portfolioFor(PortfolioContext context) {
        if (context.getPortfolio() != null) return context.getPortfolio();
        if (context.getExistingHolding() == null) {
            return Portfolio.builder().id(context.getPortfolioId()).build();
        }
        return Portfolio.builder()
            .id(context.getPortfolioId())
            .holdings(List.of(context.getExistingHolding()))
            .build();
    }
}
