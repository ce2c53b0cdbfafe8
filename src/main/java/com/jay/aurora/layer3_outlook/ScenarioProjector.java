package com.jay.aurora.layer3_outlook;

import com.jay.aurora.layer2_analysis.MetricScorer;
import com.jay.aurora.model.ReturnRange;
import com.jay.aurora.model.ScenarioBand;
import com.jay.aurora.model.ScenarioSummary;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.RiskTolerance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Layer 3 — Scenario Projector.
 * Bull / base / bear return bands for the horizon, tuned by risk tolerance,
 * with fixed 25 / 50 / 25 probabilities and a probability-weighted point estimate.
 * The bands are illustrative, not forecasts.
 */
@Slf4j
@Component
public class ScenarioProjector {

    static final int BULL_PROBABILITY = 25;
    static final int BASE_PROBABILITY = 50;
    static final int BEAR_PROBABILITY = 25;

    static final String UNCERTAINTY_COMMENT =
        "These scenarios are illustrative only and do not constitute predictions. Actual results may vary significantly.";

    private record Bands(ReturnRange bull, ReturnRange base, ReturnRange bear) {}

    public ScenarioSummary project(UserProfile profile, int horizonMonths) {
        RiskTolerance tolerance = profile == null || profile.getRiskTolerance() == null
            ? RiskTolerance.MODERATE
            : profile.getRiskTolerance();
        Bands bands = bandsFor(tolerance);

        double pointEstimate = bands.bull().midpoint() * BULL_PROBABILITY / 100.0
            + bands.base().midpoint() * BASE_PROBABILITY / 100.0
            + bands.bear().midpoint() * BEAR_PROBABILITY / 100.0;

        return ScenarioSummary.builder()
            .horizonMonths(horizonMonths)
            .bull(band(bands.bull(), BULL_PROBABILITY, "Positive catalysts materialize, market sentiment improves"))
            .base(band(bands.base(), BASE_PROBABILITY, "Current trends continue, no major surprises"))
            .bear(band(bands.bear(), BEAR_PROBABILITY, "Negative developments or broader market weakness"))
            .pointEstimateReturnPct(MetricScorer.round(pointEstimate, 1))
            .uncertaintyComment(UNCERTAINTY_COMMENT)
            .build();
    }

    private static Bands bandsFor(RiskTolerance tolerance) {
        return switch (tolerance) {
            case LOW -> new Bands(new ReturnRange(6, 12), new ReturnRange(-4, 5), new ReturnRange(-12, -3));
            case MODERATE -> new Bands(new ReturnRange(8, 15), new ReturnRange(-6, 7), new ReturnRange(-15, -5));
            case HIGH -> new Bands(new ReturnRange(10, 18), new ReturnRange(-8, 9), new ReturnRange(-20, -7));
        };
    }

    private static ScenarioBand band(ReturnRange range, int probability, String description) {
        return ScenarioBand.builder()
            .expectedReturnPctRange(range)
            .probabilityPct(probability)
            .description(description)
            .build();
    }
}
