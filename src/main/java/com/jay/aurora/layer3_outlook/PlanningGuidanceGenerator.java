package com.jay.aurora.layer3_outlook;

import com.jay.aurora.model.PlanningGuidance;
import com.jay.aurora.model.UserProfile;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 3 — Planning guidance in framework language ("many investors...", "typically...").
 * Educational only; nothing here is personalised advice.
 */
@Component
public class PlanningGuidanceGenerator {

    static final String LANGUAGE_NOTES =
        "This guidance is educational and framework-based. It does not constitute personalized financial advice.";

    public PlanningGuidance generate(UserProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("User profile is required for planning guidance");
        }

        List<String> riskNotes = new ArrayList<>(objectiveNotes(profile.getObjective()));
        riskNotes.add("All equity investments carry market risk and can lose value, especially in the short term.");
        riskNotes.add("Single-stock positions carry company-specific risk beyond general market risk.");

        return PlanningGuidance.builder()
            .positionSizing(positionSizing(profile.getRiskTolerance()))
            .timing(timing(profile.getHorizon()))
            .riskNotes(List.copyOf(riskNotes))
            .languageNotes(LANGUAGE_NOTES)
            .build();
    }

    private static List<String> positionSizing(RiskTolerance tolerance) {
        return switch (tolerance) {
            case LOW -> List.of(
                "Conservative investors often limit individual stock positions to 3-5% of total portfolio.",
                "Many risk-averse investors prefer diversifying across 20+ holdings.");
            case MODERATE -> List.of(
                "Moderate investors typically allocate 5-10% per position in growth stocks.",
                "Balanced portfolios often hold 12-20 positions for adequate diversification.");
            case HIGH -> List.of(
                "Growth-focused investors may allocate 10-15% to high-conviction positions.",
                "Concentrated portfolios typically hold 8-12 positions with careful monitoring.");
        };
    }

    private static List<String> timing(InvestmentHorizon horizon) {
        return switch (horizon) {
            case SHORT -> List.of(
                "Short-term investors often consider entry timing more carefully, watching for technical support levels.",
                "Some traders use dollar-cost averaging over 2-4 weeks to reduce timing risk.");
            case MEDIUM, LONG -> List.of(
                "Long-term investors often prioritize fundamental strength over short-term entry timing.",
                "Many long-horizon investors use systematic entry strategies over several months.");
        };
    }

    private static List<String> objectiveNotes(InvestmentObjective objective) {
        return switch (objective) {
            case INCOME -> List.of(
                "Income-focused investors typically compare dividend yield to bond yields and consider payout sustainability.");
            case GROWTH -> List.of(
                "Growth investors often accept higher volatility in exchange for potential capital appreciation.");
            case BALANCED -> List.of(
                "Balanced investors often weigh income stability alongside long-term capital growth.");
        };
    }
}
