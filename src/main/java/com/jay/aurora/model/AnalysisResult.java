package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

/**
 * Full analysis of a single stock for one investor profile.
 * {@code generatedAt} is the only field that depends on the clock.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisResult {
    String ticker;
    String name;
    AnalysisSummary summary;

    // ── Human-readable views ──────────────────────────────────────────────────
    String fundamentalsView;
    String valuationView;
    String technicalView;
    String sentimentView;

    ScenarioSummary scenarios;
    PlanningGuidance planningGuidance;
    FundamentalsInsight fundamentalsInsight;
    ValuationInsight valuationInsight;

    String disclaimer;
    String generatedAt;         // ISO-8601 instant
}
