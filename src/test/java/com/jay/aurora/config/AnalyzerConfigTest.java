package com.jay.aurora.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AnalyzerConfigTest {

    @Test
    void defaults_shouldMatchBuiltInThresholds() {
        AnalyzerConfig config = new AnalyzerConfig();

        assertEquals(25, config.portfolio().getSellWeightPct());
        assertEquals(20, config.activeManager().getBuyCapWeightPct());
        assertEquals(1.8, config.valuation().getPegDemandingRatio());
        assertEquals(252, config.historical().getTradingDaysPerYear());
    }

    @Test
    void load_shouldOverrideOnlyConfiguredValues() {
        AnalyzerConfig config = new AnalyzerConfig();

        config.load("analyzer-test.yaml");

        assertEquals(30, config.portfolio().getSellWeightPct());
        assertEquals(18, config.portfolio().getTrimWeightPct());
        assertEquals(70, config.portfolio().getHighConviction());
        assertEquals(15, config.activeManager().getBuyCapWeightPct());
        assertEquals(25, config.activeManager().getForcedTrimWeightPct());
        assertEquals(72, config.fundamental().getStrongScore());
    }

    @Test
    void load_shouldReadShippedFile() {
        AnalyzerConfig config = new AnalyzerConfig();

        config.load("analyzer.yaml");

        assertEquals(65, config.valuation().getCheapScore());
        assertEquals(-8, config.activeManager().getSellReturnPct());
    }

    @Test
    void load_shouldKeepDefaultsWhenFileMissing() {
        AnalyzerConfig config = new AnalyzerConfig();

        config.load("does-not-exist.yaml");

        assertEquals(25, config.portfolio().getSellWeightPct());
    }

    @Test
    void load_shouldKeepDefaultsForEmptySections() {
        AnalyzerConfig config = new AnalyzerConfig();

        config.load("analyzer-empty-sections.yaml");

        assertEquals(25, config.portfolio().getSellWeightPct());
        assertEquals(20, config.activeManager().getBuyCapWeightPct());
        assertEquals(60, config.valuation().getCheapScore());
        assertEquals(72, config.fundamental().getStrongScore());
    }
}
