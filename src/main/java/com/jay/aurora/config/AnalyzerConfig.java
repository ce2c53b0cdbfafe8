package com.jay.aurora.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads and exposes all scoring thresholds from analyzer.yaml.
 * Values are read once at startup. A freshly constructed instance carries the built-in defaults,
 * which is what the engines use when they are created outside of Spring.
 */
@Slf4j
@Component
public class AnalyzerConfig {

    @Value("${analyzer.config-file:analyzer.yaml}")
    private String configFile = "analyzer.yaml";

    // ── Sections ──────────────────────────────────────────────────────────────
    private Fundamental fundamental = new Fundamental();
    private Valuation valuation = new Valuation();
    private Technical technical = new Technical();
    private Sentiment sentiment = new Sentiment();
    private Historical historical = new Historical();
    private Portfolio portfolio = new Portfolio();
    private ActiveManager activeManager = new ActiveManager();

    @PostConstruct
    public void load() {
        load(configFile);
    }

    /**
     * Replaces every section with the values found in the given classpath resource.
     * Sections missing from the file, or present with no value, keep their defaults.
     */
    public void load(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                log.warn("Config file '{}' not found on classpath — using defaults", resource);
                return;
            }
            ConfigRoot root = mapper.readValue(is, ConfigRoot.class);
            if (root == null) {
                log.warn("Config file '{}' is empty — using defaults", resource);
                return;
            }
            // An empty section key deserializes to null; the current section is kept
            if (root.getFundamental() != null)   this.fundamental   = root.getFundamental();
            if (root.getValuation() != null)     this.valuation     = root.getValuation();
            if (root.getTechnical() != null)     this.technical     = root.getTechnical();
            if (root.getSentiment() != null)     this.sentiment     = root.getSentiment();
            if (root.getHistorical() != null)    this.historical    = root.getHistorical();
            if (root.getPortfolio() != null)     this.portfolio     = root.getPortfolio();
            if (root.getActiveManager() != null) this.activeManager = root.getActiveManager();
            log.info("AnalyzerConfig loaded from '{}'. Sell weight: {}%, buy cap weight: {}%",
                resource, portfolio.getSellWeightPct(), activeManager.getBuyCapWeightPct());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file '" + resource + "'", e);
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────
    public Fundamental fundamental()     { return fundamental; }
    public Valuation valuation()         { return valuation; }
    public Technical technical()         { return technical; }
    public Sentiment sentiment()         { return sentiment; }
    public Historical historical()       { return historical; }
    public Portfolio portfolio()         { return portfolio; }
    public ActiveManager activeManager() { return activeManager; }

    // ── Config POJOs ──────────────────────────────────────────────────────────

    @Data public static class ConfigRoot {
        private Fundamental fundamental = new Fundamental();
        private Valuation valuation = new Valuation();
        private Technical technical = new Technical();
        private Sentiment sentiment = new Sentiment();
        private Historical historical = new Historical();
        private Portfolio portfolio = new Portfolio();
        private ActiveManager activeManager = new ActiveManager();
    }

    @Data public static class Fundamental {
        private double strongScore = 72;
        private double weakScore = 40;
    }

    @Data public static class Valuation {
        private double cheapScore = 65;
        private double richScore = 35;
        private double pegDiscountRatio = 1.0;
        private double pegDemandingRatio = 1.8;
        private double pegStretchedRatio = 3.0;
        private double minReliableGrowthPct = 5;
    }

    @Data public static class Technical {
        private double rsiOverbought = 70;
        private double rsiOversold = 30;
        private double nearHighPercentile = 80;
        private double nearLowPercentile = 20;
    }

    @Data public static class Sentiment {
        private double targetGapPct = 15;
    }

    @Data public static class Historical {
        private double upBreadth = 0.55;
        private double downBreadth = 0.45;
        private int tradingDaysPerYear = 252;
    }

    @Data public static class Portfolio {
        private double sellWeightPct = 25;
        private double trimWeightPct = 20;
        private double minMeaningfulWeightPct = 3;
        private double highConviction = 70;
        private double moderateConviction = 50;
        private double lowConviction = 40;
        private double concentrationWarningPct = 22;
        private double concentrationHighPct = 30;
        private double maxSinglePositionPct = 25;
    }

    @Data public static class ActiveManager {
        private double positiveReturnPct = 6;
        private double negativeReturnPct = -4;
        private double sellReturnPct = -8;
        private int highRiskScore = 8;
        private int elevatedRiskScore = 6;
        private double buyCapWeightPct = 20;
        private double forcedTrimWeightPct = 25;
        private int defaultConviction = 50;
    }
}
