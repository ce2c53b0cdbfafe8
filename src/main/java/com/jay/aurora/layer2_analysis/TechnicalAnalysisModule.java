package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockTechnicals;
import com.jay.aurora.model.enums.MomentumSignal;
import com.jay.aurora.model.enums.TrendSignal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.jay.aurora.layer2_analysis.MetricScorer.finite;

/**
 * Layer 2 — Technical Analysis Module.
 * Reads trend from the moving-average stack, momentum from RSI(14) and
 * where price sits inside its 52-week range. Missing inputs fall back to neutral.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TechnicalAnalysisModule {

    public static final String NEAR_HIGH = "Near 52-week high";
    public static final String NEAR_LOW  = "Near 52-week low";
    public static final String MID_RANGE = "Mid-range";
    public static final String UNKNOWN   = "Unknown";

    private final AnalyzerConfig config;

    public record TechnicalRead(TrendSignal trend, MomentumSignal momentum, String pricePosition) {
        public static TechnicalRead neutral() {
            return new TechnicalRead(TrendSignal.NEUTRAL, MomentumSignal.NEUTRAL, UNKNOWN);
        }
    }

    public TechnicalRead analyse(StockData stock) {
        StockTechnicals t = stock == null ? null : stock.getTechnicals();
        if (t == null) {
            return TechnicalRead.neutral();
        }

        Double price = finite(t.getPrice());
        TechnicalRead read = new TechnicalRead(
            trend(price, finite(t.getSma50()), finite(t.getSma200())),
            momentum(finite(t.getRsi14())),
            pricePosition(price, finite(t.getPrice52wHigh()), finite(t.getPrice52wLow())));

        log.debug("Technicals {}: trend={} momentum={} position={}",
            stock.getTicker(), read.trend(), read.momentum(), read.pricePosition());
        return read;
    }

    // ── Trend (price vs SMA50 vs SMA200) ─────────────────────────────────────
    TrendSignal trend(Double price, Double sma50, Double sma200) {
        if (price == null || sma50 == null || sma200 == null) return TrendSignal.NEUTRAL;
        if (price > sma50 && sma50 > sma200) return TrendSignal.BULLISH;
        if (price < sma50 && sma50 < sma200) return TrendSignal.BEARISH;
        return TrendSignal.NEUTRAL;
    }

    // ── Momentum (RSI 14) ─────────────────────────────────────────────────────
    MomentumSignal momentum(Double rsi) {
        if (rsi == null) return MomentumSignal.NEUTRAL;
        AnalyzerConfig.Technical cfg = config.technical();
        if (rsi > cfg.getRsiOverbought()) return MomentumSignal.OVERBOUGHT;
        if (rsi < cfg.getRsiOversold())   return MomentumSignal.OVERSOLD;
        return MomentumSignal.NEUTRAL;
    }

    // ── 52-week range percentile ─────────────────────────────────────────────
    String pricePosition(Double price, Double high, Double low) {
        if (price == null) return UNKNOWN;
        if (high == null || low == null || high <= low) return MID_RANGE;

        AnalyzerConfig.Technical cfg = config.technical();
        double pct = (price - low) / (high - low) * 100;
        if (pct > cfg.getNearHighPercentile()) return NEAR_HIGH;
        if (pct < cfg.getNearLowPercentile())  return NEAR_LOW;
        return MID_RANGE;
    }
}
