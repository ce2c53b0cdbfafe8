package com.jay.aurora.layer2_analysis;

import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.HistoricalDataPoint;
import com.jay.aurora.model.StockTechnicals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;

import java.time.ZoneOffset;
import java.util.List;

/**
 * Layer 2 — Indicator calculator.
 * Derives moving averages, RSI(14), the 52-week range and volume figures from a daily
 * close series using ta4j. Each indicator is only reported once the series is long enough.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TechnicalIndicatorCalculator {

    private static final int RSI_PERIOD = 14;
    private static final int AVG_VOLUME_PERIOD = 20;

    private final HistoricalSeriesAnalytics analytics;

    public StockTechnicals calculate(HistoricalData data) {
        List<HistoricalDataPoint> points = analytics.normalize(data);
        if (points.isEmpty()) {
            return StockTechnicals.builder().build();
        }

        BarSeries series = buildSeries(data.getTicker(), points);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        VolumeIndicator volume = new VolumeIndicator(series);
        int last = series.getEndIndex();
        int count = series.getBarCount();
        int yearWindow = Math.min(count, 252);

        // ── Moving Averages ────────────────────────────────────────────────────
        Double sma20  = count >= 20  ? new SMAIndicator(close, 20).getValue(last).doubleValue()  : null;
        Double sma50  = count >= 50  ? new SMAIndicator(close, 50).getValue(last).doubleValue()  : null;
        Double sma200 = count >= 200 ? new SMAIndicator(close, 200).getValue(last).doubleValue() : null;

        // ── RSI ────────────────────────────────────────────────────────────────
        Double rsi = count > RSI_PERIOD ? new RSIIndicator(close, RSI_PERIOD).getValue(last).doubleValue() : null;

        // ── 52-week range ──────────────────────────────────────────────────────
        double high = new HighestValueIndicator(close, yearWindow).getValue(last).doubleValue();
        double low  = new LowestValueIndicator(close, yearWindow).getValue(last).doubleValue();

        // ── Volume ─────────────────────────────────────────────────────────────
        boolean hasVolume = points.stream().anyMatch(p -> MetricScorer.isPresent(p.getVolume()));
        Double lastVolume = hasVolume ? volume.getValue(last).doubleValue() : null;
        Double avgVolume  = hasVolume
            ? new SMAIndicator(volume, Math.min(count, AVG_VOLUME_PERIOD)).getValue(last).doubleValue()
            : null;

        log.debug("Indicators {} over {} bars: sma50={} sma200={} rsi={}", data.getTicker(), count, sma50, sma200, rsi);

        return StockTechnicals.builder()
            .price(close.getValue(last).doubleValue())
            .price52wHigh(high)
            .price52wLow(low)
            .sma20(sma20)
            .sma50(sma50)
            .sma200(sma200)
            .rsi14(rsi)
            .volume(lastVolume)
            .avgVolume(avgVolume)
            .build();
    }

    /** Fills the fields the provider left empty. Provider-supplied values always win. */
    public StockTechnicals enrich(StockTechnicals provided, HistoricalData data) {
        StockTechnicals computed = calculate(data);
        if (provided == null) return computed;
        return provided.toBuilder()
            .price(prefer(provided.getPrice(), computed.getPrice()))
            .price52wHigh(prefer(provided.getPrice52wHigh(), computed.getPrice52wHigh()))
            .price52wLow(prefer(provided.getPrice52wLow(), computed.getPrice52wLow()))
            .sma20(prefer(provided.getSma20(), computed.getSma20()))
            .sma50(prefer(provided.getSma50(), computed.getSma50()))
            .sma200(prefer(provided.getSma200(), computed.getSma200()))
            .rsi14(prefer(provided.getRsi14(), computed.getRsi14()))
            .volume(prefer(provided.getVolume(), computed.getVolume()))
            .avgVolume(prefer(provided.getAvgVolume(), computed.getAvgVolume()))
            .build();
    }

    private static Double prefer(Double provided, Double computed) {
        return MetricScorer.isPresent(provided) ? provided : computed;
    }

    private BarSeries buildSeries(String ticker, List<HistoricalDataPoint> points) {
        BarSeries series = new BaseBarSeriesBuilder().withName(ticker == null ? "series" : ticker).build();
        for (HistoricalDataPoint point : points) {
            double price = point.getPrice();
            Double vol = MetricScorer.finite(point.getVolume());
            // Only closes are known; open/high/low collapse onto the close
            series.addBar(point.getDate().atStartOfDay(ZoneOffset.UTC).plusHours(16),
                price, price, price, price, vol == null ? 0 : vol);
        }
        return series;
    }
}
