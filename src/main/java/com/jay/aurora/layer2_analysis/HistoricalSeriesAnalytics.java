package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.HistoricalDataPoint;
import com.jay.aurora.model.enums.HistoricalPeriod;
import com.jay.aurora.model.enums.PriceTrend;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Layer 2 — Historical series analytics.
 * Returns, annualised volatility and trend for a daily price series.
 * Every entry point normalises its input first: invalid points are dropped,
 * duplicate dates collapse to the last one seen, and points are sorted ascending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistoricalSeriesAnalytics {

    private static final HistoricalPeriod DEFAULT_PERIOD = HistoricalPeriod.SIX_MONTHS;

    private final AnalyzerConfig config;

    public record SeriesReturns(double periodPct, double annualizedPct) {
        public static final SeriesReturns ZERO = new SeriesReturns(0, 0);
    }

    public SeriesReturns calculateReturns(HistoricalData data) {
        List<HistoricalDataPoint> points = normalize(data);
        if (points.size() < 2) return SeriesReturns.ZERO;

        double start = first(points);
        double end = last(points);
        double rawReturn = (end - start) / start * 100;
        double years = months(period(data)) / 12.0;
        double annualized = (Math.pow(end / start, 1 / years) - 1) * 100;

        return new SeriesReturns(MetricScorer.round(rawReturn, 2), MetricScorer.round(annualized, 2));
    }

    /** Population standard deviation of daily simple returns, annualised, in percent. */
    public double calculateVolatility(HistoricalData data) {
        List<HistoricalDataPoint> points = normalize(data);
        if (points.size() < 2) return 0;

        double[] returns = new double[points.size() - 1];
        for (int i = 1; i < points.size(); i++) {
            double prev = points.get(i - 1).getPrice();
            returns[i - 1] = (points.get(i).getPrice() - prev) / prev;
        }

        double mean = 0;
        for (double r : returns) mean += r;
        mean /= returns.length;

        double variance = 0;
        for (double r : returns) variance += (r - mean) * (r - mean);
        variance /= returns.length;

        double annualized = Math.sqrt(variance) * Math.sqrt(config.historical().getTradingDaysPerYear()) * 100;
        return MetricScorer.round(annualized, 2);
    }

    /**
     * Uptrend needs the period change above its threshold, a rising least-squares slope
     * and enough advancing days. Downtrend mirrors it.
     */
    public PriceTrend detectTrend(HistoricalData data) {
        List<HistoricalDataPoint> points = normalize(data);
        if (points.size() < 2) return PriceTrend.SIDEWAYS;

        double start = first(points);
        double end = last(points);
        double changePct = (end - start) / start * 100;
        double threshold = trendThresholdPct(period(data));
        double slope = slope(points);

        int advances = 0;
        int declines = 0;
        for (int i = 1; i < points.size(); i++) {
            double diff = points.get(i).getPrice() - points.get(i - 1).getPrice();
            if (diff > 0) advances++;
            else if (diff < 0) declines++;
        }
        double breadth = advances + declines > 0 ? (double) advances / (advances + declines) : 0.5;

        AnalyzerConfig.Historical cfg = config.historical();
        PriceTrend trend = PriceTrend.SIDEWAYS;
        if (changePct >= threshold && slope > 0 && breadth >= cfg.getUpBreadth()) {
            trend = PriceTrend.UPTREND;
        } else if (changePct <= -threshold && slope < 0 && breadth <= cfg.getDownBreadth()) {
            trend = PriceTrend.DOWNTREND;
        }

        log.debug("Trend {}: change={}% slope={} breadth={} -> {}",
            data.getTicker(), String.format("%.2f", changePct), slope, breadth, trend);
        return trend;
    }

    /** Valid points only, one per date, oldest first. */
    public List<HistoricalDataPoint> normalize(HistoricalData data) {
        if (data == null || data.getDataPoints() == null) return List.of();

        Map<LocalDate, HistoricalDataPoint> byDate = new TreeMap<>();
        for (HistoricalDataPoint point : data.getDataPoints()) {
            if (point == null || point.getDate() == null) continue;
            Double price = MetricScorer.finite(point.getPrice());
            if (price == null || price <= 0) continue;
            byDate.put(point.getDate(), point);
        }
        return new ArrayList<>(byDate.values());
    }

    static int months(HistoricalPeriod period) {
        return switch (period) {
            case ONE_MONTH -> 1;
            case THREE_MONTHS -> 3;
            case SIX_MONTHS -> 6;
            case ONE_YEAR -> 12;
            case FIVE_YEARS -> 60;
        };
    }

    static double trendThresholdPct(HistoricalPeriod period) {
        return switch (period) {
            case ONE_MONTH -> 3;
            case THREE_MONTHS -> 5;
            case SIX_MONTHS -> 7;
            case ONE_YEAR -> 10;
            case FIVE_YEARS -> 15;
        };
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static HistoricalPeriod period(HistoricalData data) {
        return data.getPeriod() == null ? DEFAULT_PERIOD : data.getPeriod();
    }

    private static double first(List<HistoricalDataPoint> points) {
        return points.get(0).getPrice();
    }

    private static double last(List<HistoricalDataPoint> points) {
        return points.get(points.size() - 1).getPrice();
    }

    /** Ordinary least squares slope of price against point index. */
    private static double slope(List<HistoricalDataPoint> points) {
        int n = points.size();
        double meanX = (n - 1) / 2.0;
        double meanY = 0;
        for (HistoricalDataPoint p : points) meanY += p.getPrice();
        meanY /= n;

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            double x = i - meanX;
            numerator += x * (points.get(i).getPrice() - meanY);
            denominator += x * x;
        }
        return denominator == 0 ? 0 : numerator / denominator;
    }
}
