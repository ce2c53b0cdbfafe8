package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.layer2_analysis.HistoricalSeriesAnalytics.SeriesReturns;
import com.jay.aurora.model.HistoricalData;
import com.jay.aurora.model.HistoricalDataPoint;
import com.jay.aurora.model.enums.HistoricalPeriod;
import com.jay.aurora.model.enums.PriceTrend;
import com.jay.aurora.util.TestStocks;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HistoricalSeriesAnalyticsTest {

    private final HistoricalSeriesAnalytics analytics = new HistoricalSeriesAnalytics(new AnalyzerConfig());

    private static HistoricalData of(HistoricalPeriod period, double... prices) {
        return TestStocks.series("HIST", period, prices.length, i -> prices[i]);
    }

    @Test
    void calculateReturns_shouldReportPeriodAndAnnualisedReturn() {
        SeriesReturns oneYear = analytics.calculateReturns(of(HistoricalPeriod.ONE_YEAR, 100, 105, 110));
        SeriesReturns sixMonths = analytics.calculateReturns(of(HistoricalPeriod.SIX_MONTHS, 100, 110));

        assertEquals(10.0, oneYear.periodPct(), 1e-9);
        assertEquals(10.0, oneYear.annualizedPct(), 1e-9);
        assertEquals(10.0, sixMonths.periodPct(), 1e-9);
        assertEquals(21.0, sixMonths.annualizedPct(), 1e-9);
    }

    @Test
    void calculateReturns_shouldDefaultToSixMonthsWhenPeriodMissing() {
        HistoricalData data = of(null, 100, 110);

        assertEquals(21.0, analytics.calculateReturns(data).annualizedPct(), 1e-9);
    }

    @Test
    void calculateReturns_shouldReturnZeroForShortSeries() {
        assertEquals(SeriesReturns.ZERO, analytics.calculateReturns(of(HistoricalPeriod.ONE_YEAR, 100)));
        assertEquals(SeriesReturns.ZERO, analytics.calculateReturns(null));
    }

    @Test
    void calculateVolatility_shouldAnnualisePopulationDeviation() {
        assertEquals(0.0, analytics.calculateVolatility(of(HistoricalPeriod.ONE_MONTH, 50, 50, 50, 50)), 1e-9);
        assertEquals(151.53, analytics.calculateVolatility(of(HistoricalPeriod.ONE_MONTH, 100, 110, 100, 110, 100)), 0.011);
    }

    @Test
    void detectTrend_shouldRecogniseSteadyMoves() {
        HistoricalData rising = TestStocks.series("UP", HistoricalPeriod.ONE_YEAR, 100, i -> 100 + i);
        HistoricalData falling = TestStocks.series("DOWN", HistoricalPeriod.ONE_YEAR, 100, i -> 200 - i);
        HistoricalData flat = TestStocks.series("FLAT", HistoricalPeriod.ONE_YEAR, 100, i -> 100);

        assertEquals(PriceTrend.UPTREND, analytics.detectTrend(rising));
        assertEquals(PriceTrend.DOWNTREND, analytics.detectTrend(falling));
        assertEquals(PriceTrend.SIDEWAYS, analytics.detectTrend(flat));
    }

    @Test
    void detectTrend_shouldStaySidewaysBelowPeriodThreshold() {
        // +5% over a year is under the 10% one-year threshold
        HistoricalData drift = TestStocks.series("DRIFT", HistoricalPeriod.ONE_YEAR, 101, i -> 100 + i * 0.05);

        assertEquals(PriceTrend.SIDEWAYS, analytics.detectTrend(drift));
    }

    @Test
    void detectTrend_shouldRejectChoppyRiseWithWeakBreadth() {
        // rises overall, but only a third of the days advance
        HistoricalData choppy = TestStocks.series("CHOP", HistoricalPeriod.ONE_MONTH, 31,
            i -> 100 + i - i % 3 + (i % 3 == 0 ? 0 : 6 - i % 3));

        assertEquals(PriceTrend.SIDEWAYS, analytics.detectTrend(choppy));
    }

    @Test
    void normalize_shouldSortDedupeAndDropInvalidPoints() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        HistoricalData data = HistoricalData.builder()
            .ticker("MESSY")
            .period(HistoricalPeriod.ONE_MONTH)
            .dataPoints(Arrays.asList(
                new HistoricalDataPoint(day.plusDays(2), 12.0, null),
                new HistoricalDataPoint(day, 10.0, null),
                new HistoricalDataPoint(day.plusDays(1), 0.0, null),
                new HistoricalDataPoint(null, 99.0, null),
                new HistoricalDataPoint(day.plusDays(3), Double.NaN, null),
                null,
                new HistoricalDataPoint(day, 11.0, null)))
            .build();

        List<HistoricalDataPoint> points = analytics.normalize(data);

        assertEquals(2, points.size());
        assertEquals(day, points.get(0).getDate());
        assertEquals(11.0, points.get(0).getPrice());
        assertEquals(12.0, points.get(1).getPrice());
    }
}
