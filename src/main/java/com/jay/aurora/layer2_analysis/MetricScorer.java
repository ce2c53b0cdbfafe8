package com.jay.aurora.layer2_analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Layer 2 — Metric scoring helpers shared by every analysis module.
 *
 * Two missing-value policies:
 * <ul>
 *   <li>{@link #scorePositiveMetric}/{@link #scoreNegativeMetric} score an unknown value as a neutral 0.5.</li>
 *   <li>{@link #scorePositiveOrZero}/{@link #scoreNegativeOrZero} score an unknown value as 0,
 *       which is what the fundamentals composite uses.</li>
 * </ul>
 */
public final class MetricScorer {

    public static final double NEUTRAL_SCORE = 0.5;
    private static final double MIN_SPREAD = 0.0001;

    private MetricScorer() {}

    /** Higher is better. 1 at or above {@code strong}, 0 at or below {@code weak}, linear in between. */
    public static double scorePositiveMetric(Double value, double strong, double weak) {
        Double v = finite(value);
        if (v == null) return NEUTRAL_SCORE;
        if (v >= strong) return 1;
        if (v <= weak) return 0;
        return (v - weak) / Math.max(strong - weak, MIN_SPREAD);
    }

    /** Lower is better (e.g. debt-to-equity). 1 at or below {@code strong}, 0 at or above {@code weak}. */
    public static double scoreNegativeMetric(Double value, double strong, double weak) {
        Double v = finite(value);
        if (v == null) return NEUTRAL_SCORE;
        if (v <= strong) return 1;
        if (v >= weak) return 0;
        return 1 - (v - strong) / Math.max(weak - strong, MIN_SPREAD);
    }

    public static double scorePositiveOrZero(Double value, double strong, double weak) {
        return finite(value) == null ? 0 : scorePositiveMetric(value, strong, weak);
    }

    public static double scoreNegativeOrZero(Double value, double strong, double weak) {
        return finite(value) == null ? 0 : scoreNegativeMetric(value, strong, weak);
    }

    // ── Numeric helpers ───────────────────────────────────────────────────────

    /** NaN and infinities count as absent. */
    public static Double finite(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) return null;
        return value;
    }

    public static boolean isPresent(Double value) {
        return finite(value) != null;
    }

    /** Rounds a 0-100 score to an int; NaN becomes 0. */
    public static int roundScore(double score) {
        if (Double.isNaN(score)) return 0;
        return (int) Math.max(0, Math.min(100, Math.round(score)));
    }

    /** Half-up decimal rounding; non-finite values become 0. */
    public static double round(double value, int digits) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return 0;
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }

    /** Order-preserving, case-sensitive exact-match dedupe. */
    public static List<String> dedupe(List<String> items) {
        return new ArrayList<>(new LinkedHashSet<>(items));
    }

    public static List<String> dedupe(List<String> items, int limit) {
        List<String> unique = dedupe(items);
        return unique.size() > limit ? new ArrayList<>(unique.subList(0, limit)) : unique;
    }
}
