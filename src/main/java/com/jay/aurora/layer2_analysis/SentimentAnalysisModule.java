package com.jay.aurora.layer2_analysis;

import com.jay.aurora.config.AnalyzerConfig;
import com.jay.aurora.model.StockData;
import com.jay.aurora.model.StockSentiment;
import com.jay.aurora.model.enums.AnalystConsensus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.jay.aurora.layer2_analysis.MetricScorer.finite;

/**
 * Layer 2 — Sentiment Analysis Module.
 * Analyst consensus, mean target versus last price, and the leading news themes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SentimentAnalysisModule {

    public static final String UNKNOWN = "Unknown";
    static final String NO_ANALYST_DATA = "No analyst data available";
    static final String NO_CONSENSUS = "No consensus";
    static final String NO_NEWS = "No recent news themes available.";
    private static final int MAX_THEMES = 3;

    private final AnalyzerConfig config;

    /** {@code upsidePct} is null when no target or price is known. */
    public record SentimentRead(String consensusText, String targetVsPrice, Double upsidePct, String newsHighlight) {
        public boolean hasTargetGap() {
            return upsidePct != null;
        }
    }

    public SentimentRead analyse(StockData stock) {
        StockSentiment s = stock == null ? null : stock.getSentiment();
        if (s == null) {
            return new SentimentRead(NO_ANALYST_DATA, UNKNOWN, null, NO_NEWS);
        }

        String consensus = s.getAnalystConsensus() == null ? NO_CONSENSUS : consensusLabel(s.getAnalystConsensus());

        Double price = stock.getTechnicals() == null ? null : finite(stock.getTechnicals().getPrice());
        Double target = finite(s.getAnalystTargetMean());
        Double upside = null;
        String targetVsPrice = UNKNOWN;
        if (target != null && target > 0 && price != null && price > 0) {
            upside = (target - price) / price * 100;
            targetVsPrice = describeGap(upside);
        }

        SentimentRead read = new SentimentRead(consensus, targetVsPrice, upside, newsHighlight(s.getNewsThemes()));
        log.debug("Sentiment {}: consensus={} target={}", stock.getTicker(), consensus, targetVsPrice);
        return read;
    }

    public static String consensusLabel(AnalystConsensus consensus) {
        return switch (consensus) {
            case STRONG_BUY -> "Strong Buy";
            case BUY -> "Buy";
            case HOLD -> "Hold";
            case SELL -> "Sell";
            case STRONG_SELL -> "Strong Sell";
        };
    }

    private String describeGap(double upside) {
        double gap = config.sentiment().getTargetGapPct();
        if (upside > gap)  return String.format(Locale.US, "Significant upside (%.1f%%)", upside);
        if (upside < -gap) return String.format(Locale.US, "Downside risk (%.1f%%)", upside);
        return String.format(Locale.US, "Limited upside/downside (%.1f%%)", upside);
    }

    private String newsHighlight(List<String> themes) {
        if (themes == null) return NO_NEWS;
        List<String> top = themes.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(theme -> !theme.isEmpty())
            .limit(MAX_THEMES)
            .toList();
        return top.isEmpty() ? NO_NEWS : String.join(". ", top) + ".";
    }
}
