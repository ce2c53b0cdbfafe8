package com.jay.aurora.model;

import com.jay.aurora.model.enums.HistoricalPeriod;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Daily price history for a ticker. Points may arrive unsorted or duplicated;
 * the analytics normalise them before use.
 */
@Value
@Builder
public class HistoricalData {
    String ticker;
    HistoricalPeriod period;
    @Builder.Default
    List<HistoricalDataPoint> dataPoints = List.of();
}
