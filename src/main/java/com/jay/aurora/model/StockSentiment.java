package com.jay.aurora.model;

import com.jay.aurora.model.enums.AnalystConsensus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class StockSentiment {
    AnalystConsensus analystConsensus;
    Double analystTargetMean;
    Double analystTargetHigh;
    Double analystTargetLow;
    @Builder.Default
    List<String> newsThemes = List.of();
}
