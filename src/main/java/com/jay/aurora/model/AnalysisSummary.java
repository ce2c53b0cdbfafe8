package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnalysisSummary {
    String headlineView;
    int riskScore;              // 1 – 10
    Integer convictionScore3m;  // 0 – 100, null when unknown
    @Builder.Default
    List<String> keyTakeaways = List.of();
}
